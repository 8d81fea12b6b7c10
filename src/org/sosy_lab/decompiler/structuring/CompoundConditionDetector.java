// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ast.BinaryCondition.LogicalOperator;
import org.sosy_lab.decompiler.ast.Condition;
import org.sosy_lab.decompiler.ast.Conditions;
import org.sosy_lab.decompiler.flowgraph.ConditionalNode;
import org.sosy_lab.decompiler.flowgraph.FlowNode;
import org.sosy_lab.decompiler.structuring.statements.Body;
import org.sosy_lab.decompiler.structuring.statements.IfElseStatement;

/**
 * Detects chains of conditional nodes that together encode one condition of the form {@code c1
 * && c2 && ... && ck} or {@code c1 || c2 || ... || ck}.
 */
final class CompoundConditionDetector {

  /** Structures the region between two nodes, used for the bodies of a compound if. */
  @FunctionalInterface
  interface RegionBuilder {
    Body build(FlowNode pStart, FlowNode pEnd, int pIndent) throws StructuringFailedException;
  }

  private final StructuringContext context;
  private final Postdominators postdominators;
  private final RegionBuilder regionBuilder;

  CompoundConditionDetector(
      StructuringContext pContext, Postdominators pPostdominators, RegionBuilder pRegionBuilder) {
    context = Preconditions.checkNotNull(pContext);
    postdominators = Preconditions.checkNotNull(pPostdominators);
    regionBuilder = Preconditions.checkNotNull(pRegionBuilder);
  }

  /**
   * Return the number of parents of {@code pChild} for whom it is NOT their immediate
   * postdominator. Such nodes would be written more than once by naive structuring, which is what
   * happens for the clauses of a condition with {@code &&} or {@code ||}.
   *
   * <p>Ideally either all parents are immediately postdominated by the child or none is. If that
   * does not hold, a warning is logged once and the count is used anyway.
   */
  int countNonPostdominatedParents(FlowNode pChild, FlowNode pCurrentEnd) {
    int count = 0;
    for (FlowNode parent : pChild.getParents()) {
      // a backward jump without condition has no forward region to postdominate
      if (parent.getForwardSuccessors().isEmpty()
          || postdominators.immediatePostdominator(parent, pCurrentEnd) != pChild) {
        count++;
      }
    }
    if (count != 0 && count != pChild.getParents().size()) {
      context.getLogger().log(Level.FINE, "Parents of", pChild, "disagree on postdominance");
      context.warnAboutConfusingControlFlow();
    }
    return count;
  }

  /**
   * Return k if the branch at {@code pNode} is the first of k clauses {@code c1 && ... && ck} or
   * {@code c1 || ... || ck}. A result below 2 means a plain if-statement.
   */
  int getNumberOfIfConditions(ConditionalNode pNode, FlowNode pCurrentEnd) {
    if (!context.getOptions().detectAndOr()) {
      return 1;
    }

    int count1 = countNonPostdominatedParents(pNode.getConditionalEdge(), pCurrentEnd);
    int count2 = countNonPostdominatedParents(pNode.getFallthroughEdge(), pCurrentEnd);

    // the clauses go through the path with the nonzero count
    // TODO check against known decompilations whether count2 alone is sufficient
    if (count1 != 0) {
      return count1;
    }
    return count2;
  }

  /**
   * Join conditions with the given operator, left to right. Every condition is negated, or only
   * the last one if {@code pOnlyNegateLast} is set.
   */
  static Condition joinConditions(
      List<Condition> pConditions, LogicalOperator pOperator, boolean pOnlyNegateLast) {
    Preconditions.checkArgument(!pConditions.isEmpty(), "no conditions to join");
    @Nullable Condition result = null;
    for (int i = 0; i < pConditions.size(); i++) {
      Condition condition = pConditions.get(i);
      if (!pOnlyNegateLast || i == pConditions.size() - 1) {
        condition = condition.negated();
      }
      result = result == null ? condition : Conditions.combine(result, pOperator, condition);
    }
    return result;
  }

  /**
   * Build the if-statement for a chain of {@code pCount} conditional nodes, starting at {@code
   * pStart} and following fallthrough edges.
   *
   * @throws StructuringFailedException if a node of the chain has no condition
   */
  IfElseStatement buildCompoundIf(
      int pCount, ConditionalNode pStart, FlowNode pCurrentEnd, int pIndent)
      throws StructuringFailedException {
    FlowNode currentNode = pStart;
    ConditionalNode previousNode = null;
    List<Condition> conditions = new ArrayList<>(pCount);

    for (int remaining = pCount; remaining > 0; remaining--) {
      if (!(currentNode instanceof ConditionalNode)) {
        throw new StructuringFailedException(
            "Complex control flow; node "
                + currentNode.getName()
                + " assumed to be part of &&/|| wasn't. Run with structuring.andorDetection=false"
                + " to disable detection of &&/|| and try again.");
      }
      previousNode = (ConditionalNode) currentNode;
      conditions.add(previousNode.getBranchCondition());
      currentNode = previousNode.getFallthroughEdge();
    }
    Preconditions.checkArgument(previousNode != null, "empty chain at %s", pStart);

    if (currentNode == pStart.getConditionalEdge()) {
      // ending at the target of the first jump means this is ||: if the first condition held,
      // we would have jumped ahead to the body already.
      // The last condition must jump over the body instead of to it, hence it is negated.
      return new IfElseStatement(
          joinConditions(conditions, LogicalOperator.OR, true),
          pIndent,
          regionBuilder.build(pStart.getConditionalEdge(), pCurrentEnd, pIndent + 4),
          regionBuilder.build(previousNode.getConditionalEdge(), pCurrentEnd, pIndent + 4));
    }

    // otherwise it is &&, every conditional edge jumps over the body
    return new IfElseStatement(
        joinConditions(conditions, LogicalOperator.AND, false),
        pIndent,
        regionBuilder.build(currentNode, pCurrentEnd, pIndent + 4),
        regionBuilder.build(pStart.getConditionalEdge(), pCurrentEnd, pIndent + 4));
  }
}
