// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Preconditions;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ast.Condition;
import org.sosy_lab.decompiler.flowgraph.BasicNode;
import org.sosy_lab.decompiler.flowgraph.ConditionalNode;
import org.sosy_lab.decompiler.flowgraph.FlowNode;
import org.sosy_lab.decompiler.flowgraph.FlowNodeVisitor;
import org.sosy_lab.decompiler.flowgraph.ReturnNode;
import org.sosy_lab.decompiler.structuring.statements.Body;
import org.sosy_lab.decompiler.structuring.statements.IfElseStatement;
import org.sosy_lab.decompiler.structuring.statements.LabelStatement;

/**
 * Recovers nested if/else statements from the flow graph of one function.
 *
 * <p>A region between two nodes is split at articulation nodes, i.e. immediate postdominators,
 * into sub-regions at the same level of indentation. Each conditional node opens an if-statement
 * that spans the region up to its immediate postdominator. The contents of every node are written
 * at most once; if a node is reached a second time, a goto to its first occurrence is written.
 */
final class FlowGraphStructurer {

  private final StructuringContext context;
  private final Postdominators postdominators;
  private final CompoundConditionDetector compoundConditions;

  FlowGraphStructurer(StructuringContext pContext) {
    context = Preconditions.checkNotNull(pContext);
    postdominators = new Postdominators(pContext);
    compoundConditions =
        new CompoundConditionDetector(pContext, postdominators, this::buildFlowGraphBetween);
  }

  /**
   * Write all nodes from {@code pStart} (inclusive) to {@code pEnd} (exclusive) at the given
   * indentation, with if/else statements for the conditional nodes.
   *
   * @throws StructuringFailedException if the graph cannot be structured
   */
  Body buildFlowGraphBetween(FlowNode pStart, FlowNode pEnd, int pIndent)
      throws StructuringFailedException {
    Body body = new Body(context.getOptions().printNodeComments());
    ArticulationStep step = new ArticulationStep(body, pEnd, pIndent);

    FlowNode current = pStart;
    while (current != null && current != pEnd) {
      current = current.accept(step);
    }
    return body;
  }

  /**
   * Handles one articulation node and returns the next one, or null if the region ends here.
   */
  private class ArticulationStep
      implements FlowNodeVisitor<@Nullable FlowNode, StructuringFailedException> {

    private final Body body;
    private final FlowNode end;
    private final int indent;

    ArticulationStep(Body pBody, FlowNode pEnd, int pIndent) {
      body = pBody;
      end = pEnd;
      indent = pIndent;
    }

    /**
     * Write the contents of a node, or a goto if they were written before.
     *
     * @return false if a goto was written instead
     */
    private boolean writeNode(FlowNode pNode) {
      // Nodes are positions in the original code, so jumping to the first occurrence is
      // equivalent to repeating it. This happens when early returns, continues or || are not
      // detected properly.
      if (!context.markEmitted(pNode)) {
        JumpEmitter.emitGoto(context, pNode, body, indent);
        return false;
      }
      // only written if something jumps here, e.g. loops
      body.addStatement(new LabelStatement(pNode, context.getGotoNodes()));
      body.addNode(pNode, indent, true);
      return true;
    }

    @Override
    public @Nullable FlowNode visit(BasicNode pNode) {
      if (!writeNode(pNode)) {
        return null;
      }
      return pNode.getSuccessor();
    }

    @Override
    public @Nullable FlowNode visit(ConditionalNode pNode) throws StructuringFailedException {
      if (!writeNode(pNode)) {
        return null;
      }
      FlowNode regionEnd = postdominators.immediatePostdominator(pNode, end);
      context.getLogger().log(Level.ALL, "Region of", pNode, "ends at", regionEnd);
      body.addIfElse(buildConditionalSubgraph(pNode, regionEnd, indent));
      return regionEnd;
    }

    @Override
    public @Nullable FlowNode visit(ReturnNode pNode) {
      JumpEmitter.writeReturn(context, body, pNode, indent, false);
      return null;
    }
  }

  /**
   * Build the if-statement for the region from the conditional node {@code pStart} to {@code
   * pEnd}. Detects conditions joined by && or || if enabled.
   *
   * @throws StructuringFailedException if the graph cannot be structured
   */
  IfElseStatement buildConditionalSubgraph(ConditionalNode pStart, FlowNode pEnd, int pIndent)
      throws StructuringFailedException {
    Condition branchCondition = pStart.getBranchCondition();

    // If one edge leads to the end, there is no else-branch; the if-statement contains the other.
    if (pStart.getConditionalEdge() == pEnd) {
      return new IfElseStatement(
          branchCondition.negated(),
          pIndent,
          buildFlowGraphBetween(pStart.getFallthroughEdge(), pEnd, pIndent + 4),
          null);
    }

    if (pStart.getFallthroughEdge() == pEnd) {
      Body ifBody;
      if (!pStart.isLoop()) {
        // happens if the other branch returns early
        ifBody = buildFlowGraphBetween(pStart.getConditionalEdge(), pEnd, pIndent + 4);
      } else {
        // following the loop would trap us here, so jump to its beginning
        ifBody = new Body(false);
        JumpEmitter.emitGoto(context, pStart.getConditionalEdge(), ifBody, pIndent + 4);
      }
      return new IfElseStatement(branchCondition, pIndent, ifBody, null);
    }

    int conditions = compoundConditions.getNumberOfIfConditions(pStart, pEnd);
    if (conditions >= 2) {
      return compoundConditions.buildCompoundIf(conditions, pStart, pEnd, pIndent);
    }

    // Both branches are present. They are written in the order of the original code, where the
    // fallthrough branch always comes first.
    return new IfElseStatement(
        branchCondition.negated(),
        pIndent,
        buildFlowGraphBetween(pStart.getFallthroughEdge(), pEnd, pIndent + 4),
        buildFlowGraphBetween(pStart.getConditionalEdge(), pEnd, pIndent + 4));
  }
}
