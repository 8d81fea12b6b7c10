// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import static com.google.common.base.Verify.verify;

import com.google.common.base.Joiner;
import com.google.common.base.VerifyException;
import com.google.common.collect.FluentIterable;
import java.util.HashSet;
import java.util.Set;

public class FlowGraphCheck {

  private FlowGraphCheck() {}

  /**
   * Run a series of checks at each node of the flow graph.
   *
   * @param pGraph the graph of one function
   * @return true if all checks succeed
   * @throws VerifyException if not all checks succeed
   */
  public static boolean check(FlowGraph pGraph) throws VerifyException {
    Set<Integer> seenIndices = new HashSet<>();
    for (FlowNode node : pGraph.getNodes()) {
      verify(seenIndices.add(node.getIndex()), "Duplicate index at node %s", debugFormat(node));
      isConsistentAsGraphNode(node);
      node.accept(KIND_CHECKER);
    }

    int realReturns =
        FluentIterable.from(pGraph.getNodes())
            .filter(ReturnNode.class)
            .filter(ReturnNode::isReal)
            .size();
    verify(realReturns <= 1, "Function has %s real return nodes", realReturns);
    return true;
  }

  /**
   * This method returns a lazy object where {@link Object#toString} can be called. In most cases we
   * do not need to build the String, thus we can avoid some overhead here.
   */
  private static Object debugFormat(FlowNode node) {
    return new Object() {
      @Override
      public String toString() {
        return node
            + " with parents ["
            + Joiner.on(", ").join(node.getParents())
            + "] and successors ["
            + Joiner.on(", ").join(node.getSuccessors())
            + "]";
      }
    };
  }

  /**
   * Check that every successor knows this node as parent and every parent has this node as
   * successor.
   *
   * @param pNode Node to be checked
   */
  private static void isConsistentAsGraphNode(FlowNode pNode) {
    for (FlowNode successor : pNode.getSuccessors()) {
      verify(
          successor.getParents().contains(pNode),
          "Node %s has successor %s, but %s does not have it as parent!",
          debugFormat(pNode),
          successor,
          successor);
    }

    Set<FlowNode> seenParents = new HashSet<>();
    for (FlowNode parent : pNode.getParents()) {
      verify(
          seenParents.add(parent), "Duplicate parent %s for node %s", parent, debugFormat(pNode));
      verify(
          parent.getSuccessors().contains(pNode),
          "Node %s has parent %s, but %s does not have it as successor!",
          debugFormat(pNode),
          parent,
          parent);
    }
  }

  private static final FlowNodeVisitor<Void, VerifyException> KIND_CHECKER =
      new FlowNodeVisitor<>() {
        @Override
        public Void visit(BasicNode pNode) {
          return null;
        }

        @Override
        public Void visit(ConditionalNode pNode) {
          verify(
              pNode.getFallthroughEdge() != pNode.getConditionalEdge(),
              "Both edges of %s lead to the same node",
              debugFormat(pNode));
          verify(
              pNode.getFallthroughEdge().getIndex() > pNode.getIndex(),
              "Fallthrough edge of %s points backwards",
              debugFormat(pNode));
          return null;
        }

        @Override
        public Void visit(ReturnNode pNode) {
          verify(
              pNode.getBlock().getBranchCondition().isEmpty(),
              "Return node %s has a branch condition",
              debugFormat(pNode));
          return null;
        }
      };
}
