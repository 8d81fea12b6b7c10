// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Creates a {@link FlowGraph} from blocks and the indices of their successors. Edges may refer to
 * blocks that are added later; they are resolved in {@link #build()}.
 */
public final class FlowGraphBuilder {

  private final NavigableMap<Integer, FlowNode> nodes = new TreeMap<>();
  private final Map<BasicNode, Integer> basicEdges = new HashMap<>();
  private final Map<ConditionalNode, int[]> conditionalEdges = new HashMap<>();
  private boolean built = false;

  public FlowGraphBuilder addBasicNode(Block pBlock, int pSuccessor) {
    BasicNode node = new BasicNode(pBlock);
    add(node);
    basicEdges.put(node, pSuccessor);
    return this;
  }

  /**
   * Adds a node that continues at {@code pFallthrough} and jumps to {@code pConditional} if the
   * branch condition of the block holds.
   */
  public FlowGraphBuilder addConditionalNode(Block pBlock, int pFallthrough, int pConditional) {
    ConditionalNode node = new ConditionalNode(pBlock);
    add(node);
    conditionalEdges.put(node, new int[] {pFallthrough, pConditional});
    return this;
  }

  public FlowGraphBuilder addReturnNode(Block pBlock) {
    add(new ReturnNode(pBlock, true));
    return this;
  }

  /** Adds a copy of the return point, as produced for early returns. */
  public FlowGraphBuilder addDuplicateReturnNode(Block pBlock) {
    add(new ReturnNode(pBlock, false));
    return this;
  }

  private void add(FlowNode pNode) {
    checkState(!built, "graph already built");
    checkArgument(pNode.getIndex() >= 0, "negative block index %s", pNode.getIndex());
    FlowNode previous = nodes.putIfAbsent(pNode.getIndex(), pNode);
    checkArgument(previous == null, "duplicate block index %s", pNode.getIndex());
  }

  private FlowNode resolve(FlowNode pFrom, int pIndex) {
    FlowNode target = nodes.get(pIndex);
    checkArgument(target != null, "%s has edge to unknown block %s", pFrom, pIndex);
    target.addParent(pFrom);
    return target;
  }

  /**
   * Links all nodes and checks the resulting graph.
   *
   * @throws IllegalArgumentException if an edge points to a block that was never added
   * @throws com.google.common.base.VerifyException if the graph is inconsistent
   */
  public FlowGraph build() {
    checkState(!built, "graph already built");
    built = true;

    for (FlowNode node : nodes.values()) {
      if (node instanceof BasicNode) {
        BasicNode basic = (BasicNode) node;
        basic.setSuccessor(resolve(basic, basicEdges.get(basic)));
      } else if (node instanceof ConditionalNode) {
        ConditionalNode conditional = (ConditionalNode) node;
        int[] edges = conditionalEdges.get(conditional);
        conditional.setEdges(resolve(conditional, edges[0]), resolve(conditional, edges[1]));
      }
    }

    FlowGraph graph = new FlowGraph(ImmutableList.copyOf(nodes.values()));
    FlowGraphCheck.check(graph);
    return graph;
  }
}
