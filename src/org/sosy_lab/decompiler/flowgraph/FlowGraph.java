// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import com.google.common.base.Preconditions;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Immutable flow graph of one function, with nodes in the order of the original code. */
public final class FlowGraph {

  private final ImmutableList<FlowNode> nodes;

  FlowGraph(ImmutableList<FlowNode> pNodes) {
    Preconditions.checkArgument(!pNodes.isEmpty(), "flow graph without nodes");
    nodes = pNodes;
  }

  /** All nodes, sorted by index. Nodes unreachable from the entry are included. */
  public ImmutableList<FlowNode> getNodes() {
    return nodes;
  }

  public FlowNode getEntryNode() {
    return nodes.get(0);
  }

  /** The real return node of the function, if it has one. */
  public Optional<ReturnNode> getReturnNode() {
    return FluentIterable.from(nodes)
        .filter(ReturnNode.class)
        .firstMatch(ReturnNode::isReal)
        .toJavaUtil();
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return "flow graph with " + nodes.size() + " nodes, entry " + getEntryNode();
  }
}
