// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the flow graph of one function. Every node wraps exactly one {@link Block}; nodes are
 * ordered by the index of their block, which is the order of the original code.
 *
 * <p>The hierarchy is closed: the only subclasses are {@link BasicNode}, {@link ConditionalNode}
 * and {@link ReturnNode}.
 */
public abstract class FlowNode implements Comparable<FlowNode> {

  private final Block block;
  private final List<FlowNode> parents = new ArrayList<>();

  FlowNode(Block pBlock) {
    block = Preconditions.checkNotNull(pBlock);
  }

  public Block getBlock() {
    return block;
  }

  public int getIndex() {
    return block.getIndex();
  }

  /** Nodes with an edge to this node, including the sources of backward edges. */
  public List<FlowNode> getParents() {
    return Collections.unmodifiableList(parents);
  }

  void addParent(FlowNode pParent) {
    if (!parents.contains(pParent)) {
      parents.add(pParent);
    }
  }

  /** All successors, in the order fallthrough before taken. */
  public abstract ImmutableList<FlowNode> getSuccessors();

  /**
   * Successors reachable without following a backward edge. Traversals over these edges always
   * terminate, because the index strictly grows along them.
   */
  public abstract ImmutableList<FlowNode> getForwardSuccessors();

  public abstract <R, X extends Exception> R accept(FlowNodeVisitor<R, X> pVisitor) throws X;

  /** Short name used in debug comments. */
  public String getName() {
    return String.valueOf(getIndex());
  }

  @Override
  public int compareTo(FlowNode pOther) {
    return Integer.compare(getIndex(), pOther.getIndex());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " " + getName();
  }
}
