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
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ast.Condition;

/**
 * Node ending with a conditional branch. If the branch condition holds, control goes to the
 * conditional edge, otherwise it falls through to the next block.
 */
public final class ConditionalNode extends FlowNode {

  private @Nullable FlowNode fallthroughEdge;
  private @Nullable FlowNode conditionalEdge;

  ConditionalNode(Block pBlock) {
    super(pBlock);
    checkArgument(pBlock.getBranchCondition().isPresent(), "%s has no branch condition", pBlock);
  }

  void setEdges(FlowNode pFallthrough, FlowNode pConditional) {
    checkState(fallthroughEdge == null, "edges of %s already set", this);
    fallthroughEdge = pFallthrough;
    conditionalEdge = pConditional;
  }

  public FlowNode getFallthroughEdge() {
    checkState(fallthroughEdge != null, "%s is not linked", this);
    return fallthroughEdge;
  }

  /** Target of the branch if the condition holds. */
  public FlowNode getConditionalEdge() {
    checkState(conditionalEdge != null, "%s is not linked", this);
    return conditionalEdge;
  }

  public Condition getBranchCondition() {
    return getBlock().getBranchCondition().orElseThrow();
  }

  /** Whether the branch jumps backwards, i.e. this node closes a loop. */
  public boolean isLoop() {
    return getConditionalEdge().getIndex() <= getIndex();
  }

  @Override
  public ImmutableList<FlowNode> getSuccessors() {
    return ImmutableList.of(getFallthroughEdge(), getConditionalEdge());
  }

  @Override
  public ImmutableList<FlowNode> getForwardSuccessors() {
    return isLoop() ? ImmutableList.of(getFallthroughEdge()) : getSuccessors();
  }

  @Override
  public <R, X extends Exception> R accept(FlowNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
