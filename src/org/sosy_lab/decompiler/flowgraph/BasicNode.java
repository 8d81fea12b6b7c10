// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Node with exactly one successor. */
public final class BasicNode extends FlowNode {

  private @Nullable FlowNode successor;

  BasicNode(Block pBlock) {
    super(pBlock);
  }

  void setSuccessor(FlowNode pSuccessor) {
    checkState(successor == null, "successor of %s already set", this);
    successor = pSuccessor;
  }

  public FlowNode getSuccessor() {
    checkState(successor != null, "%s is not linked", this);
    return successor;
  }

  /** An unconditional jump back to an earlier block, e.g. the end of an endless loop. */
  public boolean isLoop() {
    return getSuccessor().getIndex() <= getIndex();
  }

  @Override
  public ImmutableList<FlowNode> getSuccessors() {
    return ImmutableList.of(getSuccessor());
  }

  @Override
  public ImmutableList<FlowNode> getForwardSuccessors() {
    return isLoop() ? ImmutableList.of() : getSuccessors();
  }

  @Override
  public <R, X extends Exception> R accept(FlowNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
