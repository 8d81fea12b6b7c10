// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Node that leaves the function.
 *
 * <p>A function has at most one <i>real</i> return node, the return point of the original code.
 * Early returns may be copies of it that are not real. A graph without any real return node is
 * given a {@link #sentinel()} as end of the whole function.
 */
public final class ReturnNode extends FlowNode {

  static final int SENTINEL_INDEX = -1;

  private final boolean real;

  ReturnNode(Block pBlock, boolean pReal) {
    super(pBlock);
    real = pReal;
  }

  /** Creates the synthetic end node for a function without return. It is not part of any graph. */
  public static ReturnNode sentinel() {
    return new ReturnNode(Block.of(SENTINEL_INDEX), false);
  }

  public boolean isReal() {
    return real;
  }

  public boolean isSentinel() {
    return getIndex() == SENTINEL_INDEX;
  }

  public Optional<String> getReturnValue() {
    return getBlock().getReturnValue();
  }

  @Override
  public ImmutableList<FlowNode> getSuccessors() {
    return ImmutableList.of();
  }

  @Override
  public ImmutableList<FlowNode> getForwardSuccessors() {
    return ImmutableList.of();
  }

  @Override
  public <R, X extends Exception> R accept(FlowNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
