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
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ast.Condition;

/**
 * Basic block of the disassembled function, already translated into statements. The index
 * reflects the order of the block in the original code and is unique within one function.
 */
public final class Block {

  private final int index;
  private final ImmutableList<String> statements;
  private final @Nullable Condition branchCondition;
  private final @Nullable String returnValue;

  public Block(
      int pIndex,
      ImmutableList<String> pStatements,
      @Nullable Condition pBranchCondition,
      @Nullable String pReturnValue) {
    index = pIndex;
    statements = Preconditions.checkNotNull(pStatements);
    branchCondition = pBranchCondition;
    returnValue = pReturnValue;
  }

  /** A block that ends without a branch. */
  public static Block of(int pIndex, String... pStatements) {
    return new Block(pIndex, ImmutableList.copyOf(pStatements), null, null);
  }

  /** A block that ends with a conditional branch taken if {@code pCondition} holds. */
  public static Block branching(int pIndex, Condition pCondition, String... pStatements) {
    return new Block(
        pIndex, ImmutableList.copyOf(pStatements), Preconditions.checkNotNull(pCondition), null);
  }

  /** A block that ends the function, optionally returning {@code pValue}. */
  public static Block returning(int pIndex, @Nullable String pValue, String... pStatements) {
    return new Block(pIndex, ImmutableList.copyOf(pStatements), null, pValue);
  }

  public int getIndex() {
    return index;
  }

  /** Pre-rendered statements of this block, in order. */
  public ImmutableList<String> getStatements() {
    return statements;
  }

  public Optional<Condition> getBranchCondition() {
    return Optional.ofNullable(branchCondition);
  }

  public Optional<String> getReturnValue() {
    return Optional.ofNullable(returnValue);
  }

  @Override
  public String toString() {
    return "block " + index;
  }
}
