// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ast;

import com.google.common.base.Preconditions;

/** Logical negation of a condition that has no cheaper negated form. */
public final class NegatedCondition implements Condition {

  private final Condition operand;

  public NegatedCondition(Condition pOperand) {
    operand = Preconditions.checkNotNull(pOperand);
  }

  public Condition getOperand() {
    return operand;
  }

  @Override
  public Condition negated() {
    return operand;
  }

  @Override
  public String toASTString() {
    if (operand instanceof SimpleCondition) {
      return "!" + operand.toParenthesizedASTString();
    }
    return "!(" + operand.toASTString() + ")";
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof NegatedCondition && operand.equals(((NegatedCondition) pObj).operand);
  }

  @Override
  public int hashCode() {
    return 31 * operand.hashCode() + 7;
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
