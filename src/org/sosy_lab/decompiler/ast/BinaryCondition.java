// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ast;

import com.google.common.base.Preconditions;
import java.util.Objects;

/** Two conditions joined by {@code &&} or {@code ||}. */
public final class BinaryCondition implements Condition {

  public enum LogicalOperator {
    AND("&&"),
    OR("||");

    private final String op;

    LogicalOperator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }

    public LogicalOperator getDual() {
      return this == AND ? OR : AND;
    }
  }

  private final Condition operand1;
  private final LogicalOperator operator;
  private final Condition operand2;

  public BinaryCondition(Condition pOperand1, LogicalOperator pOperator, Condition pOperand2) {
    operand1 = Preconditions.checkNotNull(pOperand1);
    operator = Preconditions.checkNotNull(pOperator);
    operand2 = Preconditions.checkNotNull(pOperand2);
  }

  public Condition getOperand1() {
    return operand1;
  }

  public LogicalOperator getOperator() {
    return operator;
  }

  public Condition getOperand2() {
    return operand2;
  }

  /** De Morgan: {@code !(a && b)} becomes {@code !a || !b}. */
  @Override
  public Condition negated() {
    return new BinaryCondition(operand1.negated(), operator.getDual(), operand2.negated());
  }

  @Override
  public String toASTString() {
    return formatOperand(operand1) + " " + operator.getOperator() + " " + formatOperand(operand2);
  }

  @Override
  public String toParenthesizedASTString() {
    return "(" + toASTString() + ")";
  }

  // left-nested chains of the same operator need no parentheses
  private String formatOperand(Condition pOperand) {
    if (pOperand instanceof BinaryCondition
        && ((BinaryCondition) pOperand).operator == operator) {
      return pOperand.toASTString();
    }
    return pOperand.toParenthesizedASTString();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BinaryCondition)) {
      return false;
    }
    BinaryCondition other = (BinaryCondition) pObj;
    return operand1.equals(other.operand1)
        && operator == other.operator
        && operand2.equals(other.operand2);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operand1, operator, operand2);
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
