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

/** Comparison of two expressions. Negation flips the operator instead of adding a {@code !}. */
public final class ComparisonCondition implements Condition {

  public enum ComparisonOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    GREATER_EQUAL(">="),
    GREATER_THAN(">"),
    LESS_EQUAL("<=");

    private final String op;

    ComparisonOperator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }

    public ComparisonOperator getOppositeLogicalOperator() {
      switch (this) {
        case EQUALS:
          return NOT_EQUALS;
        case NOT_EQUALS:
          return EQUALS;
        case LESS_THAN:
          return GREATER_EQUAL;
        case GREATER_EQUAL:
          return LESS_THAN;
        case GREATER_THAN:
          return LESS_EQUAL;
        case LESS_EQUAL:
          return GREATER_THAN;
        default:
          throw new AssertionError("unhandled operator " + this);
      }
    }
  }

  private final String operand1;
  private final ComparisonOperator operator;
  private final String operand2;

  public ComparisonCondition(String pOperand1, ComparisonOperator pOperator, String pOperand2) {
    operand1 = Preconditions.checkNotNull(pOperand1);
    operator = Preconditions.checkNotNull(pOperator);
    operand2 = Preconditions.checkNotNull(pOperand2);
  }

  public String getOperand1() {
    return operand1;
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public String getOperand2() {
    return operand2;
  }

  @Override
  public Condition negated() {
    return new ComparisonCondition(operand1, operator.getOppositeLogicalOperator(), operand2);
  }

  @Override
  public String toASTString() {
    return operand1 + " " + operator.getOperator() + " " + operand2;
  }

  @Override
  public String toParenthesizedASTString() {
    return "(" + toASTString() + ")";
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof ComparisonCondition)) {
      return false;
    }
    ComparisonCondition other = (ComparisonCondition) pObj;
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
