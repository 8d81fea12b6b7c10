// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/** Opaque condition given by its expression text, e.g. a variable or a function call. */
public final class SimpleCondition implements Condition {

  private static final CharMatcher WORD =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_$."));

  private final String expression;

  public SimpleCondition(String pExpression) {
    checkArgument(!Strings.isNullOrEmpty(pExpression), "empty condition");
    expression = pExpression;
  }

  public String getExpression() {
    return expression;
  }

  @Override
  public Condition negated() {
    return new NegatedCondition(this);
  }

  @Override
  public String toASTString() {
    return expression;
  }

  @Override
  public String toParenthesizedASTString() {
    return isSingleOperand() ? expression : "(" + expression + ")";
  }

  /**
   * Whether the expression text is an identifier, a literal, a call or already parenthesized, so
   * that no operator inside it can bind to its surroundings.
   */
  boolean isSingleOperand() {
    int pos = 0;
    while (pos < expression.length() && WORD.matches(expression.charAt(pos))) {
      pos++;
    }
    if (pos == expression.length()) {
      return pos > 0;
    }
    return expression.charAt(pos) == '(' && closingParenthesis(pos) == expression.length() - 1;
  }

  private int closingParenthesis(int pOpen) {
    int depth = 0;
    for (int i = pOpen; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof SimpleCondition
        && expression.equals(((SimpleCondition) pObj).expression);
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
