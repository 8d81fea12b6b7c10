// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ast;

/**
 * Boolean-valued expression that guards a branch. The structuring stage treats conditions as
 * opaque: it only negates them, combines them with {@code &&} and {@code ||}, and prints them.
 *
 * <p>Implementations are immutable values with structural equality.
 */
public interface Condition {

  /** Returns the logical negation of this condition. */
  Condition negated();

  /**
   * Returns the source text of this condition. The result never carries redundant outer
   * parentheses, so it can be written directly into {@code if (...)}.
   */
  String toASTString();

  /**
   * Returns the source text of this condition as an operand of a logical operator. Conditions
   * that could bind weaker than the operator are wrapped in parentheses.
   */
  default String toParenthesizedASTString() {
    return toASTString();
  }
}
