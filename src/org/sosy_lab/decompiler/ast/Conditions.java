// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ast;

import org.sosy_lab.decompiler.ast.BinaryCondition.LogicalOperator;

/** Factory methods for combining conditions. */
public final class Conditions {

  private Conditions() {}

  public static Condition and(Condition pFirst, Condition pSecond) {
    return new BinaryCondition(pFirst, LogicalOperator.AND, pSecond);
  }

  public static Condition or(Condition pFirst, Condition pSecond) {
    return new BinaryCondition(pFirst, LogicalOperator.OR, pSecond);
  }

  public static Condition combine(
      Condition pFirst, LogicalOperator pOperator, Condition pSecond) {
    return new BinaryCondition(pFirst, pOperator, pSecond);
  }
}
