// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.statements;

/** Statement of the structured output. {@link #toString()} renders it at its own indentation. */
public interface Statement {

  /** Whether this statement appears in the rendered output at all. */
  boolean shouldWrite();
}
