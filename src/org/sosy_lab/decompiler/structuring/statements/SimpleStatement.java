// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.statements;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/** Pre-rendered line of code, e.g. an assignment, a comment, a goto or a return. */
public final class SimpleStatement implements Statement {

  private final int indent;
  private final String contents;

  public SimpleStatement(int pIndent, String pContents) {
    Preconditions.checkArgument(pIndent >= 0);
    indent = pIndent;
    contents = Preconditions.checkNotNull(pContents);
  }

  public int getIndent() {
    return indent;
  }

  public String getContents() {
    return contents;
  }

  @Override
  public boolean shouldWrite() {
    return true;
  }

  @Override
  public String toString() {
    return Strings.repeat(" ", indent) + contents;
  }
}
