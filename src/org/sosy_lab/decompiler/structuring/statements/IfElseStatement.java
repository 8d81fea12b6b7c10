// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.statements;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ast.Condition;

/** {@code if (condition) { ifBody } else { elseBody }}, the else part being optional. */
public final class IfElseStatement implements Statement {

  private final Condition condition;
  private final int indent;
  private final Body ifBody;
  private final @Nullable Body elseBody;

  public IfElseStatement(
      Condition pCondition, int pIndent, Body pIfBody, @Nullable Body pElseBody) {
    condition = Preconditions.checkNotNull(pCondition);
    indent = pIndent;
    ifBody = Preconditions.checkNotNull(pIfBody);
    elseBody = pElseBody;
  }

  public Condition getCondition() {
    return condition;
  }

  public int getIndent() {
    return indent;
  }

  public Body getIfBody() {
    return ifBody;
  }

  public Optional<Body> getElseBody() {
    return Optional.ofNullable(elseBody);
  }

  @Override
  public boolean shouldWrite() {
    return true;
  }

  @Override
  public String toString() {
    String space = Strings.repeat(" ", indent);
    // bodies carry their own indentation
    String result =
        Joiner.on('\n')
            .join(
                space + "if (" + condition.toASTString() + ")",
                space + "{",
                ifBody,
                space + "}");
    if (elseBody != null) {
      result += "\n" + Joiner.on('\n').join(space + "else", space + "{", elseBody, space + "}");
    }
    return result;
  }
}
