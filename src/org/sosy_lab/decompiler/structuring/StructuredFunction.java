// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.io.IOException;
import org.sosy_lab.decompiler.structuring.statements.Body;
import org.sosy_lab.decompiler.structuring.statements.SimpleStatement;

/** Result of structuring one function, ready to be written as C code. */
public final class StructuredFunction {

  private static final int DECLARATION_INDENT = 4;

  private final FunctionInfo function;
  private final Body body;
  private final String returnType;
  private final boolean isVoid;
  private final boolean structured;

  StructuredFunction(
      FunctionInfo pFunction,
      Body pBody,
      String pReturnType,
      boolean pIsVoid,
      boolean pStructured) {
    function = Preconditions.checkNotNull(pFunction);
    body = Preconditions.checkNotNull(pBody);
    returnType = Preconditions.checkNotNull(pReturnType);
    isVoid = pIsVoid;
    structured = pStructured;
  }

  public FunctionInfo getFunction() {
    return function;
  }

  public Body getBody() {
    return body;
  }

  /** Whether no return of the function has a value. */
  public boolean isVoid() {
    return isVoid;
  }

  public boolean hasDeclarations() {
    return !function.getDeclarations().isEmpty();
  }

  /** False if the body was written with gotos only. */
  public boolean isStructured() {
    return structured;
  }

  public String getSignature() {
    String arguments =
        function.getArguments().isEmpty() ? "void" : Joiner.on(", ").join(function.getArguments());
    return (isVoid ? "void" : returnType) + " " + function.getName() + "(" + arguments + ")";
  }

  public void writeTo(Appendable pOut) throws IOException {
    pOut.append(getSignature()).append("\n{\n");
    for (String declaration : function.getDeclarations()) {
      pOut.append(new SimpleStatement(DECLARATION_INDENT, declaration).toString()).append('\n');
    }
    if (hasDeclarations()) {
      pOut.append('\n');
    }
    String code = body.toString();
    if (!code.isEmpty()) {
      pOut.append(code).append('\n');
    }
    pOut.append("}\n");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    try {
      writeTo(sb);
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw", e);
    }
    return sb.toString();
  }
}
