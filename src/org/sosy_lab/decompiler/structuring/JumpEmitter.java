// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import java.util.Optional;
import org.sosy_lab.decompiler.flowgraph.FlowNode;
import org.sosy_lab.decompiler.flowgraph.ReturnNode;
import org.sosy_lab.decompiler.structuring.statements.Body;
import org.sosy_lab.decompiler.structuring.statements.LabelStatement;
import org.sosy_lab.decompiler.structuring.statements.SimpleStatement;

/** Writes gotos and returns, shared by structured and naive output. */
final class JumpEmitter {

  private JumpEmitter() {}

  /** Append a goto to the label of {@code pTarget}, making that label visible. */
  static void emitGoto(StructuringContext pContext, FlowNode pTarget, Body pBody, int pIndent) {
    pContext.addGotoNode(pTarget);
    pBody.addStatement(
        new SimpleStatement(pIndent, "goto " + LabelStatement.labelFor(pTarget) + ";"));
  }

  /**
   * Append the contents of a return node and the return statement.
   *
   * @param pLast whether this is the return at the very end of the function, which needs a label
   *     for gotos and no {@code return;} without value
   */
  static void writeReturn(
      StructuringContext pContext, Body pBody, ReturnNode pNode, int pIndent, boolean pLast) {
    if (pLast) {
      pBody.addStatement(new LabelStatement(pNode, pContext.getGotoNodes()));
    }
    pBody.addNode(pNode, pIndent, pNode.isReal());

    Optional<String> returnValue = pNode.getReturnValue();
    if (returnValue.isPresent()) {
      pBody.addStatement(new SimpleStatement(pIndent, "return " + returnValue.orElseThrow() + ";"));
      pContext.setReturnsValue();
    } else if (!pLast) {
      pBody.addStatement(new SimpleStatement(pIndent, "return;"));
    }
  }
}
