// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.statements;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.sosy_lab.decompiler.flowgraph.FlowNode;

/** Ordered sequence of statements at one nesting level. */
public final class Body {

  private final boolean printNodeComment;
  private final List<Statement> statements = new ArrayList<>();

  public Body(boolean pPrintNodeComment) {
    printNodeComment = pPrintNodeComment;
  }

  /**
   * Append the contents of a node. With node comments enabled, a {@code // Node <name>} comment
   * precedes them if the node has contents or {@code pCommentEmpty} is set.
   */
  public void addNode(FlowNode pNode, int pIndent, boolean pCommentEmpty) {
    List<String> toWrite = pNode.getBlock().getStatements();
    if (printNodeComment && (!toWrite.isEmpty() || pCommentEmpty)) {
      addComment(pIndent, "Node " + pNode.getName());
    }
    for (String item : toWrite) {
      statements.add(new SimpleStatement(pIndent, item));
    }
  }

  public void addStatement(Statement pStatement) {
    statements.add(pStatement);
  }

  public void addComment(int pIndent, String pContents) {
    addStatement(new SimpleStatement(pIndent, "// " + pContents));
  }

  public void addIfElse(IfElseStatement pIfElse) {
    statements.add(pIfElse);
  }

  public List<Statement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  @Override
  public String toString() {
    return Joiner.on('\n').join(FluentIterable.from(statements).filter(Statement::shouldWrite));
  }
}
