// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Preconditions;
import java.util.List;
import org.sosy_lab.decompiler.flowgraph.BasicNode;
import org.sosy_lab.decompiler.flowgraph.ConditionalNode;
import org.sosy_lab.decompiler.flowgraph.FlowNode;
import org.sosy_lab.decompiler.flowgraph.FlowNodeVisitor;
import org.sosy_lab.decompiler.flowgraph.ReturnNode;
import org.sosy_lab.decompiler.structuring.statements.Body;
import org.sosy_lab.decompiler.structuring.statements.IfElseStatement;
import org.sosy_lab.decompiler.structuring.statements.LabelStatement;

/**
 * Writes a function in the order of the original code with gotos as only control flow. Used if
 * structuring is disabled or failed.
 */
final class NaiveStructurer implements FlowNodeVisitor<Void, RuntimeException> {

  private final StructuringContext context;
  private final List<FlowNode> nodes;
  private final Body body;
  private final int indent;
  private int currentIndex;

  private NaiveStructurer(StructuringContext pContext, List<FlowNode> pNodes, int pIndent) {
    context = Preconditions.checkNotNull(pContext);
    nodes = Preconditions.checkNotNull(pNodes);
    body = new Body(pContext.getOptions().printNodeComments());
    indent = pIndent;
  }

  /** Write the given nodes, which are expected in the order of the original code. */
  static Body build(StructuringContext pContext, List<FlowNode> pNodes, int pIndent) {
    NaiveStructurer structurer = new NaiveStructurer(pContext, pNodes, pIndent);
    for (int i = 0; i < pNodes.size(); i++) {
      structurer.currentIndex = i;
      pNodes.get(i).accept(structurer);
    }
    return structurer.body;
  }

  private void emitNode(FlowNode pNode) {
    context.markEmitted(pNode);
    body.addStatement(new LabelStatement(pNode, context.getGotoNodes()));
    body.addNode(pNode, indent, true);
  }

  /**
   * Copies of the return point do not have a well-defined position in the code, so they are
   * written wherever they are jumped to.
   */
  private boolean maybeEmitReturn(FlowNode pTarget, Body pBody, int pIndent) {
    if (!(pTarget instanceof ReturnNode) || ((ReturnNode) pTarget).isReal()) {
      return false;
    }
    JumpEmitter.writeReturn(context, pBody, (ReturnNode) pTarget, pIndent, false);
    return true;
  }

  private boolean isFallthroughTo(FlowNode pTarget) {
    int next = currentIndex + 1;
    if (next >= nodes.size() || nodes.get(next) != pTarget) {
      return false;
    }
    // the real return point is written at the end, after all other nodes
    return !(pTarget instanceof ReturnNode) || next == nodes.size() - 1;
  }

  private void emitSuccessor(FlowNode pSuccessor) {
    if (maybeEmitReturn(pSuccessor, body, indent) || isFallthroughTo(pSuccessor)) {
      return;
    }
    JumpEmitter.emitGoto(context, pSuccessor, body, indent);
  }

  @Override
  public Void visit(BasicNode pNode) {
    emitNode(pNode);
    emitSuccessor(pNode.getSuccessor());
    return null;
  }

  @Override
  public Void visit(ConditionalNode pNode) {
    emitNode(pNode);
    Body ifBody = new Body(false);
    if (!maybeEmitReturn(pNode.getConditionalEdge(), ifBody, indent + 4)) {
      JumpEmitter.emitGoto(context, pNode.getConditionalEdge(), ifBody, indent + 4);
    }
    body.addIfElse(new IfElseStatement(pNode.getBranchCondition(), indent, ifBody, null));
    emitSuccessor(pNode.getFallthroughEdge());
    return null;
  }

  @Override
  public Void visit(ReturnNode pNode) {
    // written where they are jumped to, see maybeEmitReturn
    return null;
  }
}
