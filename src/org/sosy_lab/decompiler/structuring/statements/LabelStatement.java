// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.statements;

import com.google.common.base.Preconditions;
import java.util.Set;
import org.sosy_lab.decompiler.flowgraph.FlowNode;

/**
 * Label in front of the contents of a node. Labels are placed for every emitted node, but only
 * written if something jumps to the node. The set of jump targets is still growing while labels
 * are placed, so it is consulted at render time.
 */
public final class LabelStatement implements Statement {

  private final FlowNode node;
  private final Set<FlowNode> gotoTargets;

  public LabelStatement(FlowNode pNode, Set<FlowNode> pGotoTargets) {
    node = Preconditions.checkNotNull(pNode);
    gotoTargets = Preconditions.checkNotNull(pGotoTargets);
  }

  public FlowNode getNode() {
    return node;
  }

  public static String labelFor(FlowNode pNode) {
    return "block_" + pNode.getIndex();
  }

  @Override
  public boolean shouldWrite() {
    return gotoTargets.contains(node);
  }

  @Override
  public String toString() {
    return labelFor(node) + ":";
  }
}
