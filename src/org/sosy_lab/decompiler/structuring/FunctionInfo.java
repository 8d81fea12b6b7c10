// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.sosy_lab.decompiler.flowgraph.FlowGraph;

/**
 * Everything about a function that earlier stages of the decompiler determined: its signature,
 * the declarations of its local variables and its translated flow graph.
 */
public final class FunctionInfo {

  private final String name;
  private final String returnType;
  private final ImmutableList<String> arguments;
  private final ImmutableList<String> declarations;
  private final FlowGraph flowGraph;

  /**
   * @param pName the name of the function
   * @param pReturnType the declared return type, used if some return has a value
   * @param pArguments declarations of the arguments, e.g. {@code s32 arg0}
   * @param pDeclarations declarations of local variables, e.g. {@code s32 sp1C;}
   * @param pFlowGraph the flow graph with translated statements
   */
  public FunctionInfo(
      String pName,
      String pReturnType,
      ImmutableList<String> pArguments,
      ImmutableList<String> pDeclarations,
      FlowGraph pFlowGraph) {
    name = Preconditions.checkNotNull(pName);
    returnType = Preconditions.checkNotNull(pReturnType);
    arguments = Preconditions.checkNotNull(pArguments);
    declarations = Preconditions.checkNotNull(pDeclarations);
    flowGraph = Preconditions.checkNotNull(pFlowGraph);
  }

  public String getName() {
    return name;
  }

  public String getReturnType() {
    return returnType;
  }

  public ImmutableList<String> getArguments() {
    return arguments;
  }

  public ImmutableList<String> getDeclarations() {
    return declarations;
  }

  public FlowGraph getFlowGraph() {
    return flowGraph;
  }

  @Override
  public String toString() {
    return "function " + name;
  }
}
