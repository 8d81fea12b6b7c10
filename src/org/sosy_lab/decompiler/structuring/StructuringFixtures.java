// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.ConfigurationBuilder;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.ast.ComparisonCondition;
import org.sosy_lab.decompiler.ast.ComparisonCondition.ComparisonOperator;
import org.sosy_lab.decompiler.ast.Condition;
import org.sosy_lab.decompiler.ast.SimpleCondition;
import org.sosy_lab.decompiler.flowgraph.Block;
import org.sosy_lab.decompiler.flowgraph.FlowGraph;
import org.sosy_lab.decompiler.flowgraph.FlowGraphBuilder;
import org.sosy_lab.decompiler.flowgraph.FlowNode;

/** Flow graphs of small functions shared by the structuring tests. */
final class StructuringFixtures {

  private StructuringFixtures() {}

  static Condition cond(String pExpression) {
    return new SimpleCondition(pExpression);
  }

  static Condition isZero(String pVariable) {
    return new ComparisonCondition(pVariable, ComparisonOperator.EQUALS, "0");
  }

  static Condition isNonZero(String pVariable) {
    return new ComparisonCondition(pVariable, ComparisonOperator.NOT_EQUALS, "0");
  }

  /** Options given as pairs of name and value, e.g. {@code "structuring.debug", "true"}. */
  static StructuringOptions options(String... pOptions) throws InvalidConfigurationException {
    ConfigurationBuilder builder = Configuration.builder();
    for (int i = 0; i + 1 < pOptions.length; i += 2) {
      builder.setOption(pOptions[i], pOptions[i + 1]);
    }
    return new StructuringOptions(builder.build());
  }

  static StructuringContext context(FlowGraph pGraph, String... pOptions)
      throws InvalidConfigurationException {
    return new StructuringContext(
        pGraph, options(pOptions), LogManager.createTestLogManager(), "s32");
  }

  static FunctionInfo function(String pName, FlowGraph pGraph) {
    return new FunctionInfo(pName, "s32", ImmutableList.of(), ImmutableList.of(), pGraph);
  }

  static FlowNode node(FlowGraph pGraph, int pIndex) {
    for (FlowNode node : pGraph.getNodes()) {
      if (node.getIndex() == pIndex) {
        return node;
      }
    }
    throw new AssertionError("no node " + pIndex);
  }

  /** {@code x = 0; if (a) { y = 2; } else { y = 1; } return y;} */
  static FlowGraph diamond() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, cond("a"), "x = 0;"), 1, 2)
        .addBasicNode(Block.of(1, "y = 1;"), 3)
        .addBasicNode(Block.of(2, "y = 2;"), 3)
        .addReturnNode(Block.returning(3, "y"))
        .build();
  }

  /** {@code if (a && b) { body(); } else { other(); }} */
  static FlowGraph andChain() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, isZero("a")), 1, 3)
        .addConditionalNode(Block.branching(1, isZero("b")), 2, 3)
        .addBasicNode(Block.of(2, "body();"), 4)
        .addBasicNode(Block.of(3, "other();"), 4)
        .addReturnNode(Block.returning(4, null))
        .build();
  }

  /** {@code if (a || b) { body(); } else { other(); }} */
  static FlowGraph orChain() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, isNonZero("a")), 1, 2)
        .addConditionalNode(Block.branching(1, isZero("b")), 2, 3)
        .addBasicNode(Block.of(2, "body();"), 4)
        .addBasicNode(Block.of(3, "other();"), 4)
        .addReturnNode(Block.returning(4, null))
        .build();
  }

  /** {@code i = 0; do { i++; } while (i < 10); return i;} */
  static FlowGraph doWhileLoop() {
    return new FlowGraphBuilder()
        .addBasicNode(Block.of(0, "i = 0;"), 1)
        .addBasicNode(Block.of(1, "i++;"), 2)
        .addConditionalNode(
            Block.branching(2, new ComparisonCondition("i", ComparisonOperator.LESS_THAN, "10")),
            3,
            1)
        .addReturnNode(Block.returning(3, "i"))
        .build();
  }

  /** {@code if (a != 0) { return 0; } x = 1; return x;} with a copy of the return point. */
  static FlowGraph earlyReturn() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, isZero("a")), 1, 2)
        .addDuplicateReturnNode(Block.returning(1, "0"))
        .addBasicNode(Block.of(2, "x = 1;"), 3)
        .addReturnNode(Block.returning(3, "x"))
        .build();
  }

  /** Endless loop without any return. */
  static FlowGraph endlessLoop() {
    return new FlowGraphBuilder()
        .addBasicNode(Block.of(0, "i = 0;"), 1)
        .addBasicNode(Block.of(1, "i++;"), 1)
        .build();
  }

  /** Branches that meet in an endless loop, so the function never returns. */
  static FlowGraph diamondIntoEndlessLoop() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, cond("a")), 1, 2)
        .addBasicNode(Block.of(1, "x();"), 3)
        .addBasicNode(Block.of(2, "y();"), 3)
        .addBasicNode(Block.of(3, "z();"), 3)
        .build();
  }

  /**
   * The taken target of node 0 has two parents that both skip it, but node 1 is no conditional,
   * so no &&/|| chain starts at node 0.
   */
  static FlowGraph brokenChain() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, cond("a")), 1, 3)
        .addBasicNode(Block.of(1, "x = 1;"), 2)
        .addConditionalNode(Block.branching(2, cond("b")), 4, 3)
        .addBasicNode(Block.of(3, "y = 2;"), 4)
        .addReturnNode(Block.returning(4, null))
        .build();
  }

  /** Node 3 is the immediate postdominator of its parent 1 but not of its parent 2. */
  static FlowGraph mixedParents() {
    return new FlowGraphBuilder()
        .addConditionalNode(Block.branching(0, cond("a")), 1, 2)
        .addBasicNode(Block.of(1, "x = 1;"), 3)
        .addConditionalNode(Block.branching(2, cond("b")), 3, 4)
        .addBasicNode(Block.of(3, "y = 2;"), 4)
        .addReturnNode(Block.returning(4, null))
        .build();
  }
}
