// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;
import static org.sosy_lab.decompiler.structuring.StructuringFixtures.context;
import static org.sosy_lab.decompiler.structuring.StructuringFixtures.node;

import com.google.common.base.Joiner;
import org.junit.Test;
import org.sosy_lab.decompiler.flowgraph.ConditionalNode;
import org.sosy_lab.decompiler.flowgraph.FlowGraph;
import org.sosy_lab.decompiler.flowgraph.ReturnNode;
import org.sosy_lab.decompiler.structuring.statements.IfElseStatement;

public class FlowGraphStructurerTest {

  private static String lines(String... pLines) {
    return Joiner.on('\n').join(pLines);
  }

  @Test
  public void testDiamondWritesFallthroughFirst() throws Exception {
    FlowGraph graph = StructuringFixtures.diamond();
    FlowGraphStructurer structurer = new FlowGraphStructurer(context(graph));

    IfElseStatement statement =
        structurer.buildConditionalSubgraph(
            (ConditionalNode) node(graph, 0), node(graph, 3), 4);

    assertThat(statement.getCondition().toASTString()).isEqualTo("!a");
    assertThat(statement.getIfBody().toString()).isEqualTo("        y = 1;");
    assertThat(statement.getElseBody().orElseThrow().toString()).isEqualTo("        y = 2;");
  }

  @Test
  public void testDiamond() throws Exception {
    FlowGraph graph = StructuringFixtures.diamond();

    assertThat(
            new FlowGraphStructurer(context(graph))
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 3), 4)
                .toString())
        .isEqualTo(
            lines(
                "    x = 0;",
                "    if (!a)",
                "    {",
                "        y = 1;",
                "    }",
                "    else",
                "    {",
                "        y = 2;",
                "    }"));
  }

  @Test
  public void testLoopHeadJumpsBack() throws Exception {
    FlowGraph graph = StructuringFixtures.doWhileLoop();
    StructuringContext context = context(graph);
    FlowGraphStructurer structurer = new FlowGraphStructurer(context);

    IfElseStatement statement =
        structurer.buildConditionalSubgraph(
            (ConditionalNode) node(graph, 2), node(graph, 3), 4);

    assertThat(statement.getCondition().toASTString()).isEqualTo("i < 10");
    assertThat(statement.getIfBody().toString()).isEqualTo("        goto block_1;");
    assertThat(statement.getElseBody().isPresent()).isFalse();
    // the loop body was not entered
    assertThat(context.isEmitted(node(graph, 1))).isFalse();
    assertThat(context.getGotoNodes()).containsExactly(node(graph, 1));
  }

  @Test
  public void testLoop() throws Exception {
    FlowGraph graph = StructuringFixtures.doWhileLoop();

    assertThat(
            new FlowGraphStructurer(context(graph))
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 3), 4)
                .toString())
        .isEqualTo(
            lines(
                "    i = 0;",
                "block_1:",
                "    i++;",
                "    if (i < 10)",
                "    {",
                "        goto block_1;",
                "    }"));
  }

  @Test
  public void testEarlyReturn() throws Exception {
    FlowGraph graph = StructuringFixtures.earlyReturn();
    StructuringContext context = context(graph);

    assertThat(
            new FlowGraphStructurer(context)
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 3), 4)
                .toString())
        .isEqualTo(
            lines(
                "    if (a != 0)",
                "    {",
                "        return 0;",
                "    }",
                "    x = 1;"));
    assertThat(context.isVoid()).isFalse();
  }

  @Test
  public void testAndChain() throws Exception {
    FlowGraph graph = StructuringFixtures.andChain();

    assertThat(
            new FlowGraphStructurer(context(graph))
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 4), 4)
                .toString())
        .isEqualTo(
            lines(
                "    if ((a != 0) && (b != 0))",
                "    {",
                "        body();",
                "    }",
                "    else",
                "    {",
                "        other();",
                "    }"));
  }

  @Test
  public void testAndChainWithoutDetection() throws Exception {
    FlowGraph graph = StructuringFixtures.andChain();

    assertThat(
            new FlowGraphStructurer(context(graph, "structuring.andorDetection", "false"))
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 4), 4)
                .toString())
        .isEqualTo(
            lines(
                "    if (a != 0)",
                "    {",
                "        if (b != 0)",
                "        {",
                "            body();",
                "        }",
                "        else",
                "        {",
                "block_3:",
                "            other();",
                "        }",
                "    }",
                "    else",
                "    {",
                "        goto block_3;",
                "    }"));
  }

  @Test
  public void testSecondVisitBecomesGoto() throws Exception {
    FlowGraph graph = StructuringFixtures.mixedParents();

    assertThat(
            new FlowGraphStructurer(context(graph))
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 4), 4)
                .toString())
        .isEqualTo(
            lines(
                "    if (!a)",
                "    {",
                "        x = 1;",
                "block_3:",
                "        y = 2;",
                "    }",
                "    else",
                "    {",
                "        if (!b)",
                "        {",
                "            goto block_3;",
                "        }",
                "    }"));
  }

  @Test
  public void testEndlessLoopWithSentinel() throws Exception {
    FlowGraph graph = StructuringFixtures.diamondIntoEndlessLoop();

    assertThat(
            new FlowGraphStructurer(context(graph))
                .buildFlowGraphBetween(graph.getEntryNode(), ReturnNode.sentinel(), 4)
                .toString())
        .isEqualTo(
            lines(
                "    if (!a)",
                "    {",
                "        x();",
                "    }",
                "    else",
                "    {",
                "        y();",
                "    }",
                "block_3:",
                "    z();",
                "    goto block_3;"));
  }

  @Test
  public void testNodeComments() throws Exception {
    FlowGraph graph = StructuringFixtures.diamond();

    assertThat(
            new FlowGraphStructurer(context(graph, "structuring.debug", "true"))
                .buildFlowGraphBetween(graph.getEntryNode(), node(graph, 3), 4)
                .toString())
        .isEqualTo(
            lines(
                "    // Node 0",
                "    x = 0;",
                "    if (!a)",
                "    {",
                "        // Node 1",
                "        y = 1;",
                "    }",
                "    else",
                "    {",
                "        // Node 2",
                "        y = 2;",
                "    }"));
  }
}
