// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.VerifyException;
import org.junit.Test;
import org.sosy_lab.decompiler.ast.Condition;
import org.sosy_lab.decompiler.ast.SimpleCondition;

public class FlowGraphBuilderTest {

  private static final Condition COND = new SimpleCondition("c");

  @Test
  public void testLinking() {
    FlowGraph graph =
        new FlowGraphBuilder()
            .addReturnNode(Block.returning(3, "v0"))
            .addBasicNode(Block.of(2, "x = 2;"), 3)
            .addBasicNode(Block.of(1, "x = 1;"), 3)
            .addConditionalNode(Block.branching(0, COND), 1, 2)
            .build();

    assertThat(graph.size()).isEqualTo(4);
    ConditionalNode entry = (ConditionalNode) graph.getEntryNode();
    assertThat(entry.getIndex()).isEqualTo(0);
    assertThat(entry.getFallthroughEdge()).isSameInstanceAs(graph.getNodes().get(1));
    assertThat(entry.getConditionalEdge()).isSameInstanceAs(graph.getNodes().get(2));
    assertThat(entry.isLoop()).isFalse();
    assertThat(entry.getBranchCondition()).isEqualTo(COND);

    FlowNode exit = graph.getNodes().get(3);
    assertThat(exit.getParents())
        .containsExactly(graph.getNodes().get(1), graph.getNodes().get(2))
        .inOrder();
    assertThat(graph.getReturnNode().orElseThrow()).isSameInstanceAs(exit);
    assertThat(((ReturnNode) exit).getReturnValue().orElseThrow()).isEqualTo("v0");
  }

  @Test
  public void testBackwardEdges() {
    FlowGraph graph =
        new FlowGraphBuilder()
            .addBasicNode(Block.of(0), 1)
            .addConditionalNode(Block.branching(1, COND), 2, 0)
            .addBasicNode(Block.of(2), 2)
            .build();

    ConditionalNode loopHead = (ConditionalNode) graph.getNodes().get(1);
    assertThat(loopHead.isLoop()).isTrue();
    assertThat(loopHead.getForwardSuccessors()).containsExactly(graph.getNodes().get(2));
    BasicNode selfLoop = (BasicNode) graph.getNodes().get(2);
    assertThat(selfLoop.isLoop()).isTrue();
    assertThat(selfLoop.getForwardSuccessors()).isEmpty();
    assertThat(selfLoop.getParents()).containsExactly(loopHead, selfLoop);
    assertThat(graph.getReturnNode().isPresent()).isFalse();
  }

  @Test
  public void testSentinel() {
    ReturnNode sentinel = ReturnNode.sentinel();
    assertThat(sentinel.isSentinel()).isTrue();
    assertThat(sentinel.isReal()).isFalse();
    assertThat(sentinel.getReturnValue().isPresent()).isFalse();
  }

  @Test
  public void testDuplicateIndex() {
    FlowGraphBuilder builder = new FlowGraphBuilder().addBasicNode(Block.of(0), 1);
    assertThrows(IllegalArgumentException.class, () -> builder.addReturnNode(Block.of(0)));
  }

  @Test
  public void testNegativeIndex() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new FlowGraphBuilder().addReturnNode(Block.returning(-1, null)));
  }

  @Test
  public void testUnknownTarget() {
    FlowGraphBuilder builder = new FlowGraphBuilder().addBasicNode(Block.of(0), 7);
    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  public void testConditionalWithoutCondition() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new FlowGraphBuilder().addConditionalNode(Block.of(0), 1, 2));
  }

  @Test
  public void testBackwardFallthrough() {
    FlowGraphBuilder builder =
        new FlowGraphBuilder()
            .addReturnNode(Block.of(0))
            .addConditionalNode(Block.branching(1, COND), 0, 2)
            .addReturnNode(Block.of(2));
    assertThrows(VerifyException.class, builder::build);
  }

  @Test
  public void testSameTargetTwice() {
    FlowGraphBuilder builder =
        new FlowGraphBuilder()
            .addConditionalNode(Block.branching(0, COND), 1, 1)
            .addReturnNode(Block.of(1));
    assertThrows(VerifyException.class, builder::build);
  }

  @Test
  public void testTwoRealReturns() {
    FlowGraphBuilder builder =
        new FlowGraphBuilder()
            .addConditionalNode(Block.branching(0, COND), 1, 2)
            .addReturnNode(Block.of(1))
            .addReturnNode(Block.of(2));
    assertThrows(VerifyException.class, builder::build);
  }

  @Test
  public void testBuildOnlyOnce() {
    FlowGraphBuilder builder = new FlowGraphBuilder().addReturnNode(Block.of(0));
    builder.build();
    assertThrows(IllegalStateException.class, builder::build);
  }
}
