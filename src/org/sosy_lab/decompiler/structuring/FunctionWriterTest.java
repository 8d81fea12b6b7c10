// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.sosy_lab.decompiler.structuring.StructuringFixtures.function;
import static org.sosy_lab.decompiler.structuring.StructuringFixtures.options;

import com.google.common.base.Joiner;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.FileOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.converters.FileTypeConverter;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.flowgraph.Block;
import org.sosy_lab.decompiler.flowgraph.FlowGraph;
import org.sosy_lab.decompiler.flowgraph.FlowGraphBuilder;
import org.sosy_lab.decompiler.flowgraph.FlowNode;

public class FunctionWriterTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private static FunctionWriter writer(String... pOptions) throws InvalidConfigurationException {
    return new FunctionWriter(options(pOptions), LogManager.createTestLogManager());
  }

  private static String lines(String... pLines) {
    return Joiner.on('\n').join(pLines) + "\n";
  }

  @Test
  public void testDefaultConfiguration() throws InvalidConfigurationException {
    FunctionWriter functionWriter =
        new FunctionWriter(Configuration.defaultConfiguration(), LogManager.createTestLogManager());

    StructuredFunction result =
        functionWriter.structure(function("f", StructuringFixtures.diamond()));
    assertThat(result.isStructured()).isTrue();
  }

  @Test
  public void testDiamond() throws Exception {
    StructuredFunction result = writer().structure(function("test", StructuringFixtures.diamond()));

    assertThat(result.isVoid()).isFalse();
    assertThat(result.isStructured()).isTrue();
    assertThat(result.toString())
        .isEqualTo(
            lines(
                "s32 test(void)",
                "{",
                "    x = 0;",
                "    if (!a)",
                "    {",
                "        y = 1;",
                "    }",
                "    else",
                "    {",
                "        y = 2;",
                "    }",
                "    return y;",
                "}"));
  }

  @Test
  public void testVoidFunctionHasNoTrailingReturn() throws Exception {
    StructuredFunction result =
        writer().structure(function("test", StructuringFixtures.andChain()));

    assertThat(result.isVoid()).isTrue();
    assertThat(result.toString())
        .isEqualTo(
            lines(
                "void test(void)",
                "{",
                "    if ((a != 0) && (b != 0))",
                "    {",
                "        body();",
                "    }",
                "    else",
                "    {",
                "        other();",
                "    }",
                "}"));
  }

  @Test
  public void testSentinelOnly() throws Exception {
    StructuredFunction result =
        writer().structure(function("spin", StructuringFixtures.endlessLoop()));

    assertThat(result.isVoid()).isTrue();
    assertThat(result.toString())
        .isEqualTo(
            lines(
                "void spin(void)",
                "{",
                "    i = 0;",
                "block_1:",
                "    i++;",
                "    goto block_1;",
                "}"));
    assertThat(result.toString()).doesNotContain("return");
  }

  @Test
  public void testSignatureAndDeclarations() throws Exception {
    FunctionInfo info =
        new FunctionInfo(
            "loop",
            "s32",
            ImmutableList.of("s32 arg0", "s32 *arg1"),
            ImmutableList.of("s32 i;"),
            StructuringFixtures.doWhileLoop());
    StringBuilder out = new StringBuilder();
    writer().write(info, out);

    assertThat(out.toString())
        .isEqualTo(
            lines(
                "s32 loop(s32 arg0, s32 *arg1)",
                "{",
                "    s32 i;",
                "",
                "    i = 0;",
                "block_1:",
                "    i++;",
                "    if (i < 10)",
                "    {",
                "        goto block_1;",
                "    }",
                "    return i;",
                "}"));
    assertThat(writer().structure(info).hasDeclarations()).isTrue();
  }

  @Test
  public void testFallbackToGotos() throws Exception {
    StructuredFunction result =
        writer().structure(function("test", StructuringFixtures.brokenChain()));

    assertThat(result.isStructured()).isFalse();
    assertThat(result.toString())
        .isEqualTo(
            lines(
                "void test(void)",
                "{",
                "    if (a)",
                "    {",
                "        goto block_3;",
                "    }",
                "    x = 1;",
                "    if (b)",
                "    {",
                "        goto block_3;",
                "    }",
                "    goto block_4;",
                "block_3:",
                "    y = 2;",
                "block_4:",
                "}"));
  }

  @Test
  public void testWithoutStructuring() throws Exception {
    StructuredFunction result =
        writer("structuring.ifs", "false")
            .structure(function("test", StructuringFixtures.diamond()));

    assertThat(result.isStructured()).isFalse();
    assertThat(result.toString())
        .isEqualTo(
            lines(
                "s32 test(void)",
                "{",
                "    x = 0;",
                "    if (a)",
                "    {",
                "        goto block_2;",
                "    }",
                "    y = 1;",
                "    goto block_3;",
                "block_2:",
                "    y = 2;",
                "block_3:",
                "    return y;",
                "}"));
  }

  @Test
  public void testNodeCommentsOnReturn() throws Exception {
    String code =
        writer("structuring.debug", "true")
            .structure(function("test", StructuringFixtures.earlyReturn()))
            .toString();

    // the copied return point is empty and gets no comment, the real one does
    assertThat(code).doesNotContain("// Node 1");
    assertThat(code).contains("    // Node 3\n    return x;");
  }

  @Test
  public void testExportFlowGraph() throws Exception {
    Configuration config =
        Configuration.builder()
            .setOption("output.path", tmp.getRoot().toString())
            .setOption("structuring.exportFlowGraphDir", "graphs")
            .build();
    Configuration withOutputPath =
        Configuration.builder()
            .copyFrom(config)
            .addConverter(FileOption.class, FileTypeConverter.create(config))
            .build();

    StructuringOptions options = new StructuringOptions(withOutputPath);
    new FunctionWriter(options, LogManager.createTestLogManager())
        .structure(function("f", StructuringFixtures.diamond()));

    Path dotFile = tmp.getRoot().toPath().resolve("graphs").resolve("fg__f.dot");
    assertThat(Files.exists(dotFile)).isTrue();
    assertThat(new String(Files.readAllBytes(dotFile), StandardCharsets.UTF_8))
        .startsWith("digraph flow_graph_of_f_function {\n0 [shape=diamond ");
  }

  @Test
  public void testMalformedGraphIsFatal() {
    assertThrows(
        VerifyException.class,
        () ->
            new FlowGraphBuilder()
                .addReturnNode(Block.returning(0, null))
                .addReturnNode(Block.returning(1, null))
                .build());
  }

  @Test
  public void testEveryNodeWrittenOnce() throws Exception {
    ImmutableList<FlowGraph> graphs =
        ImmutableList.of(
            StructuringFixtures.diamond(),
            StructuringFixtures.andChain(),
            StructuringFixtures.orChain(),
            StructuringFixtures.doWhileLoop(),
            StructuringFixtures.earlyReturn(),
            StructuringFixtures.endlessLoop(),
            StructuringFixtures.diamondIntoEndlessLoop(),
            StructuringFixtures.brokenChain(),
            StructuringFixtures.mixedParents());

    for (String andor : ImmutableList.of("true", "false")) {
      for (String ifs : ImmutableList.of("true", "false")) {
        FunctionWriter functionWriter =
            writer("structuring.andorDetection", andor, "structuring.ifs", ifs);
        for (FlowGraph graph : graphs) {
          String code = functionWriter.structure(function("test", graph)).toString();
          for (FlowNode node : graph.getNodes()) {
            for (String statement : node.getBlock().getStatements()) {
              assertThat(count(code, statement)).isEqualTo(1);
            }
          }
        }
      }
    }
  }

  private static int count(String pText, String pPart) {
    Matcher matcher = Pattern.compile(Pattern.quote(pPart)).matcher(pText);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
