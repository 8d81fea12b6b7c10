// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

import com.google.common.base.Preconditions;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;

/** This Writer can dump the flow graph of a function into a file. */
public class FlowGraphToDotWriter {

  private final FlowGraph graph;
  private final String functionName;

  public FlowGraphToDotWriter(FlowGraph pGraph, String pFunctionName) {
    graph = Preconditions.checkNotNull(pGraph);
    functionName = Preconditions.checkNotNull(pFunctionName);
  }

  /** dump the flow graph into {@code fg__<function>.dot} in the given directory. */
  public void dump(final Path pDir, LogManager pLogger) {
    Path graphFile = pDir.resolve("fg__" + functionName + ".dot");

    try {
      MoreFiles.createParentDirectories(graphFile);
    } catch (IOException e) {
      pLogger.logUserException(
          Level.WARNING, e, "Could not create parent directories to write flow graph");
      return;
    }

    try (Writer w = Files.newBufferedWriter(graphFile, StandardCharsets.UTF_8)) {
      dump(w);
    } catch (IOException e) {
      pLogger.logUserException(Level.WARNING, e, "Could not write flow graph to dot file");
      // ignore exception and continue structuring
    }
  }

  /** dump the flow graph with shaped nodes. */
  public void dump(final Appendable app) throws IOException {
    app.append("digraph flow_graph_of_" + functionName + "_function {\n");

    // we have to dump edges after the nodes, otherwise Dot places nodes by first mention
    for (FlowNode node : graph.getNodes()) {
      app.append(formatNode(node));
    }
    for (FlowNode node : graph.getNodes()) {
      node.accept(new EdgeFormatter(app));
    }

    app.append("}");
  }

  private static String formatNode(FlowNode node) {
    String shape = "";
    if (node instanceof ConditionalNode) {
      shape =
          ((ConditionalNode) node).isLoop() ? "shape=doubleoctagon " : "shape=diamond ";
    } else if (node instanceof ReturnNode) {
      shape = ((ReturnNode) node).isReal() ? "shape=doublecircle " : "shape=circle ";
    }

    String label = "label=\"N" + node.getIndex() + "\\n" + node.getBlock().getStatements().size();
    if (node instanceof ConditionalNode) {
      label += "\\n" + escape(((ConditionalNode) node).getBranchCondition().toASTString());
    }
    return node.getIndex() + " [" + shape + label + "\"]\n";
  }

  private static String escape(String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static String formatEdge(FlowNode from, FlowNode to, String label) {
    StringBuilder sb = new StringBuilder();
    sb.append(from.getIndex());
    sb.append(" -> ");
    sb.append(to.getIndex());
    sb.append(" [label=\"");
    sb.append(label);
    sb.append("\"");
    if (to.getIndex() <= from.getIndex()) {
      sb.append(" style=\"dashed\"");
    }
    sb.append("]\n");
    return sb.toString();
  }

  private static class EdgeFormatter implements FlowNodeVisitor<Void, IOException> {

    private final Appendable app;

    EdgeFormatter(Appendable pApp) {
      app = pApp;
    }

    @Override
    public Void visit(BasicNode pNode) throws IOException {
      app.append(formatEdge(pNode, pNode.getSuccessor(), ""));
      return null;
    }

    @Override
    public Void visit(ConditionalNode pNode) throws IOException {
      app.append(formatEdge(pNode, pNode.getFallthroughEdge(), "fallthrough"));
      app.append(formatEdge(pNode, pNode.getConditionalEdge(), "taken"));
      return null;
    }

    @Override
    public Void visit(ReturnNode pNode) {
      return null;
    }
  }
}
