// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.flowgraph.FlowGraph;
import org.sosy_lab.decompiler.flowgraph.FlowGraphToDotWriter;
import org.sosy_lab.decompiler.flowgraph.ReturnNode;
import org.sosy_lab.decompiler.structuring.statements.Body;

/**
 * Writes functions as C code, recovering if/else statements from their flow graphs. If a function
 * cannot be structured, it is written with gotos instead.
 */
public class FunctionWriter {

  private static final int BODY_INDENT = 4;

  private final StructuringOptions options;
  private final LogManager logger;

  public FunctionWriter(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    this(new StructuringOptions(pConfig), pLogger);
  }

  public FunctionWriter(StructuringOptions pOptions, LogManager pLogger) {
    options = Preconditions.checkNotNull(pOptions);
    logger = pLogger.withComponentName(FunctionWriter.class.getSimpleName());
  }

  /**
   * Build the statements of the function.
   *
   * @throws com.google.common.base.VerifyException if the flow graph is malformed
   */
  public StructuredFunction structure(FunctionInfo pFunction) {
    FlowGraph graph = pFunction.getFlowGraph();
    Optional<ReturnNode> returnNode = graph.getReturnNode();
    ReturnNode end = returnNode.orElseGet(ReturnNode::sentinel);

    Path dotDir = options.getFlowGraphExportDirectory();
    if (dotDir != null) {
      new FlowGraphToDotWriter(graph, pFunction.getName()).dump(dotDir, logger);
    }

    StructuringContext context = createContext(pFunction);
    Body body;
    boolean structured = false;
    if (options.structureIfs()) {
      logger.log(Level.FINE, "Structuring", pFunction, "with", graph);
      try {
        body =
            new FlowGraphStructurer(context)
                .buildFlowGraphBetween(graph.getEntryNode(), end, BODY_INDENT);
        structured = true;
      } catch (StructuringFailedException e) {
        logger.logUserException(
            Level.WARNING, e, "Writing " + pFunction + " with gotos only");
        context = createContext(pFunction);
        body = NaiveStructurer.build(context, graph.getNodes(), BODY_INDENT);
      }
    } else {
      body = NaiveStructurer.build(context, graph.getNodes(), BODY_INDENT);
    }

    if (returnNode.isPresent()) {
      JumpEmitter.writeReturn(context, body, returnNode.orElseThrow(), BODY_INDENT, true);
    }

    return new StructuredFunction(
        pFunction, body, context.getReturnType(), context.isVoid(), structured);
  }

  /** Structure the function and write it to {@code pOut}. */
  public void write(FunctionInfo pFunction, Appendable pOut) throws IOException {
    structure(pFunction).writeTo(pOut);
  }

  private StructuringContext createContext(FunctionInfo pFunction) {
    return new StructuringContext(
        pFunction.getFlowGraph(), options, logger, pFunction.getReturnType());
  }
}
