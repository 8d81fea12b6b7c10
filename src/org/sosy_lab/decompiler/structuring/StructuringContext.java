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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.flowgraph.FlowGraph;
import org.sosy_lab.decompiler.flowgraph.FlowNode;

/**
 * State of structuring one function. A new context is created for every function (and for every
 * retry of a function) and dropped after the function has been written.
 */
final class StructuringContext {

  private final FlowGraph flowGraph;
  private final StructuringOptions options;
  private final LogManager logger;
  private final String returnType;

  // keyed by (start, end, without)
  private final Map<List<FlowNode>, Boolean> reachableWithout = new HashMap<>();
  private final Set<FlowNode> gotoNodes = new LinkedHashSet<>();
  private final Set<FlowNode> emittedNodes = new HashSet<>();
  private boolean isVoid = true;
  private boolean hasWarned = false;

  StructuringContext(
      FlowGraph pFlowGraph, StructuringOptions pOptions, LogManager pLogger, String pReturnType) {
    flowGraph = Preconditions.checkNotNull(pFlowGraph);
    options = Preconditions.checkNotNull(pOptions);
    logger = Preconditions.checkNotNull(pLogger);
    returnType = Preconditions.checkNotNull(pReturnType);
  }

  FlowGraph getFlowGraph() {
    return flowGraph;
  }

  StructuringOptions getOptions() {
    return options;
  }

  LogManager getLogger() {
    return logger;
  }

  String getReturnType() {
    return returnType;
  }

  @Nullable Boolean getCachedReachability(FlowNode pStart, FlowNode pEnd, FlowNode pWithout) {
    return reachableWithout.get(ImmutableList.of(pStart, pEnd, pWithout));
  }

  void cacheReachability(FlowNode pStart, FlowNode pEnd, FlowNode pWithout, boolean pReachable) {
    reachableWithout.put(ImmutableList.of(pStart, pEnd, pWithout), pReachable);
  }

  /** Live view of all nodes that are the target of some goto. */
  Set<FlowNode> getGotoNodes() {
    return Collections.unmodifiableSet(gotoNodes);
  }

  void addGotoNode(FlowNode pTarget) {
    gotoNodes.add(pTarget);
  }

  /**
   * Record that the contents of the node are written.
   *
   * @return false if they were already written before
   */
  boolean markEmitted(FlowNode pNode) {
    return emittedNodes.add(pNode);
  }

  boolean isEmitted(FlowNode pNode) {
    return emittedNodes.contains(pNode);
  }

  boolean isVoid() {
    return isVoid;
  }

  void setReturnsValue() {
    isVoid = false;
  }

  /** Log the warning about inconsistent &&/|| detection, but only once per function. */
  void warnAboutConfusingControlFlow() {
    if (!hasWarned) {
      hasWarned = true;
      logger.log(
          Level.WARNING,
          "Confusing control flow, output may have incorrect && and || detection.",
          "Run with structuring.andorDetection=false to disable detection and print gotos"
              + " instead.");
    }
  }

  boolean hasWarned() {
    return hasWarned;
  }
}
