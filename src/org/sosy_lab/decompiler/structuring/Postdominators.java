// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.base.Verify.verify;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import org.sosy_lab.decompiler.flowgraph.FlowNode;

/**
 * Reachability and postdominance inside a region of the flow graph.
 *
 * <p>Backward edges are never followed: they cannot lead to a node after the region, and leaving
 * them out makes every traversal terminate.
 */
final class Postdominators {

  private final StructuringContext context;

  Postdominators(StructuringContext pContext) {
    context = Preconditions.checkNotNull(pContext);
  }

  /**
   * Return whether {@code pEnd} is reachable from {@code pStart} if {@code pWithout} were removed
   * from the graph. Results are cached in the context.
   */
  boolean isEndReachableWithout(FlowNode pStart, FlowNode pEnd, FlowNode pWithout) {
    if (pEnd == pWithout || pStart == pWithout) {
      return false;
    }
    if (pStart == pEnd) {
      return true;
    }

    Boolean cached = context.getCachedReachability(pStart, pEnd, pWithout);
    if (cached != null) {
      return cached;
    }

    boolean result = false;
    for (FlowNode successor : pStart.getForwardSuccessors()) {
      if (isEndReachableWithout(successor, pEnd, pWithout)) {
        result = true;
        break;
      }
    }

    context.cacheReachability(pStart, pEnd, pWithout, result);
    return result;
  }

  /** All nodes reachable from {@code pStart} along forward edges, including itself. */
  static ImmutableSet<FlowNode> getReachableNodes(FlowNode pStart) {
    Set<FlowNode> reachableNodes = new LinkedHashSet<>();
    Deque<FlowNode> waitlist = new ArrayDeque<>();
    waitlist.push(pStart);
    while (!waitlist.isEmpty()) {
      FlowNode node = waitlist.pop();
      if (reachableNodes.add(node)) {
        node.getForwardSuccessors().forEach(waitlist::push);
      }
    }
    return ImmutableSet.copyOf(reachableNodes);
  }

  /**
   * Find the immediate postdominator of {@code pStart} with respect to the exit {@code pEnd}, i.e.
   * the earliest node other than the start that lies on every path from start to end.
   *
   * <p>If every path from the start returns early, the end is not reachable at all and every node
   * would count as postdominator, so the earliest one could lie inside a conditional and be
   * written twice. In this case the reachable node with the highest index serves as end instead.
   *
   * @throws com.google.common.base.VerifyException if no postdominator exists, which means the
   *     graph is malformed
   */
  FlowNode immediatePostdominator(FlowNode pStart, FlowNode pEnd) {
    FlowNode end = pEnd;
    Set<FlowNode> reachableNodes = getReachableNodes(pStart);
    if (!reachableNodes.contains(end)) {
      end = Collections.max(reachableNodes);
    }

    NavigableSet<FlowNode> postdominators = new TreeSet<>();
    Set<FlowNode> visited = new HashSet<>();
    Deque<FlowNode> waitlist = new ArrayDeque<>();
    waitlist.push(pStart);
    while (!waitlist.isEmpty()) {
      FlowNode node = waitlist.pop();
      if (node.getIndex() > end.getIndex() || !visited.add(node)) {
        // don't go beyond the end
        continue;
      }
      node.getForwardSuccessors().forEach(waitlist::push);

      if (node != pStart && !isEndReachableWithout(pStart, end, node)) {
        postdominators.add(node);
      }
    }

    verify(
        !postdominators.isEmpty(),
        "No postdominator of %s on the way to %s, at least the end should be one",
        pStart,
        end);
    return postdominators.first();
  }
}
