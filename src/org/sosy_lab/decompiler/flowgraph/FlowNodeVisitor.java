// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.flowgraph;

/**
 * Visitor over the three kinds of flow-graph nodes. Implementing it is the way to handle every
 * kind of node; adding a kind breaks all visitors at compile time.
 *
 * @param <R> the return type of the visit methods
 * @param <X> the exception the visit methods may throw
 */
public interface FlowNodeVisitor<R, X extends Exception> {

  R visit(BasicNode pNode) throws X;

  R visit(ConditionalNode pNode) throws X;

  R visit(ReturnNode pNode) throws X;
}
