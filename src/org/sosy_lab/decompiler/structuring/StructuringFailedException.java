// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

/**
 * Signals that the flow graph of a function does not have the shape the structuring assumed.
 * The function can still be written without structuring, using gotos only.
 */
public class StructuringFailedException extends Exception {

  private static final long serialVersionUID = -3962517843108702351L;

  public StructuringFailedException(String pMessage) {
    super(pMessage);
  }
}
