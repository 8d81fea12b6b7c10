// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import java.nio.file.Path;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.FileOption;
import org.sosy_lab.common.configuration.FileOption.Type;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;

@Options(prefix = "structuring")
public final class StructuringOptions {

  @Option(
      secure = true,
      name = "andorDetection",
      description =
          "Detect chains of conditional branches that encode a single condition joined by && or "
              + "||. If disabled, every branch becomes a separate if-statement, which may need "
              + "gotos where the chain would have been.")
  private boolean andorDetection = true;

  @Option(
      secure = true,
      name = "ifs",
      description =
          "Recover if/else statements from the flow graph. If disabled, the function is written "
              + "in the order of the original code with a goto for every jump.")
  private boolean structureIfs = true;

  @Option(
      secure = true,
      name = "debug",
      description = "Write a comment with the name of the flow-graph node before its contents.")
  private boolean debug = false;

  @FileOption(Type.OUTPUT_DIRECTORY)
  @Option(
      secure = true,
      name = "exportFlowGraphDir",
      description = "directory to dump the flow graph of each function to before structuring it")
  private @Nullable Path flowGraphDir = null;

  public StructuringOptions(Configuration pConfig) throws InvalidConfigurationException {
    pConfig.inject(this);
  }

  public boolean detectAndOr() {
    return andorDetection;
  }

  public boolean structureIfs() {
    return structureIfs;
  }

  public boolean printNodeComments() {
    return debug;
  }

  /** Directory for dot files of the flow graphs, or null if they should not be written. */
  public @Nullable Path getFlowGraphExportDirectory() {
    return flowGraphDir;
  }
}
