// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.complexity;

import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.structurer.cfa.model.BasicBlock;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;

/**
 * Computes McCabe's cyclomatic complexity of a control-flow graph.
 *
 * <p>Every block with n distinct successors adds n - 1 decision points, and the complexity is the
 * number of decision points plus one. For graphs with a single exit block this is E - N + 2.
 */
@Options(prefix = "structure.complexity")
public class ComplexityAnalyzer {

  @Option(
      secure = true,
      name = "threshold.low",
      description = "Highest cyclomatic complexity that is still rated as low.")
  @IntegerOption(min = 1)
  private int lowThreshold = 5;

  @Option(
      secure = true,
      name = "threshold.medium",
      description = "Highest cyclomatic complexity that is still rated as medium.")
  @IntegerOption(min = 1)
  private int mediumThreshold = 10;

  @Option(
      secure = true,
      name = "threshold.high",
      description =
          "Highest cyclomatic complexity that is still rated as high, "
              + "everything above is rated as very high.")
  @IntegerOption(min = 1)
  private int highThreshold = 20;

  public ComplexityAnalyzer(Configuration pConfig) throws InvalidConfigurationException {
    pConfig.inject(this);
    if (lowThreshold > mediumThreshold || mediumThreshold > highThreshold) {
      throw new InvalidConfigurationException(
          String.format(
              "Complexity thresholds have to be ascending, but are %d, %d, and %d",
              lowThreshold, mediumThreshold, highThreshold));
    }
  }

  public ComplexityReport analyze(ControlFlowGraph pGraph) {
    int decisionPoints = 0;
    for (BasicBlock block : pGraph.getBlocks()) {
      decisionPoints += Math.max(0, block.getSuccessors().size() - 1);
    }
    int complexity = decisionPoints + 1;
    return new ComplexityReport(complexity, decisionPoints, rate(complexity));
  }

  public ComplexityRating rate(int pComplexity) {
    if (pComplexity <= lowThreshold) {
      return ComplexityRating.LOW;
    } else if (pComplexity <= mediumThreshold) {
      return ComplexityRating.MEDIUM;
    } else if (pComplexity <= highThreshold) {
      return ComplexityRating.HIGH;
    } else {
      return ComplexityRating.VERY_HIGH;
    }
  }
}
