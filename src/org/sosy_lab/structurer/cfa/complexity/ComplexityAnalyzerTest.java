// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.complexity;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.cfa.model.DispatchTerminator;
import org.sosy_lab.structurer.cfa.model.Terminator;

public class ComplexityAnalyzerTest {

  private static final ImmutableList<String> NONE = ImmutableList.of();

  @Test
  public void testStraightLine() throws Exception {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.fallthrough(1))
            .addBlock(1, NONE, Terminator.returnVoid())
            .build();

    ComplexityReport report =
        new ComplexityAnalyzer(Configuration.defaultConfiguration()).analyze(graph);

    assertThat(report.getCyclomaticComplexity()).isEqualTo(1);
    assertThat(report.getDecisionPoints()).isEqualTo(0);
    assertThat(report.getRating()).isEqualTo(ComplexityRating.LOW);
    assertThat(report.getDescription()).isEqualTo("Simple function with low complexity");
  }

  @Test
  public void testBranchesAndDispatch() throws Exception {
    // one conditional, one dispatch with three distinct targets, one loop back edge
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.conditional("c", 1, 4))
            .addBlock(
                1,
                NONE,
                DispatchTerminator.builder("x")
                    .addCase(2, 1, 2)
                    .addCase(3, 3)
                    .setDefault(4)
                    .build())
            .addBlock(2, NONE, Terminator.fallthrough(4))
            .addBlock(3, NONE, Terminator.conditional("again", 0, 4))
            .addBlock(4, NONE, Terminator.returnVoid())
            .build();

    ComplexityReport report =
        new ComplexityAnalyzer(Configuration.defaultConfiguration()).analyze(graph);

    // E - N + 2 = 8 - 5 + 2
    assertThat(report.getDecisionPoints()).isEqualTo(4);
    assertThat(report.getCyclomaticComplexity()).isEqualTo(5);
  }

  @Test
  public void testConfiguredThresholds() throws Exception {
    Configuration config =
        Configuration.builder()
            .setOption("structure.complexity.threshold.low", "1")
            .setOption("structure.complexity.threshold.medium", "2")
            .setOption("structure.complexity.threshold.high", "3")
            .build();
    ComplexityAnalyzer analyzer = new ComplexityAnalyzer(config);

    assertThat(analyzer.rate(2)).isEqualTo(ComplexityRating.MEDIUM);
    assertThat(analyzer.rate(4)).isEqualTo(ComplexityRating.VERY_HIGH);
  }

  @Test
  public void testDescendingThresholdsAreRejected() throws InvalidConfigurationException {
    Configuration config =
        Configuration.builder()
            .setOption("structure.complexity.threshold.low", "12")
            .setOption("structure.complexity.threshold.medium", "10")
            .build();

    assertThrows(InvalidConfigurationException.class, () -> new ComplexityAnalyzer(config));
  }

  @Test
  public void testThresholdBelowMinimumIsRejected() throws InvalidConfigurationException {
    Configuration config =
        Configuration.builder().setOption("structure.complexity.threshold.low", "0").build();

    assertThrows(InvalidConfigurationException.class, () -> new ComplexityAnalyzer(config));
  }
}
