// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.complexity;

import static com.google.common.truth.Truth.assertThat;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;

@RunWith(Parameterized.class)
@SuppressFBWarnings(
    value = "NP_NONNULL_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR",
    justification = "Fields are filled by parameterization of JUnit")
public class ComplexityRatingTest {

  private static ComplexityAnalyzer analyzer;

  @Parameters(name = "{0} // {1}")
  public static Object[][] ratings() {
    return new Object[][] {
      {1, ComplexityRating.LOW},
      {5, ComplexityRating.LOW},
      {6, ComplexityRating.MEDIUM},
      {10, ComplexityRating.MEDIUM},
      {11, ComplexityRating.HIGH},
      {20, ComplexityRating.HIGH},
      {21, ComplexityRating.VERY_HIGH},
      {150, ComplexityRating.VERY_HIGH},
    };
  }

  @Parameter(0)
  public int complexity;

  @Parameter(1)
  public ComplexityRating expectedRating;

  @BeforeClass
  public static void setUpAnalyzer() throws InvalidConfigurationException {
    analyzer = new ComplexityAnalyzer(Configuration.defaultConfiguration());
  }

  @Test
  public void testRating() {
    assertThat(analyzer.rate(complexity)).isEqualTo(expectedRating);
  }
}
