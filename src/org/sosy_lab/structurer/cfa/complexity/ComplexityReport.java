// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.complexity;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** Cyclomatic complexity of one control-flow graph together with its rating. */
public final class ComplexityReport {

  private final int cyclomaticComplexity;
  private final int decisionPoints;
  private final ComplexityRating rating;

  ComplexityReport(int pCyclomaticComplexity, int pDecisionPoints, ComplexityRating pRating) {
    cyclomaticComplexity = pCyclomaticComplexity;
    decisionPoints = pDecisionPoints;
    rating = checkNotNull(pRating);
  }

  public int getCyclomaticComplexity() {
    return cyclomaticComplexity;
  }

  /** Returns the number of additional paths created by branching blocks. */
  public int getDecisionPoints() {
    return decisionPoints;
  }

  public ComplexityRating getRating() {
    return rating;
  }

  public String getDescription() {
    return rating.getDescription();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof ComplexityReport)) {
      return false;
    }
    ComplexityReport other = (ComplexityReport) pObj;
    return cyclomaticComplexity == other.cyclomaticComplexity
        && decisionPoints == other.decisionPoints
        && rating == other.rating;
  }

  @Override
  public int hashCode() {
    return Objects.hash(cyclomaticComplexity, decisionPoints, rating);
  }

  @Override
  public String toString() {
    return "cyclomatic complexity " + cyclomaticComplexity + " (" + rating + ")";
  }
}
