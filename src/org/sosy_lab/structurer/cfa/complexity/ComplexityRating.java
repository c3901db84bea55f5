// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.complexity;

public enum ComplexityRating {
  LOW("Simple function with low complexity"),
  MEDIUM("Moderately complex function"),
  HIGH("Complex function that may benefit from refactoring"),
  VERY_HIGH("Very complex function that should be refactored");

  private final String description;

  ComplexityRating(String pDescription) {
    description = pDescription;
  }

  public String getDescription() {
    return description;
  }
}
