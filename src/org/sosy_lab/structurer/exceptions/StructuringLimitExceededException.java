// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.exceptions;

/**
 * Exception thrown if structuring does more work than the step limit allows, or nests regions
 * deeper than the nesting limit allows. This happens for adversarial graphs, e.g., large
 * irreducible regions or long chains of nested branches.
 */
public class StructuringLimitExceededException extends StructuringException {

  private static final long serialVersionUID = 2970157335093367119L;

  private final String phase;
  private final String resource;
  private final long steps;
  private final long limit;

  public StructuringLimitExceededException(String pPhase, long pSteps, long pLimit) {
    this(pPhase, "step", pSteps, pLimit);
  }

  public StructuringLimitExceededException(
      String pPhase, String pResource, long pUsed, long pLimit) {
    super(
        String.format(
            "Structuring exceeded its %s limit of %d during %s (reached %d)",
            pResource, pLimit, pPhase, pUsed));
    phase = pPhase;
    resource = pResource;
    steps = pUsed;
    limit = pLimit;
  }

  public String getPhase() {
    return phase;
  }

  /** Returns "step" or "nesting depth". */
  public String getResource() {
    return resource;
  }

  /** Returns the amount of the exceeded resource that was used. */
  public long getSteps() {
    return steps;
  }

  public long getLimit() {
    return limit;
  }
}
