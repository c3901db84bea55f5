// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.util.resources;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;

/**
 * Counts the work steps of one structuring run and aborts the run as soon as the limit is exceeded.
 * Every loop of the structuring algorithms charges its iterations here, so a run always terminates.
 * Recursive algorithms additionally enter and exit nesting levels, which bounds their stack depth.
 * Instances are not thread-safe and belong to exactly one run.
 */
public final class WorkBudget {

  public static final int DEFAULT_MAX_NESTING = 256;

  private final long limit;
  private final int maxNesting;
  private long steps = 0;
  private int nesting = 0;
  private String phase = "initialization";

  public WorkBudget(long pLimit) {
    this(pLimit, DEFAULT_MAX_NESTING);
  }

  public WorkBudget(long pLimit, int pMaxNesting) {
    checkArgument(pLimit > 0, "step limit must be positive, but is %s", pLimit);
    checkArgument(pMaxNesting > 0, "nesting limit must be positive, but is %s", pMaxNesting);
    limit = pLimit;
    maxNesting = pMaxNesting;
  }

  /** Sets the name of the current phase, which is reported if the limit is exceeded. */
  public void enterPhase(String pPhase) {
    phase = pPhase;
  }

  public void tick() throws StructuringLimitExceededException {
    tick(1);
  }

  public void tick(long pSteps) throws StructuringLimitExceededException {
    steps += pSteps;
    if (steps > limit) {
      throw new StructuringLimitExceededException(phase, steps, limit);
    }
  }

  public void enterNesting() throws StructuringLimitExceededException {
    nesting++;
    if (nesting > maxNesting) {
      throw new StructuringLimitExceededException(phase, "nesting depth", nesting, maxNesting);
    }
  }

  public void exitNesting() {
    checkState(nesting > 0, "no nesting level entered");
    nesting--;
  }

  public long getSteps() {
    return steps;
  }

  public long getLimit() {
    return limit;
  }

  public int getMaxNesting() {
    return maxNesting;
  }
}
