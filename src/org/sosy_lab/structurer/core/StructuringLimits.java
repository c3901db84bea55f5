// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.core;

import static com.google.common.base.Preconditions.checkArgument;

import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.util.resources.WorkBudget;

/**
 * Upper bound for the work of one structuring run, counted in steps, and for the depth of nested
 * regions.
 */
public final class StructuringLimits {

  private final long maxSteps;
  private final int maxNesting;

  private StructuringLimits(long pMaxSteps, int pMaxNesting) {
    checkArgument(pMaxSteps > 0, "step limit must be positive, but is %s", pMaxSteps);
    checkArgument(pMaxNesting > 0, "nesting limit must be positive, but is %s", pMaxNesting);
    maxSteps = pMaxSteps;
    maxNesting = pMaxNesting;
  }

  public static StructuringLimits ofSteps(long pMaxSteps) {
    return new StructuringLimits(pMaxSteps, WorkBudget.DEFAULT_MAX_NESTING);
  }

  public StructuringLimits withMaxNesting(int pMaxNesting) {
    return new StructuringLimits(maxSteps, pMaxNesting);
  }

  /**
   * Creates a limit proportional to the size of the graph:
   * factor * blocks * edges + base.
   */
  public static StructuringLimits proportional(
      ControlFlowGraph pGraph, long pFactor, long pBaseSteps) {
    checkArgument(pFactor > 0, "factor must be positive, but is %s", pFactor);
    checkArgument(pBaseSteps >= 0, "base steps must not be negative, but are %s", pBaseSteps);
    long blocks = Math.max(1, pGraph.getNumberOfBlocks());
    long edges = Math.max(1, pGraph.getEdges().size());
    return ofSteps(
        Math.addExact(Math.multiplyExact(Math.multiplyExact(pFactor, blocks), edges), pBaseSteps));
  }

  public long getMaxSteps() {
    return maxSteps;
  }

  public int getMaxNesting() {
    return maxNesting;
  }

  WorkBudget createBudget() {
    return new WorkBudget(maxSteps, maxNesting);
  }

  @Override
  public String toString() {
    return "at most " + maxSteps + " steps and nesting depth " + maxNesting;
  }
}
