// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.core;

import com.google.common.base.Strings;
import java.io.PrintStream;
import org.sosy_lab.common.time.Timer;

/** Timers and counters of one structuring run. */
public final class StructuringStatistics {

  private static final int VALUE_COLUMN = 50;

  final Timer totalTimer = new Timer();
  final Timer dominatorTimer = new Timer();
  final Timer loopTimer = new Timer();
  final Timer structuringTimer = new Timer();

  private int blocks;
  private int edges;
  private int loops;
  private int irreducibleLoops;
  private int regions;
  private int diagnostics;
  private long steps;
  private long stepLimit;

  void setGraphSize(int pBlocks, int pEdges) {
    blocks = pBlocks;
    edges = pEdges;
  }

  void setLoops(int pLoops, int pIrreducibleLoops) {
    loops = pLoops;
    irreducibleLoops = pIrreducibleLoops;
  }

  void setResult(int pRegions, int pDiagnostics) {
    regions = pRegions;
    diagnostics = pDiagnostics;
  }

  void setSteps(long pSteps, long pStepLimit) {
    steps = pSteps;
    stepLimit = pStepLimit;
  }

  public String getName() {
    return "CFA Structurer";
  }

  public int getNumberOfRegions() {
    return regions;
  }

  public long getSteps() {
    return steps;
  }

  public void printStatistics(PrintStream pOut) {
    put(pOut, 0, "Number of blocks", blocks);
    put(pOut, 0, "Number of edges", edges);
    put(pOut, 0, "Number of loops", loops);
    put(pOut, 1, "irreducible", irreducibleLoops);
    put(pOut, 0, "Number of contracted regions", regions);
    put(pOut, 0, "Number of diagnostics", diagnostics);
    put(pOut, 0, "Work steps", steps + " (limit " + stepLimit + ")");
    pOut.println();

    put(pOut, 0, "Total time for structuring", totalTimer);
    put(pOut, 1, "Time for dominators", dominatorTimer);
    put(pOut, 1, "Time for loop detection", loopTimer);
    put(pOut, 1, "Time for region contraction", structuringTimer);
  }

  private static void put(PrintStream pOut, int pLevel, String pName, Object pValue) {
    String name = Strings.repeat("  ", pLevel) + pName + ":";
    pOut.println(Strings.padEnd(name, VALUE_COLUMN, ' ') + pValue);
  }
}
