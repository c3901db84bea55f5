// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.cfa.complexity.ComplexityAnalyzer;
import org.sosy_lab.structurer.cfa.complexity.ComplexityReport;
import org.sosy_lab.structurer.cfa.dominators.DominatorTree;
import org.sosy_lab.structurer.cfa.loops.LoopDetector;
import org.sosy_lab.structurer.cfa.loops.NaturalLoop;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.cfa.structure.Diagnostic;
import org.sosy_lab.structurer.cfa.structure.RegionStructurer;
import org.sosy_lab.structurer.exceptions.StructuringException;
import org.sosy_lab.structurer.util.resources.WorkBudget;

/**
 * Entry point of the structuring engine: turns a validated {@link ControlFlowGraph} into a
 * structured statement tree.
 *
 * <p>A run computes dominators, detects loops, and contracts the regions of the graph, all within
 * one {@link WorkBudget}. The instance itself keeps no state between runs, so graphs can be
 * structured concurrently with the same instance.
 */
@Options(prefix = "structure")
public class CfaStructurer {

  @Option(
      secure = true,
      name = "limits.stepFactor",
      description =
          "Factor for the default step limit, which is factor * blocks * edges + baseSteps.")
  @IntegerOption(min = 1)
  private int stepFactor = 64;

  @Option(
      secure = true,
      name = "limits.baseSteps",
      description = "Number of steps that every structuring run may take in addition.")
  @IntegerOption(min = 0)
  private long baseSteps = 10000;

  @Option(
      secure = true,
      name = "limits.maxSteps",
      description =
          "Fixed step limit for every structuring run (0 derives the limit from the graph size).")
  @IntegerOption(min = 0)
  private long maxSteps = 0;

  @Option(
      secure = true,
      name = "limits.maxNesting",
      description = "Maximal depth of nested regions, deeper graphs abort the structuring run.")
  @IntegerOption(min = 1)
  private int maxNesting = WorkBudget.DEFAULT_MAX_NESTING;

  private final LogManager logger;
  private final ComplexityAnalyzer complexityAnalyzer;

  public CfaStructurer(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger.withComponentName("CfaStructurer");
    complexityAnalyzer = new ComplexityAnalyzer(pConfig);
  }

  /** Returns the limits that {@link #structure(ControlFlowGraph)} uses for the graph. */
  public StructuringLimits getDefaultLimits(ControlFlowGraph pGraph) {
    StructuringLimits limits =
        maxSteps > 0
            ? StructuringLimits.ofSteps(maxSteps)
            : StructuringLimits.proportional(pGraph, stepFactor, baseSteps);
    return limits.withMaxNesting(maxNesting);
  }

  public StructuringResult structure(ControlFlowGraph pGraph) throws StructuringException {
    return structure(pGraph, getDefaultLimits(pGraph));
  }

  /**
   * Structures the graph within the given limits.
   *
   * @throws StructuringException if the work of the run exceeds the limits
   */
  public StructuringResult structure(ControlFlowGraph pGraph, StructuringLimits pLimits)
      throws StructuringException {
    checkNotNull(pGraph);
    StructuringStatistics stats = new StructuringStatistics();
    WorkBudget budget = pLimits.createBudget();
    stats.setGraphSize(pGraph.getNumberOfBlocks(), pGraph.getEdges().size());

    logger.log(
        Level.FINE,
        "Structuring graph with",
        pGraph.getNumberOfBlocks(),
        "blocks and",
        pGraph.getEdges().size(),
        "edges,",
        pLimits);

    stats.totalTimer.start();
    try {
      budget.enterPhase("dominators");
      stats.dominatorTimer.start();
      DominatorTree dominators;
      try {
        dominators = DominatorTree.compute(pGraph, budget);
      } finally {
        stats.dominatorTimer.stop();
      }

      budget.enterPhase("loops");
      stats.loopTimer.start();
      ImmutableList<NaturalLoop> loops;
      try {
        loops = new LoopDetector(pGraph, dominators, budget).findLoops();
      } finally {
        stats.loopTimer.stop();
      }
      int irreducible = FluentIterable.from(loops).filter(l -> !l.isReducible()).size();
      stats.setLoops(loops.size(), irreducible);
      logger.log(Level.FINE, "Found", loops.size(), "loops,", irreducible, "of them irreducible");

      budget.enterPhase("structuring");
      stats.structuringTimer.start();
      RegionStructurer structurer;
      SequenceNode body;
      try {
        structurer = new RegionStructurer(pGraph, dominators, loops, budget, logger);
        body = structurer.structure();
      } finally {
        stats.structuringTimer.stop();
      }

      ComplexityReport complexity = complexityAnalyzer.analyze(pGraph);
      ImmutableList<Diagnostic> diagnostics = structurer.getDiagnostics();
      stats.setResult(structurer.getRegions().size(), diagnostics.size());
      stats.setSteps(budget.getSteps(), budget.getLimit());

      if (!diagnostics.isEmpty()) {
        logger.log(
            Level.INFO,
            "Graph could not be structured completely,",
            diagnostics.size(),
            "diagnostics reported");
      }
      logger.log(Level.FINE, "Structuring took", budget.getSteps(), "steps,", complexity);

      return new StructuringResult(
          body,
          diagnostics,
          structurer.getRegions(),
          loops,
          structurer.getEmissionOrder(),
          complexity,
          stats);
    } finally {
      stats.totalTimer.stopIfRunning();
    }
  }
}
