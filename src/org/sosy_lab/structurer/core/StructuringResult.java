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
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.cfa.complexity.ComplexityReport;
import org.sosy_lab.structurer.cfa.loops.NaturalLoop;
import org.sosy_lab.structurer.cfa.structure.Diagnostic;
import org.sosy_lab.structurer.cfa.structure.DiagnosticKind;
import org.sosy_lab.structurer.cfa.structure.Region;

/** Everything produced by one structuring run of a control-flow graph. */
public final class StructuringResult {

  private final SequenceNode body;
  private final ImmutableList<Diagnostic> diagnostics;
  private final ImmutableList<Region> regions;
  private final ImmutableList<NaturalLoop> loops;
  private final ImmutableList<Integer> emissionOrder;
  private final ComplexityReport complexity;
  private final StructuringStatistics statistics;

  StructuringResult(
      SequenceNode pBody,
      ImmutableList<Diagnostic> pDiagnostics,
      ImmutableList<Region> pRegions,
      ImmutableList<NaturalLoop> pLoops,
      ImmutableList<Integer> pEmissionOrder,
      ComplexityReport pComplexity,
      StructuringStatistics pStatistics) {
    body = checkNotNull(pBody);
    diagnostics = checkNotNull(pDiagnostics);
    regions = checkNotNull(pRegions);
    loops = checkNotNull(pLoops);
    emissionOrder = checkNotNull(pEmissionOrder);
    complexity = checkNotNull(pComplexity);
    statistics = checkNotNull(pStatistics);
  }

  /** Returns the structured body of the function. */
  public SequenceNode getBody() {
    return body;
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public ImmutableList<Diagnostic> getDiagnostics(DiagnosticKind pKind) {
    return FluentIterable.from(diagnostics).filter(d -> d.getKind() == pKind).toList();
  }

  /** Returns the contracted regions, inner regions before the regions around them. */
  public ImmutableList<Region> getRegions() {
    return regions;
  }

  /** Returns all loops of the graph, including irreducible ones. */
  public ImmutableList<NaturalLoop> getLoops() {
    return loops;
  }

  public ImmutableList<Integer> getEmissionOrder() {
    return emissionOrder;
  }

  public ComplexityReport getComplexity() {
    return complexity;
  }

  public StructuringStatistics getStatistics() {
    return statistics;
  }

  /**
   * Returns whether the body could be built without gotos, that is without any irreducible loop,
   * irregular switch, or jump that had to fall back to a goto.
   */
  public boolean isFullyStructured() {
    return diagnostics.isEmpty();
  }

  @Override
  public String toString() {
    return body.toString();
  }
}
