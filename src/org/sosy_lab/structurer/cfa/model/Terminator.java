// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * The control-transferring instruction at the end of a {@link BasicBlock}. The set of subclasses is
 * closed, use {@link #getKind()} to distinguish them.
 */
public abstract class Terminator {

  Terminator() {}

  public abstract TerminatorKind getKind();

  /**
   * Returns the edges leaving a block with this terminator, in canonical order. The order is
   * relevant for all traversals of the graph and thus for the shape of the structured result.
   */
  public abstract ImmutableList<BlockEdge> getLeavingEdges(int pSource);

  /** Returns the distinct successor block ids, in canonical order. */
  public ImmutableList<Integer> getSuccessors(int pSource) {
    return FluentIterable.from(getLeavingEdges(pSource))
        .transform(BlockEdge::getTarget)
        .toSet()
        .asList();
  }

  public static FallthroughTerminator fallthrough(int pTarget) {
    return new FallthroughTerminator(pTarget);
  }

  public static ConditionalTerminator conditional(String pTest, int pTrueTarget, int pFalseTarget) {
    return new ConditionalTerminator(pTest, pTrueTarget, pFalseTarget);
  }

  public static ReturnTerminator returnVoid() {
    return new ReturnTerminator(Optional.empty());
  }

  public static ReturnTerminator returnValue(String pValue) {
    return new ReturnTerminator(Optional.of(pValue));
  }

  public static UnreachableTerminator unreachable() {
    return UnreachableTerminator.INSTANCE;
  }
}
