// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** Two-way branch on an opaque test expression. */
public final class ConditionalTerminator extends Terminator {

  private final String test;
  private final int trueTarget;
  private final int falseTarget;

  ConditionalTerminator(String pTest, int pTrueTarget, int pFalseTarget) {
    test = checkNotNull(pTest);
    trueTarget = pTrueTarget;
    falseTarget = pFalseTarget;
  }

  public String getTest() {
    return test;
  }

  public int getTrueTarget() {
    return trueTarget;
  }

  public int getFalseTarget() {
    return falseTarget;
  }

  /** Returns the target that is taken for the given outcome of the test. */
  public int getTarget(boolean pOutcome) {
    return pOutcome ? trueTarget : falseTarget;
  }

  @Override
  public TerminatorKind getKind() {
    return TerminatorKind.CONDITIONAL;
  }

  @Override
  public ImmutableList<BlockEdge> getLeavingEdges(int pSource) {
    return ImmutableList.of(
        new BlockEdge(pSource, trueTarget, EdgeKind.TRUE_BRANCH),
        new BlockEdge(pSource, falseTarget, EdgeKind.FALSE_BRANCH));
  }

  @Override
  public boolean equals(Object pObj) {
    if (!(pObj instanceof ConditionalTerminator)) {
      return false;
    }
    ConditionalTerminator other = (ConditionalTerminator) pObj;
    return test.equals(other.test)
        && trueTarget == other.trueTarget
        && falseTarget == other.falseTarget;
  }

  @Override
  public int hashCode() {
    return Objects.hash(test, trueTarget, falseTarget);
  }

  @Override
  public String toString() {
    return "if (" + test + ") goto " + trueTarget + " else goto " + falseTarget;
  }
}
