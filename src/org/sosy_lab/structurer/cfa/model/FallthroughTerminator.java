// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import com.google.common.collect.ImmutableList;

/** Unconditional jump to the next block. */
public final class FallthroughTerminator extends Terminator {

  private final int target;

  FallthroughTerminator(int pTarget) {
    target = pTarget;
  }

  public int getTarget() {
    return target;
  }

  @Override
  public TerminatorKind getKind() {
    return TerminatorKind.FALLTHROUGH;
  }

  @Override
  public ImmutableList<BlockEdge> getLeavingEdges(int pSource) {
    return ImmutableList.of(new BlockEdge(pSource, target, EdgeKind.FALLTHROUGH));
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof FallthroughTerminator
        && ((FallthroughTerminator) pObj).target == target;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(target);
  }

  @Override
  public String toString() {
    return "goto " + target;
  }
}
