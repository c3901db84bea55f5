// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import com.google.common.collect.ImmutableList;

/** Marks the end of a block that control never leaves, e.g., after a call to abort(). */
public final class UnreachableTerminator extends Terminator {

  static final UnreachableTerminator INSTANCE = new UnreachableTerminator();

  private UnreachableTerminator() {}

  @Override
  public TerminatorKind getKind() {
    return TerminatorKind.UNREACHABLE;
  }

  @Override
  public ImmutableList<BlockEdge> getLeavingEdges(int pSource) {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return "unreachable";
  }
}
