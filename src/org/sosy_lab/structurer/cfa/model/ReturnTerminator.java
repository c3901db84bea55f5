// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

public final class ReturnTerminator extends Terminator {

  private final Optional<String> value;

  ReturnTerminator(Optional<String> pValue) {
    value = pValue;
  }

  public Optional<String> getValue() {
    return value;
  }

  @Override
  public TerminatorKind getKind() {
    return TerminatorKind.RETURN;
  }

  @Override
  public ImmutableList<BlockEdge> getLeavingEdges(int pSource) {
    return ImmutableList.of();
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof ReturnTerminator && ((ReturnTerminator) pObj).value.equals(value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.isPresent() ? "return " + value.orElseThrow() : "return";
  }
}
