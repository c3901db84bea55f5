// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;

public final class ReturnNode extends StatementNode {

  private final Optional<String> value;

  public ReturnNode(Optional<String> pValue) {
    value = checkNotNull(pValue);
  }

  public Optional<String> getValue() {
    return value;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof ReturnNode && ((ReturnNode) pObj).value.equals(value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.map(v -> "return " + v).orElse("return");
  }
}
