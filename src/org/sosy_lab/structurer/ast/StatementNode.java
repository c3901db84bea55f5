// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

/**
 * Node of the structured statement tree. Nodes are immutable values; two trees are equal if they
 * have the same shape and contents. {@link #toString()} returns a compact single-line form for
 * debugging and tests, rendering concrete syntax is left to the consumers of the tree.
 */
public abstract class StatementNode {

  StatementNode() {}

  public abstract <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X;

  @Override
  public abstract boolean equals(Object pObj);

  @Override
  public abstract int hashCode();
}
