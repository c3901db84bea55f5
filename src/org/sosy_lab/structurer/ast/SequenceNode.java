// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Ordered list of statements, also used for all bodies of compound statements. */
public final class SequenceNode extends StatementNode {

  private static final SequenceNode EMPTY = new SequenceNode(ImmutableList.of());

  private final ImmutableList<StatementNode> statements;

  private SequenceNode(ImmutableList<StatementNode> pStatements) {
    statements = pStatements;
  }

  public static SequenceNode empty() {
    return EMPTY;
  }

  public static SequenceNode of(StatementNode... pStatements) {
    return copyOf(ImmutableList.copyOf(pStatements));
  }

  public static SequenceNode copyOf(List<? extends StatementNode> pStatements) {
    return pStatements.isEmpty() ? EMPTY : new SequenceNode(ImmutableList.copyOf(pStatements));
  }

  public ImmutableList<StatementNode> getStatements() {
    return statements;
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public int size() {
    return statements.size();
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(Object pObj) {
    return this == pObj
        || (pObj instanceof SequenceNode && statements.equals(((SequenceNode) pObj).statements));
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }

  @Override
  public String toString() {
    return "{" + Joiner.on("; ").join(statements) + "}";
  }
}
