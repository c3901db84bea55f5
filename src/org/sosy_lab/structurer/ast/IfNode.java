// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.Optional;

/**
 * Two-way branch of one conditional block. If the node is negated, the then-branch is executed if
 * the test evaluates to false. Tests of different blocks are never combined.
 */
public final class IfNode extends StatementNode {

  private final int blockId;
  private final String test;
  private final boolean negated;
  private final SequenceNode thenBranch;
  private final Optional<SequenceNode> elseBranch;

  public IfNode(
      int pBlockId,
      String pTest,
      boolean pNegated,
      SequenceNode pThenBranch,
      Optional<SequenceNode> pElseBranch) {
    blockId = pBlockId;
    test = checkNotNull(pTest);
    negated = pNegated;
    thenBranch = checkNotNull(pThenBranch);
    elseBranch = checkNotNull(pElseBranch);
  }

  /** Returns the id of the block whose terminator is represented by this node. */
  public int getBlockId() {
    return blockId;
  }

  public String getTest() {
    return test;
  }

  public boolean isNegated() {
    return negated;
  }

  /** Returns the condition under which the then-branch is executed. */
  public String getCondition() {
    return negated ? "!(" + test + ")" : test;
  }

  public SequenceNode getThenBranch() {
    return thenBranch;
  }

  public Optional<SequenceNode> getElseBranch() {
    return elseBranch;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof IfNode)) {
      return false;
    }
    IfNode other = (IfNode) pObj;
    return blockId == other.blockId
        && negated == other.negated
        && test.equals(other.test)
        && thenBranch.equals(other.thenBranch)
        && elseBranch.equals(other.elseBranch);
  }

  @Override
  public int hashCode() {
    return Objects.hash(blockId, test, negated, thenBranch, elseBranch);
  }

  @Override
  public String toString() {
    return "if ("
        + getCondition()
        + ") "
        + thenBranch
        + elseBranch.map(e -> " else " + e).orElse("");
  }
}
