// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

/** Unstructured jump to the labeled statement of a block. Only used as fallback. */
public final class GotoNode extends StatementNode {

  private final int targetBlock;

  public GotoNode(int pTargetBlock) {
    targetBlock = pTargetBlock;
  }

  public int getTargetBlock() {
    return targetBlock;
  }

  /** Returns the label of the target, see {@link BlockStatementNode#getLabel()}. */
  public String getLabel() {
    return BlockStatementNode.labelOf(targetBlock);
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof GotoNode && ((GotoNode) pObj).targetBlock == targetBlock;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(targetBlock);
  }

  @Override
  public String toString() {
    return "goto " + getLabel();
  }
}
