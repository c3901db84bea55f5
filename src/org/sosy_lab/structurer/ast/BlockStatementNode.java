// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * The statements of one basic block. A labeled block statement is the target of at least one
 * {@link GotoNode}.
 */
public final class BlockStatementNode extends StatementNode {

  private final int blockId;
  private final ImmutableList<String> statements;
  private final boolean labeled;

  public BlockStatementNode(int pBlockId, List<String> pStatements, boolean pLabeled) {
    blockId = pBlockId;
    statements = ImmutableList.copyOf(pStatements);
    labeled = pLabeled;
  }

  public int getBlockId() {
    return blockId;
  }

  public ImmutableList<String> getStatements() {
    return statements;
  }

  public boolean isLabeled() {
    return labeled;
  }

  public String getLabel() {
    return labelOf(blockId);
  }

  static String labelOf(int pBlockId) {
    return "block" + pBlockId;
  }

  public BlockStatementNode withLabel() {
    return labeled ? this : new BlockStatementNode(blockId, statements, true);
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
    if (!(pObj instanceof BlockStatementNode)) {
      return false;
    }
    BlockStatementNode other = (BlockStatementNode) pObj;
    return blockId == other.blockId
        && labeled == other.labeled
        && statements.equals(other.statements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(blockId, statements, labeled);
  }

  @Override
  public String toString() {
    return (labeled ? getLabel() + ": " : "") + "#" + blockId;
  }
}
