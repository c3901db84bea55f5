// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * A maximal straight-line run of opaque statements, ended by one {@link Terminator}. Blocks are
 * immutable and reference other blocks only by id.
 */
public final class BasicBlock {

  private final int id;
  private final ImmutableList<String> statements;
  private final Terminator terminator;

  public BasicBlock(int pId, List<String> pStatements, Terminator pTerminator) {
    id = pId;
    statements = ImmutableList.copyOf(pStatements);
    terminator = checkNotNull(pTerminator);
  }

  public int getId() {
    return id;
  }

  public ImmutableList<String> getStatements() {
    return statements;
  }

  public Terminator getTerminator() {
    return terminator;
  }

  public ImmutableList<BlockEdge> getLeavingEdges() {
    return terminator.getLeavingEdges(id);
  }

  public ImmutableList<Integer> getSuccessors() {
    return terminator.getSuccessors(id);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BasicBlock)) {
      return false;
    }
    BasicBlock other = (BasicBlock) pObj;
    return id == other.id
        && statements.equals(other.statements)
        && terminator.equals(other.terminator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, statements, terminator);
  }

  @Override
  public String toString() {
    return "B" + id + " [" + Joiner.on("; ").join(statements) + "] " + terminator;
  }
}
