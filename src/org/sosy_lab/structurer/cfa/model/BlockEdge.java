// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * Directed edge between two basic blocks. Edges are derived from the terminators of the blocks and
 * identify blocks by id only.
 */
public final class BlockEdge implements Comparable<BlockEdge> {

  private final int source;
  private final int target;
  private final EdgeKind kind;

  public BlockEdge(int pSource, int pTarget, EdgeKind pKind) {
    source = pSource;
    target = pTarget;
    kind = pKind;
  }

  public int getSource() {
    return source;
  }

  public int getTarget() {
    return target;
  }

  public EdgeKind getKind() {
    return kind;
  }

  public BlockEdge asBackEdge() {
    checkArgument(kind != EdgeKind.BACK, "%s is already a back edge", this);
    return new BlockEdge(source, target, EdgeKind.BACK);
  }

  @Override
  public int compareTo(BlockEdge pOther) {
    return ComparisonChain.start()
        .compare(source, pOther.source)
        .compare(target, pOther.target)
        .compare(kind, pOther.kind)
        .result();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BlockEdge)) {
      return false;
    }
    BlockEdge other = (BlockEdge) pObj;
    return source == other.source && target == other.target && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, kind);
  }

  @Override
  public String toString() {
    return source + " -> " + target + " (" + kind + ")";
  }
}
