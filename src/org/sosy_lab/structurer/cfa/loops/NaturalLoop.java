// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.loops;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurer.cfa.model.BlockEdge;

/**
 * A loop of the control-flow graph. For reducible loops, the header dominates all blocks of the
 * body and the back edges are exactly the edges from the body to the header. Irreducible loops
 * have several entries, their header is the entry that comes first in reverse postorder.
 */
public final class NaturalLoop {

  private final int header;
  private final ImmutableSortedSet<Integer> body;
  private final ImmutableSortedSet<BlockEdge> exits;
  private final ImmutableSortedSet<BlockEdge> backEdges;
  private final ImmutableSortedSet<Integer> entries;
  private final LoopKind kind;
  private final @Nullable Integer follow;
  private final @Nullable Integer latch;

  NaturalLoop(
      int pHeader,
      ImmutableSortedSet<Integer> pBody,
      ImmutableSortedSet<BlockEdge> pExits,
      ImmutableSortedSet<BlockEdge> pBackEdges,
      ImmutableSortedSet<Integer> pEntries,
      LoopKind pKind,
      @Nullable Integer pFollow,
      @Nullable Integer pLatch) {
    checkArgument(pBody.contains(pHeader));
    checkArgument(pKind != LoopKind.POSTTEST || pLatch != null, "do-while loop without latch");
    header = pHeader;
    body = pBody;
    exits = pExits;
    backEdges = pBackEdges;
    entries = pEntries;
    kind = pKind;
    follow = pFollow;
    latch = pLatch;
  }

  public int getHeader() {
    return header;
  }

  public ImmutableSortedSet<Integer> getBody() {
    return body;
  }

  public boolean contains(int pBlock) {
    return body.contains(pBlock);
  }

  /** Returns the edges that leave the body, sorted by source block. */
  public ImmutableSortedSet<BlockEdge> getExits() {
    return exits;
  }

  public ImmutableSortedSet<Integer> getExitTargets() {
    return FluentIterable.from(exits)
        .transform(BlockEdge::getTarget)
        .toSortedSet(Integer::compare);
  }

  /** Returns the edges closing the loop, all of kind {@code BACK}. */
  public ImmutableSortedSet<BlockEdge> getBackEdges() {
    return backEdges;
  }

  /** Returns the blocks of the body that have a predecessor outside of the body. */
  public ImmutableSortedSet<Integer> getEntries() {
    return entries;
  }

  public LoopKind getKind() {
    return kind;
  }

  public boolean isReducible() {
    return kind != LoopKind.IRREDUCIBLE;
  }

  /** Returns the block where control continues after the loop, if the loop can terminate. */
  public Optional<Integer> getFollow() {
    return Optional.ofNullable(follow);
  }

  /** Returns the block with the loop condition of a do-while loop. */
  public Optional<Integer> getLatch() {
    return Optional.ofNullable(latch);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof NaturalLoop)) {
      return false;
    }
    NaturalLoop other = (NaturalLoop) pObj;
    return header == other.header
        && kind == other.kind
        && body.equals(other.body)
        && exits.equals(other.exits)
        && backEdges.equals(other.backEdges)
        && entries.equals(other.entries)
        && Objects.equals(follow, other.follow)
        && Objects.equals(latch, other.latch);
  }

  @Override
  public int hashCode() {
    return Objects.hash(header, kind, body, exits, backEdges);
  }

  @Override
  public String toString() {
    return kind
        + " loop at "
        + header
        + " with body "
        + body
        + (follow == null ? "" : ", follow " + follow);
  }
}
