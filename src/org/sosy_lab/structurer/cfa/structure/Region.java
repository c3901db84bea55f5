// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;
import org.sosy_lab.structurer.cfa.model.BlockEdge;

/**
 * A single-entry part of the graph that was contracted into one structured statement. Regions are
 * recorded in the order of contraction, so inner regions come before the regions containing them.
 */
public final class Region {

  private final RegionKind kind;
  private final int entry;
  private final ImmutableSortedSet<Integer> members;
  private final ImmutableSortedSet<BlockEdge> exits;

  Region(
      RegionKind pKind,
      int pEntry,
      ImmutableSortedSet<Integer> pMembers,
      ImmutableSortedSet<BlockEdge> pExits) {
    checkArgument(pMembers.contains(pEntry), "entry %s not part of region %s", pEntry, pMembers);
    kind = checkNotNull(pKind);
    entry = pEntry;
    members = pMembers;
    exits = pExits;
  }

  public RegionKind getKind() {
    return kind;
  }

  public int getEntry() {
    return entry;
  }

  public ImmutableSortedSet<Integer> getMembers() {
    return members;
  }

  /** Returns the edges from members of the region to blocks outside. */
  public ImmutableSortedSet<BlockEdge> getExits() {
    return exits;
  }

  /** Returns whether all members of the given region are also members of this one. */
  public boolean encloses(Region pOther) {
    return members.containsAll(pOther.members);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Region)) {
      return false;
    }
    Region other = (Region) pObj;
    return kind == other.kind
        && entry == other.entry
        && members.equals(other.members)
        && exits.equals(other.exits);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, entry, members, exits);
  }

  @Override
  public String toString() {
    return kind + " " + entry + " " + members;
  }
}
