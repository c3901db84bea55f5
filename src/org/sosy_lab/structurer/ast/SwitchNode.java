// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured multi-way branch. The case groups are ordered as they are emitted. An irregular switch
 * has no common merge block, so its cases are connected with gotos instead.
 */
public final class SwitchNode extends StatementNode {

  private final int blockId;
  private final String discriminant;
  private final ImmutableList<CaseGroup> caseGroups;
  private final Optional<Integer> merge;
  private final Optional<String> label;
  private final boolean irregular;

  public SwitchNode(
      int pBlockId,
      String pDiscriminant,
      List<CaseGroup> pCaseGroups,
      Optional<Integer> pMerge,
      Optional<String> pLabel,
      boolean pIrregular) {
    checkArgument(
        FluentIterable.from(pCaseGroups).filter(CaseGroup::isDefault).size() <= 1,
        "several default groups");
    checkArgument(!pIrregular || pMerge.isEmpty(), "irregular switch with merge");
    blockId = pBlockId;
    discriminant = checkNotNull(pDiscriminant);
    caseGroups = ImmutableList.copyOf(pCaseGroups);
    merge = checkNotNull(pMerge);
    label = checkNotNull(pLabel);
    irregular = pIrregular;
  }

  public int getBlockId() {
    return blockId;
  }

  public String getDiscriminant() {
    return discriminant;
  }

  public ImmutableList<CaseGroup> getCaseGroups() {
    return caseGroups;
  }

  public Optional<CaseGroup> getDefaultGroup() {
    return FluentIterable.from(caseGroups).firstMatch(CaseGroup::isDefault).toJavaUtil();
  }

  /** Returns the block where control continues after the switch. */
  public Optional<Integer> getMerge() {
    return merge;
  }

  public Optional<String> getLabel() {
    return label;
  }

  public boolean isIrregular() {
    return irregular;
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
    if (!(pObj instanceof SwitchNode)) {
      return false;
    }
    SwitchNode other = (SwitchNode) pObj;
    return blockId == other.blockId
        && irregular == other.irregular
        && discriminant.equals(other.discriminant)
        && caseGroups.equals(other.caseGroups)
        && merge.equals(other.merge)
        && label.equals(other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(blockId, discriminant, caseGroups, merge, label, irregular);
  }

  @Override
  public String toString() {
    return label.map(l -> l + ": ").orElse("")
        + "switch ("
        + discriminant
        + ") {"
        + Joiner.on(' ').join(caseGroups)
        + "}";
  }
}
