// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Multi-way branch on an opaque discriminant. Every case label maps to exactly one target, several
 * labels may share a target (<code>case 3: case 4:</code>). The default target is optional, without
 * it the case labels are expected to cover all values of the discriminant.
 */
public final class DispatchTerminator extends Terminator {

  private final String discriminant;
  private final ImmutableSortedMap<Long, Integer> cases;
  private final Optional<Integer> defaultTarget;

  // derived, ordered by the smallest label of each target
  private final ImmutableSetMultimap<Integer, Long> labelsByTarget;

  private DispatchTerminator(
      String pDiscriminant, Map<Long, Integer> pCases, Optional<Integer> pDefault) {
    discriminant = pDiscriminant;
    cases = ImmutableSortedMap.copyOf(pCases);
    defaultTarget = pDefault;

    ImmutableSetMultimap.Builder<Integer, Long> byTarget = ImmutableSetMultimap.builder();
    cases.forEach((label, target) -> byTarget.put(target, label));
    labelsByTarget = byTarget.build();
  }

  public static Builder builder(String pDiscriminant) {
    return new Builder(pDiscriminant);
  }

  public String getDiscriminant() {
    return discriminant;
  }

  public ImmutableSortedMap<Long, Integer> getCases() {
    return cases;
  }

  public Optional<Integer> getDefaultTarget() {
    return defaultTarget;
  }

  /** Returns the distinct case targets, ordered by ascending minimum label. */
  public ImmutableList<Integer> getCaseTargets() {
    return labelsByTarget.keySet().asList();
  }

  public ImmutableSortedSet<Long> getLabels(int pTarget) {
    return ImmutableSortedSet.copyOf(labelsByTarget.get(pTarget));
  }

  @Override
  public TerminatorKind getKind() {
    return TerminatorKind.DISPATCH;
  }

  @Override
  public ImmutableList<BlockEdge> getLeavingEdges(int pSource) {
    ImmutableList.Builder<BlockEdge> edges = ImmutableList.builder();
    for (int target : getCaseTargets()) {
      edges.add(new BlockEdge(pSource, target, EdgeKind.CASE));
    }
    if (defaultTarget.isPresent()) {
      edges.add(new BlockEdge(pSource, defaultTarget.orElseThrow(), EdgeKind.DEFAULT));
    }
    return edges.build();
  }

  @Override
  public boolean equals(Object pObj) {
    if (!(pObj instanceof DispatchTerminator)) {
      return false;
    }
    DispatchTerminator other = (DispatchTerminator) pObj;
    return discriminant.equals(other.discriminant)
        && cases.equals(other.cases)
        && defaultTarget.equals(other.defaultTarget);
  }

  @Override
  public int hashCode() {
    return Objects.hash(discriminant, cases, defaultTarget);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("switch (").append(discriminant).append(") {");
    for (int target : getCaseTargets()) {
      sb.append(" case ")
          .append(Joiner.on(", ").join(labelsByTarget.get(target)))
          .append(": goto ")
          .append(target)
          .append(";");
    }
    defaultTarget.ifPresent(t -> sb.append(" default: goto ").append(t).append(";"));
    return sb.append(" }").toString();
  }

  public static final class Builder {

    private final String discriminant;
    private final Map<Long, Integer> cases = new TreeMap<>();
    private @Nullable Integer defaultTarget = null;

    private Builder(String pDiscriminant) {
      discriminant = checkNotNull(pDiscriminant);
    }

    /** Adds labels that all jump to the given target. */
    @CanIgnoreReturnValue
    public Builder addCase(int pTarget, long... pLabels) {
      checkArgument(pLabels.length > 0, "case for target %s without labels", pTarget);
      for (long label : pLabels) {
        Integer previous = cases.put(label, pTarget);
        checkArgument(
            previous == null, "duplicate case label %s (targets %s and %s)", label, previous,
            pTarget);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDefault(int pTarget) {
      checkState(defaultTarget == null, "default target already set to %s", defaultTarget);
      defaultTarget = pTarget;
      return this;
    }

    public DispatchTerminator build() {
      checkState(
          !cases.isEmpty() || defaultTarget != null, "dispatch on %s has no targets", discriminant);
      return new DispatchTerminator(discriminant, cases, Optional.ofNullable(defaultTarget));
    }
  }
}
