// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurer.ast.CaseGroup;
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.ast.StatementNode;
import org.sosy_lab.structurer.ast.SwitchNode;
import org.sosy_lab.structurer.cfa.model.DispatchTerminator;
import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;

/**
 * Turns a dispatch block into a {@link SwitchNode}.
 *
 * <p>Labels with the same target form one case group, and the groups are ordered by their smallest
 * label. A default target without labels of its own is placed next to the group it is connected
 * to by fall-through, or last. The merge block is the valid candidate reached by most cases. Case
 * entries are never merge candidates. The default target is one if the case groups alone agree on
 * it, and then the default group is dropped. Without a valid candidate the switch is irregular. A
 * group falls through if the entry of the next group is in its dominance frontier, all other
 * paths to the merge block end with a break. Dispatch blocks inside the cases are structured
 * recursively as nested switches.
 */
final class SwitchRecovery {

  private final RegionStructurer structurer;

  SwitchRecovery(RegionStructurer pStructurer) {
    structurer = pStructurer;
  }

  /** Returns the block where the current sequence continues after the switch, or null. */
  @Nullable Integer structure(
      int pBlock,
      DispatchTerminator pDispatch,
      StructuringContext pContext,
      List<StatementNode> pOut)
      throws StructuringLimitExceededException {
    int mark = structurer.markRegionStart();
    ImmutableList<Integer> caseTargets = pDispatch.getCaseTargets();
    Optional<Integer> defaultTarget = pDispatch.getDefaultTarget();

    Map<Integer, ImmutableSortedSet<Integer>> frontiers = new LinkedHashMap<>();
    for (int target : caseTargets) {
      frontiers.put(target, frontierOf(target, pBlock, pContext));
    }
    List<Integer> order = new ArrayList<>(caseTargets);
    boolean separateDefault =
        defaultTarget.isPresent() && !caseTargets.contains(defaultTarget.orElseThrow());
    if (separateDefault) {
      int target = defaultTarget.orElseThrow();
      frontiers.put(target, frontierOf(target, pBlock, pContext));
      insertDefault(order, target, frontiers);
    }

    Optional<Integer> merge = Optional.empty();
    boolean irregular = false;
    if (needsMerge(order, frontiers, pContext)) {
      Set<Integer> candidates = new LinkedHashSet<>();
      for (ImmutableSortedSet<Integer> frontier : frontiers.values()) {
        candidates.addAll(frontier);
      }
      if (separateDefault) {
        candidates.add(defaultTarget.orElseThrow());
      }
      // an entry with case labels starts a case group and cannot be left with break
      candidates.removeAll(caseTargets);
      List<Integer> validCandidates = new ArrayList<>();
      for (int candidate : candidates) {
        structurer.getBudget().tick(order.size());
        // if the default target is the merge, there is no default group
        List<Integer> groupEntries =
            separateDefault && defaultTarget.orElseThrow() == candidate ? caseTargets : order;
        if (isValidMerge(candidate, groupEntries, frontiers, pContext)) {
          validCandidates.add(candidate);
        }
      }
      merge =
          structurer.selectMerge(
              pBlock, mostSupported(validCandidates, frontiers.values()), pContext);
      if (merge.isEmpty()) {
        irregular = true;
        structurer.report(
            DiagnosticKind.IRREGULAR_SWITCH,
            pBlock,
            "Cases of switch on " + pDispatch.getDiscriminant() + " have no common merge block");
      }
    }
    if (separateDefault && merge.equals(defaultTarget)) {
      order.remove(defaultTarget.orElseThrow());
    }

    JumpFrame frame = JumpFrame.forSwitch(pBlock, merge);
    StructuringContext switchContext = pContext.withFrame(frame);
    List<CaseGroup> groups = new ArrayList<>(order.size());
    for (int i = 0; i < order.size(); i++) {
      int entry = order.get(i);
      @Nullable Integer next = i + 1 < order.size() ? order.get(i + 1) : null;
      boolean fallsThrough =
          !irregular && next != null && frontiers.get(entry).contains(next);
      List<Integer> otherEntries = new ArrayList<>(order);
      otherEntries.remove(i);
      StructuringContext caseContext =
          (fallsThrough ? switchContext.withStop(next) : switchContext.withoutStop())
              .withOuterStops(otherEntries);

      SequenceNode body = structurer.structureArm(entry, caseContext);
      groups.add(
          new CaseGroup(
              pDispatch.getLabels(entry),
              defaultTarget.isPresent() && defaultTarget.orElseThrow() == entry,
              body,
              fallsThrough));
    }

    pOut.add(
        new SwitchNode(
            pBlock,
            pDispatch.getDiscriminant(),
            groups,
            merge,
            structurer.labelOf(frame),
            irregular));
    structurer.recordRegion(RegionKind.SWITCH, pBlock, mark);
    return merge.orElse(null);
  }

  private ImmutableSortedSet<Integer> frontierOf(
      int pTarget, int pBlock, StructuringContext pContext) {
    return structurer.regionFrontier(
        pTarget, structurer.isDominatedTarget(pTarget, pBlock, pContext));
  }

  /**
   * Places the group of a default target without case labels: after a group that falls into it,
   * otherwise before a group it falls into, otherwise last.
   */
  private static void insertDefault(
      List<Integer> pOrder, int pDefault, Map<Integer, ImmutableSortedSet<Integer>> pFrontiers) {
    for (int i = 0; i < pOrder.size(); i++) {
      if (pFrontiers.get(pOrder.get(i)).contains(pDefault)) {
        pOrder.add(i + 1, pDefault);
        return;
      }
    }
    ImmutableSortedSet<Integer> defaultFrontier = pFrontiers.get(pDefault);
    for (int i = 0; i < pOrder.size(); i++) {
      if (defaultFrontier.contains(pOrder.get(i))) {
        pOrder.add(i, pDefault);
        return;
      }
    }
    pOrder.add(pDefault);
  }

  /**
   * A merge block is needed if some case continues at a block that is neither the entry of the
   * next case nor part of an enclosing construct.
   */
  private static boolean needsMerge(
      List<Integer> pOrder,
      Map<Integer, ImmutableSortedSet<Integer>> pFrontiers,
      StructuringContext pContext) {
    for (int i = 0; i < pOrder.size(); i++) {
      @Nullable Integer next = i + 1 < pOrder.size() ? pOrder.get(i + 1) : null;
      for (int block : pFrontiers.get(pOrder.get(i))) {
        if ((next == null || block != next) && !pContext.isKnownExit(block)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns the candidates that are reached by the largest number of cases. */
  private static List<Integer> mostSupported(
      List<Integer> pCandidates, Collection<ImmutableSortedSet<Integer>> pFrontiers) {
    List<Integer> result = new ArrayList<>();
    int best = -1;
    for (int candidate : pCandidates) {
      int support = FluentIterable.from(pFrontiers).filter(f -> f.contains(candidate)).size();
      if (support > best) {
        result.clear();
        best = support;
      }
      if (support == best) {
        result.add(candidate);
      }
    }
    return result;
  }

  /**
   * A block is a valid merge if every case, apart from jumps to enclosing constructs, continues
   * only at the merge or by falling through into the next case.
   */
  private static boolean isValidMerge(
      int pCandidate,
      List<Integer> pOrder,
      Map<Integer, ImmutableSortedSet<Integer>> pFrontiers,
      StructuringContext pContext) {
    for (int i = 0; i < pOrder.size(); i++) {
      @Nullable Integer next = i + 1 < pOrder.size() ? pOrder.get(i + 1) : null;
      for (int block : pFrontiers.get(pOrder.get(i))) {
        if (block != pCandidate
            && (next == null || block != next)
            && !pContext.isKnownExit(block)) {
          return false;
        }
      }
    }
    return true;
  }
}
