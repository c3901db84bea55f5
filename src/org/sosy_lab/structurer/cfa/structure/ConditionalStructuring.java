// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurer.ast.IfNode;
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.ast.StatementNode;
import org.sosy_lab.structurer.cfa.dominators.DominatorTree;
import org.sosy_lab.structurer.cfa.model.ConditionalTerminator;
import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;

/**
 * Turns a conditional block into exactly one {@link IfNode}.
 *
 * <p>Each branch target either starts a region owned by the conditional block, or it is a plain
 * jump. The merge block is the first block where the regions of both branches meet again. If
 * there is none, one branch escapes (with return, break, continue, or goto): it becomes the
 * then-branch, and the other branch continues the current sequence without an else-branch.
 */
final class ConditionalStructuring {

  private final RegionStructurer structurer;

  ConditionalStructuring(RegionStructurer pStructurer) {
    structurer = pStructurer;
  }

  /** Returns the block where the current sequence continues after the if-statement, or null. */
  @Nullable Integer structure(
      int pBlock,
      ConditionalTerminator pCondition,
      StructuringContext pContext,
      List<StatementNode> pOut)
      throws StructuringLimitExceededException {
    int trueTarget = pCondition.getTrueTarget();
    int falseTarget = pCondition.getFalseTarget();
    if (trueTarget == falseTarget) {
      // both branches lead to the same block, there is nothing to decide
      return trueTarget;
    }

    int mark = structurer.markRegionStart();
    boolean trueIsRoot = isRegionRoot(trueTarget, pBlock, pContext);
    boolean falseIsRoot = isRegionRoot(falseTarget, pBlock, pContext);
    ImmutableSortedSet<Integer> trueFrontier = structurer.regionFrontier(trueTarget, trueIsRoot);
    ImmutableSortedSet<Integer> falseFrontier =
        structurer.regionFrontier(falseTarget, falseIsRoot);

    Optional<Integer> merge =
        structurer.selectMerge(
            pBlock, Sets.intersection(trueFrontier, falseFrontier), pContext);

    if (merge.isPresent()) {
      int mergeBlock = merge.orElseThrow();
      StructuringContext armContext = pContext.withStop(mergeBlock);
      IfNode node;
      if (falseTarget == mergeBlock) {
        node =
            new IfNode(
                pBlock,
                pCondition.getTest(),
                false,
                structurer.structureArm(trueTarget, armContext),
                Optional.empty());
      } else if (trueTarget == mergeBlock) {
        node =
            new IfNode(
                pBlock,
                pCondition.getTest(),
                true,
                structurer.structureArm(falseTarget, armContext),
                Optional.empty());
      } else {
        SequenceNode thenBranch = structurer.structureArm(trueTarget, armContext);
        SequenceNode elseBranch = structurer.structureArm(falseTarget, armContext);
        node =
            new IfNode(pBlock, pCondition.getTest(), false, thenBranch, Optional.of(elseBranch));
      }
      pOut.add(node);
      structurer.recordRegion(
          node.getElseBranch().isPresent() ? RegionKind.IF_THEN_ELSE : RegionKind.IF_THEN,
          pBlock,
          mark);
      return mergeBlock;
    }

    boolean trueFlowsOn = flowsOn(pBlock, trueFrontier, pContext);
    boolean falseFlowsOn = flowsOn(pBlock, falseFrontier, pContext);
    int escaping;
    if (trueFlowsOn != falseFlowsOn) {
      escaping = trueFlowsOn ? falseTarget : trueTarget;
    } else if (trueIsRoot != falseIsRoot) {
      // a plain jump is the shorter then-branch
      escaping = trueIsRoot ? falseTarget : trueTarget;
    } else {
      escaping = trueTarget;
    }

    SequenceNode thenBranch = structurer.structureArm(escaping, pContext.withoutStop());
    pOut.add(
        new IfNode(
            pBlock, pCondition.getTest(), escaping == falseTarget, thenBranch, Optional.empty()));
    structurer.recordRegion(RegionKind.IF_THEN, pBlock, mark);
    return escaping == trueTarget ? falseTarget : trueTarget;
  }

  /**
   * A branch target starts a region of the conditional block if it is dominated by it and can be
   * entered only from the conditional block (or from inside the region, via loops).
   */
  private boolean isRegionRoot(int pTarget, int pBlock, StructuringContext pContext) {
    if (!structurer.isDominatedTarget(pTarget, pBlock, pContext)) {
      return false;
    }
    DominatorTree dominators = structurer.getDominators();
    for (int pred : structurer.getGraph().getPredecessors(pTarget)) {
      if (pred != pBlock && !dominators.dominates(pTarget, pred)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether a branch continues the current sequence: it reaches the stop block, or a block
   * inside the region of the conditional block.
   */
  private boolean flowsOn(
      int pBlock, ImmutableSortedSet<Integer> pFrontier, StructuringContext pContext) {
    for (int block : pFrontier) {
      if (pContext.isStop(block)
          || (structurer.getDominators().strictlyDominates(pBlock, block)
              && !structurer.isEmitted(block)
              && !pContext.isKnownExit(block))) {
        return true;
      }
    }
    return false;
  }
}
