// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A loop or switch that is currently being structured and can be left with break. */
final class JumpFrame {

  private final boolean isLoop;
  private final int owner;
  private final @Nullable Integer breakTarget;
  private final @Nullable Integer continueTarget;

  private JumpFrame(
      boolean pIsLoop, int pOwner, @Nullable Integer pBreakTarget, @Nullable Integer pContinue) {
    isLoop = pIsLoop;
    owner = pOwner;
    breakTarget = pBreakTarget;
    continueTarget = pContinue;
  }

  static JumpFrame forLoop(int pHeader, Optional<Integer> pFollow, int pContinueTarget) {
    return new JumpFrame(true, pHeader, pFollow.orElse(null), pContinueTarget);
  }

  static JumpFrame forSwitch(int pDispatchBlock, Optional<Integer> pMerge) {
    return new JumpFrame(false, pDispatchBlock, pMerge.orElse(null), null);
  }

  boolean isLoop() {
    return isLoop;
  }

  String getLabel() {
    return (isLoop ? "L" : "S") + owner;
  }

  boolean isBreakTarget(int pBlock) {
    return breakTarget != null && breakTarget == pBlock;
  }

  boolean isContinueTarget(int pBlock) {
    return continueTarget != null && continueTarget == pBlock;
  }

  @Override
  public String toString() {
    return getLabel() + " (break " + breakTarget + ", continue " + continueTarget + ")";
  }
}
