// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable description of where the structuring of a statement sequence has to end and which
 * jumps are available there.
 *
 * <p>The stop block ends the current sequence silently, because the enclosing construct continues
 * there. Outer stops belong to enclosing constructs and can only be reached by a jump. The frames
 * are the enclosing loops and switches, the innermost one last.
 */
final class StructuringContext {

  private static final StructuringContext ROOT =
      new StructuringContext(null, ImmutableSet.of(), ImmutableList.of());

  private final @Nullable Integer stop;
  private final ImmutableSet<Integer> outerStops;
  private final ImmutableList<JumpFrame> frames;

  private StructuringContext(
      @Nullable Integer pStop,
      ImmutableSet<Integer> pOuterStops,
      ImmutableList<JumpFrame> pFrames) {
    stop = pStop;
    outerStops = pOuterStops;
    frames = pFrames;
  }

  static StructuringContext root() {
    return ROOT;
  }

  Optional<Integer> getStop() {
    return Optional.ofNullable(stop);
  }

  boolean isStop(int pBlock) {
    return stop != null && stop == pBlock;
  }

  boolean isOuterStop(int pBlock) {
    return outerStops.contains(pBlock);
  }

  ImmutableList<JumpFrame> getFrames() {
    return frames;
  }

  /**
   * Returns whether the block belongs to an enclosing construct: it is a stop block or the target
   * of a break or continue.
   */
  boolean isKnownExit(int pBlock) {
    if (isStop(pBlock) || isOuterStop(pBlock)) {
      return true;
    }
    for (JumpFrame frame : frames) {
      if (frame.isBreakTarget(pBlock) || frame.isContinueTarget(pBlock)) {
        return true;
      }
    }
    return false;
  }

  StructuringContext withStop(int pStop) {
    return new StructuringContext(pStop, outerStopsWithCurrent(), frames);
  }

  StructuringContext withoutStop() {
    return new StructuringContext(null, outerStopsWithCurrent(), frames);
  }

  StructuringContext withOuterStops(Iterable<Integer> pBlocks) {
    return new StructuringContext(
        stop,
        ImmutableSet.<Integer>builder().addAll(outerStops).addAll(pBlocks).build(),
        frames);
  }

  StructuringContext withFrame(JumpFrame pFrame) {
    return new StructuringContext(
        stop, outerStops, ImmutableList.<JumpFrame>builder().addAll(frames).add(pFrame).build());
  }

  private ImmutableSet<Integer> outerStopsWithCurrent() {
    if (stop == null) {
      return outerStops;
    }
    return ImmutableSet.<Integer>builder().addAll(outerStops).add(stop).build();
  }

  @Override
  public String toString() {
    return "stop " + stop + ", outer stops " + outerStops + ", frames " + frames;
  }
}
