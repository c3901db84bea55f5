// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.loops;

public enum LoopKind {
  /** while-style loop, the header tests the condition before each iteration. */
  PRETEST,
  /** do-while-style loop, the single latch tests the condition after each iteration. */
  POSTTEST,
  /** Loop without a test of its own, all exits leave from inside the body. */
  INFINITE_WITH_BREAKS,
  /** Cyclic region without a dominating header. It is never structured as a loop. */
  IRREDUCIBLE,
}
