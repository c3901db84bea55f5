// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

/** Kinds of non-fatal problems that lead to degraded, goto-containing output. */
public enum DiagnosticKind {
  /** A cyclic region without a dominating header. */
  IRREDUCIBLE_LOOP,
  /** A switch without a common merge block for its cases. */
  IRREGULAR_SWITCH,
  /** A jump that could not be expressed as break, continue, or fall-through. */
  GOTO_FALLBACK,
  /** A block that was not part of any recognized region and was appended to the function body. */
  RESIDUAL_BLOCK,
}
