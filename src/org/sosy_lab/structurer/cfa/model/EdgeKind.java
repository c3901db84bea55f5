// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

public enum EdgeKind {
  FALLTHROUGH,
  TRUE_BRANCH,
  FALSE_BRANCH,
  CASE,
  DEFAULT,
  /** Copy of one of the other kinds, produced by loop detection for edges closing a loop. */
  BACK,
}
