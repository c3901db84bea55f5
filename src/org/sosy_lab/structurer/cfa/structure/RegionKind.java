// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

public enum RegionKind {
  IF_THEN,
  IF_THEN_ELSE,
  LOOP,
  SWITCH,
  /** The whole function, including blocks that were appended as residual blocks. */
  FUNCTION_BODY,
}
