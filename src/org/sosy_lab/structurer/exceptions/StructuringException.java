// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.exceptions;

/** Super class for all exceptions that abort the structuring of a control-flow graph. */
public abstract class StructuringException extends Exception {

  private static final long serialVersionUID = 4218906381726402241L;

  protected StructuringException(String pMsg) {
    super(pMsg);
  }

  protected StructuringException(String pMsg, Throwable pCause) {
    super(pMsg, pCause);
  }
}
