// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

public final class Diagnostic {

  private final DiagnosticKind kind;
  private final int blockId;
  private final String message;

  public Diagnostic(DiagnosticKind pKind, int pBlockId, String pMessage) {
    kind = checkNotNull(pKind);
    blockId = pBlockId;
    message = checkNotNull(pMessage);
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  /** Returns the block at which the problem was detected. */
  public int getBlockId() {
    return blockId;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic) pObj;
    return kind == other.kind && blockId == other.blockId && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, blockId, message);
  }

  @Override
  public String toString() {
    return kind + " at block " + blockId + ": " + message;
  }
}
