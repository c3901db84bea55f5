// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.exceptions;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurer.cfa.model.BlockEdge;

/**
 * Exception for control-flow graphs that violate the well-formedness rules, e.g., a dangling edge
 * or a block that cannot be reached from the entry. The offending block and/or edge are attached.
 */
public class InvalidGraphException extends StructuringException {

  private static final long serialVersionUID = -6102855377312489823L;

  private final @Nullable Integer blockId;
  private final @Nullable BlockEdge edge;

  public InvalidGraphException(String pMsg) {
    super(pMsg);
    blockId = null;
    edge = null;
  }

  public InvalidGraphException(String pMsg, int pBlockId) {
    super(pMsg);
    blockId = pBlockId;
    edge = null;
  }

  public InvalidGraphException(String pMsg, BlockEdge pEdge) {
    super(pMsg);
    blockId = pEdge.getSource();
    edge = pEdge;
  }

  public Optional<Integer> getBlockId() {
    return Optional.ofNullable(blockId);
  }

  public Optional<BlockEdge> getEdge() {
    return Optional.ofNullable(edge);
  }
}
