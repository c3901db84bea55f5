// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;

/**
 * Jump to the block after a loop or switch. It carries the label of the targeted construct if that
 * is not the innermost one.
 */
public final class BreakNode extends StatementNode {

  private static final BreakNode UNLABELED = new BreakNode(Optional.empty());

  private final Optional<String> label;

  private BreakNode(Optional<String> pLabel) {
    label = checkNotNull(pLabel);
  }

  public static BreakNode unlabeled() {
    return UNLABELED;
  }

  public static BreakNode to(String pLabel) {
    return new BreakNode(Optional.of(pLabel));
  }

  public Optional<String> getLabel() {
    return label;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof BreakNode && ((BreakNode) pObj).label.equals(label);
  }

  @Override
  public int hashCode() {
    return 31 * label.hashCode() + 1;
  }

  @Override
  public String toString() {
    return label.map(l -> "break " + l).orElse("break");
  }
}
