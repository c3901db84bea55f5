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

/** Jump to the next iteration of a loop, labeled if that is not the innermost loop. */
public final class ContinueNode extends StatementNode {

  private static final ContinueNode UNLABELED = new ContinueNode(Optional.empty());

  private final Optional<String> label;

  private ContinueNode(Optional<String> pLabel) {
    label = checkNotNull(pLabel);
  }

  public static ContinueNode unlabeled() {
    return UNLABELED;
  }

  public static ContinueNode to(String pLabel) {
    return new ContinueNode(Optional.of(pLabel));
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
    return pObj instanceof ContinueNode && ((ContinueNode) pObj).label.equals(label);
  }

  @Override
  public int hashCode() {
    return 31 * label.hashCode() + 2;
  }

  @Override
  public String toString() {
    return label.map(l -> "continue " + l).orElse("continue");
  }
}
