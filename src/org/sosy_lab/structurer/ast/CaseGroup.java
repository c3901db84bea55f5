// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;

/**
 * Case labels that share one body. A group that falls through continues with the body of the next
 * group and does not end with a break.
 */
public final class CaseGroup {

  private final ImmutableSortedSet<Long> labels;
  private final boolean isDefault;
  private final SequenceNode body;
  private final boolean fallsThrough;

  public CaseGroup(
      ImmutableSortedSet<Long> pLabels,
      boolean pIsDefault,
      SequenceNode pBody,
      boolean pFallsThrough) {
    checkArgument(!pLabels.isEmpty() || pIsDefault, "case group without labels");
    labels = pLabels;
    isDefault = pIsDefault;
    body = checkNotNull(pBody);
    fallsThrough = pFallsThrough;
  }

  public ImmutableSortedSet<Long> getLabels() {
    return labels;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public SequenceNode getBody() {
    return body;
  }

  public boolean fallsThrough() {
    return fallsThrough;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof CaseGroup)) {
      return false;
    }
    CaseGroup other = (CaseGroup) pObj;
    return isDefault == other.isDefault
        && fallsThrough == other.fallsThrough
        && labels.equals(other.labels)
        && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(labels, isDefault, body, fallsThrough);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!labels.isEmpty()) {
      sb.append("case ").append(Joiner.on(", ").join(labels)).append(": ");
    }
    if (isDefault) {
      sb.append("default: ");
    }
    return sb.append(body).toString();
  }
}
