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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.sosy_lab.structurer.cfa.loops.LoopKind;

/**
 * Structured loop. While-loops test before each iteration, do-while-loops after each iteration, and
 * infinite loops have no test at all and are left with break or return statements. The loop
 * continues as long as the test evaluates to true, or to false if the node is negated.
 *
 * <p>The test statements of a while-loop are the statements of its header block. They are executed
 * before each evaluation of the test, like the left operands of a comma expression.
 */
public final class LoopNode extends StatementNode {

  private final int headerId;
  private final LoopKind kind;
  private final ImmutableList<String> testStatements;
  private final Optional<String> test;
  private final boolean negated;
  private final SequenceNode body;
  private final Optional<String> label;

  public LoopNode(
      int pHeaderId,
      LoopKind pKind,
      List<String> pTestStatements,
      Optional<String> pTest,
      boolean pNegated,
      SequenceNode pBody,
      Optional<String> pLabel) {
    checkArgument(pKind != LoopKind.IRREDUCIBLE, "irreducible loops cannot be structured");
    checkArgument(
        pTest.isPresent() == (pKind != LoopKind.INFINITE_WITH_BREAKS),
        "test %s does not match loop kind %s",
        pTest,
        pKind);
    checkArgument(pTest.isPresent() || !pNegated, "negated infinite loop");
    checkArgument(
        pTestStatements.isEmpty() || pKind == LoopKind.PRETEST,
        "only while-loops have test statements");
    headerId = pHeaderId;
    kind = pKind;
    testStatements = ImmutableList.copyOf(pTestStatements);
    test = pTest;
    negated = pNegated;
    body = checkNotNull(pBody);
    label = checkNotNull(pLabel);
  }

  public int getHeaderId() {
    return headerId;
  }

  public LoopKind getKind() {
    return kind;
  }

  public ImmutableList<String> getTestStatements() {
    return testStatements;
  }

  public Optional<String> getTest() {
    return test;
  }

  public boolean isNegated() {
    return negated;
  }

  /** Returns the condition for the next iteration, "true" for infinite loops. */
  public String getCondition() {
    if (test.isEmpty()) {
      return "true";
    }
    return negated ? "!(" + test.orElseThrow() + ")" : test.orElseThrow();
  }

  public SequenceNode getBody() {
    return body;
  }

  /** Returns the label of the loop if it is the target of a labeled break or continue. */
  public Optional<String> getLabel() {
    return label;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof LoopNode)) {
      return false;
    }
    LoopNode other = (LoopNode) pObj;
    return headerId == other.headerId
        && kind == other.kind
        && negated == other.negated
        && testStatements.equals(other.testStatements)
        && test.equals(other.test)
        && body.equals(other.body)
        && label.equals(other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(headerId, kind, testStatements, test, negated, body, label);
  }

  @Override
  public String toString() {
    String prefix = label.map(l -> l + ": ").orElse("");
    switch (kind) {
      case PRETEST:
      case INFINITE_WITH_BREAKS:
        String statements = testStatements.isEmpty() ? "" : "#" + headerId + ", ";
        return prefix + "while (" + statements + getCondition() + ") " + body;
      case POSTTEST:
        return prefix + "do " + body + " while (" + getCondition() + ")";
      default:
        throw new AssertionError("unhandled loop kind " + kind);
    }
  }
}
