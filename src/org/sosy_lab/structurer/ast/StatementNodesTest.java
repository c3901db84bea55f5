// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Optional;
import org.junit.Test;
import org.sosy_lab.structurer.cfa.loops.LoopKind;

public class StatementNodesTest {

  private static BlockStatementNode block(int pId) {
    return new BlockStatementNode(pId, ImmutableList.of("s" + pId + "()"), false);
  }

  private static SwitchNode sampleSwitch() {
    return new SwitchNode(
        4,
        "x",
        ImmutableList.of(
            new CaseGroup(
                ImmutableSortedSet.of(1L, 2L), false, SequenceNode.of(block(5)), true),
            new CaseGroup(
                ImmutableSortedSet.of(3L),
                true,
                SequenceNode.of(block(6), BreakNode.unlabeled()),
                false)),
        Optional.of(7),
        Optional.of("S4"),
        false);
  }

  @Test
  public void testToString() {
    IfNode ifNode =
        new IfNode(
            0,
            "a > b",
            true,
            SequenceNode.of(block(1), new ReturnNode(Optional.of("a"))),
            Optional.of(SequenceNode.of(new GotoNode(3))));
    LoopNode doWhile =
        new LoopNode(
            2,
            LoopKind.POSTTEST,
            ImmutableList.of(),
            Optional.of("c"),
            false,
            SequenceNode.of(block(2), ContinueNode.to("L2")),
            Optional.of("L2"));

    assertThat(ifNode.toString()).isEqualTo("if (!(a > b)) {#1; return a} else {goto block3}");
    assertThat(doWhile.toString()).isEqualTo("L2: do {#2; continue L2} while (c)");
    assertThat(sampleSwitch().toString())
        .isEqualTo("S4: switch (x) {case 1, 2: {#5} case 3: default: {#6; break}}");
    assertThat(block(3).withLabel().toString()).isEqualTo("block3: #3");
  }

  @Test
  public void testInfiniteLoopHasNoTest() {
    LoopNode loop =
        new LoopNode(
            1,
            LoopKind.INFINITE_WITH_BREAKS,
            ImmutableList.of(),
            Optional.empty(),
            false,
            SequenceNode.of(BreakNode.to("L1")),
            Optional.empty());

    assertThat(loop.getCondition()).isEqualTo("true");
    assertThat(loop.toString()).isEqualTo("while (true) {break L1}");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new LoopNode(
                1,
                LoopKind.PRETEST,
                ImmutableList.of(),
                Optional.empty(),
                false,
                SequenceNode.empty(),
                Optional.empty()));
  }

  @Test
  public void testWhileLoopWithTestStatements() {
    LoopNode loop =
        new LoopNode(
            1,
            LoopKind.PRETEST,
            ImmutableList.of("c = getc()"),
            Optional.of("c != EOF"),
            false,
            SequenceNode.of(block(2)),
            Optional.empty());

    assertThat(loop.toString()).isEqualTo("while (#1, c != EOF) {#2}");
    assertThat(loop.getTestStatements()).containsExactly("c = getc()");
    assertThat(loop.getCondition()).isEqualTo("c != EOF");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new LoopNode(
                1,
                LoopKind.POSTTEST,
                ImmutableList.of("c = getc()"),
                Optional.of("c != EOF"),
                false,
                SequenceNode.empty(),
                Optional.empty()));
  }

  @Test
  public void testTraversal() {
    SwitchNode node = sampleSwitch();
    SequenceNode body = SequenceNode.of(block(0), node);

    assertThat(StatementNodes.childrenOf(node)).hasSize(2);
    assertThat(StatementNodes.preorder(body).first().get()).isSameInstanceAs(body);
    assertThat(StatementNodes.collect(body, BlockStatementNode.class))
        .containsExactly(block(0), block(5), block(6))
        .inOrder();
    assertThat(StatementNodes.collect(body, BreakNode.class))
        .containsExactly(BreakNode.unlabeled());
  }

  @Test
  public void testInvalidSwitch() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new CaseGroup(ImmutableSortedSet.of(), false, SequenceNode.empty(), false));

    CaseGroup defaultGroup =
        new CaseGroup(ImmutableSortedSet.of(), true, SequenceNode.empty(), false);
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SwitchNode(
                0,
                "x",
                ImmutableList.of(defaultGroup, defaultGroup),
                Optional.empty(),
                Optional.empty(),
                false));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SwitchNode(
                0,
                "x",
                ImmutableList.of(defaultGroup),
                Optional.of(1),
                Optional.empty(),
                true));
  }

  @Test
  public void testEquality() {
    assertThat(sampleSwitch()).isEqualTo(sampleSwitch());
    assertThat(BreakNode.unlabeled()).isNotEqualTo(ContinueNode.unlabeled());
    assertThat(BreakNode.to("L1")).isNotEqualTo(BreakNode.to("L2"));
    assertThat(block(1)).isNotEqualTo(block(1).withLabel());
  }
}
