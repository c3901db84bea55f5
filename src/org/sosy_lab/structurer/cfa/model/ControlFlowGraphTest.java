// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.sosy_lab.structurer.exceptions.InvalidGraphException;

public class ControlFlowGraphTest {

  private static final ImmutableList<String> NONE = ImmutableList.of();

  /** if (c) { a } else { b }; return */
  private static ControlFlowGraph diamond() throws InvalidGraphException {
    return ControlFlowGraph.builder(0)
        .addBlock(0, NONE, Terminator.conditional("c", 1, 2))
        .addBlock(1, ImmutableList.of("a"), Terminator.fallthrough(3))
        .addBlock(2, ImmutableList.of("b"), Terminator.fallthrough(3))
        .addBlock(3, NONE, Terminator.returnVoid())
        .build();
  }

  @Test
  public void testEdgesAndNeighbors() throws InvalidGraphException {
    ControlFlowGraph graph = diamond();

    assertThat(graph.getEntry()).isEqualTo(0);
    assertThat(graph.getNumberOfBlocks()).isEqualTo(4);
    assertThat(graph.getBlockIds()).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(graph.getLeavingEdges(0))
        .containsExactly(
            new BlockEdge(0, 1, EdgeKind.TRUE_BRANCH), new BlockEdge(0, 2, EdgeKind.FALSE_BRANCH))
        .inOrder();
    assertThat(graph.getSuccessors(0)).containsExactly(1, 2).inOrder();
    assertThat(graph.getPredecessors(3)).containsExactly(1, 2);
    assertThat(graph.getEnteringEdges(0)).isEmpty();
    assertThat(graph.getEdges()).hasSize(4);
  }

  @Test
  public void testConditionalWithEqualTargetsHasOneSuccessor() throws InvalidGraphException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.conditional("c", 1, 1))
            .addBlock(1, NONE, Terminator.returnVoid())
            .build();

    assertThat(graph.getLeavingEdges(0)).hasSize(2);
    assertThat(graph.getSuccessors(0)).containsExactly(1);
  }

  @Test
  public void testDispatchEdges() throws InvalidGraphException {
    DispatchTerminator dispatch =
        DispatchTerminator.builder("x").addCase(2, 5).addCase(1, 1, 3).setDefault(3).build();
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, dispatch)
            .addBlock(1, NONE, Terminator.fallthrough(4))
            .addBlock(2, NONE, Terminator.fallthrough(4))
            .addBlock(3, NONE, Terminator.fallthrough(4))
            .addBlock(4, NONE, Terminator.returnVoid())
            .build();

    assertThat(dispatch.getCaseTargets()).containsExactly(1, 2).inOrder();
    assertThat(dispatch.getLabels(1)).containsExactly(1L, 3L).inOrder();
    assertThat(graph.getLeavingEdges(0))
        .containsExactly(
            new BlockEdge(0, 1, EdgeKind.CASE),
            new BlockEdge(0, 2, EdgeKind.CASE),
            new BlockEdge(0, 3, EdgeKind.DEFAULT))
        .inOrder();
  }

  @Test
  public void testDuplicateCaseLabel() {
    DispatchTerminator.Builder builder = DispatchTerminator.builder("x").addCase(1, 7);
    assertThrows(IllegalArgumentException.class, () -> builder.addCase(2, 7));
  }

  @Test
  public void testDuplicateBlock() {
    InvalidGraphException e =
        assertThrows(
            InvalidGraphException.class,
            () ->
                ControlFlowGraph.builder(0)
                    .addBlock(0, NONE, Terminator.fallthrough(1))
                    .addBlock(1, NONE, Terminator.returnVoid())
                    .addBlock(1, NONE, Terminator.returnVoid())
                    .build());
    assertThat(e.getBlockId().orElseThrow()).isEqualTo(1);
  }

  @Test
  public void testMissingEntry() {
    InvalidGraphException e =
        assertThrows(
            InvalidGraphException.class,
            () ->
                ControlFlowGraph.builder(5)
                    .addBlock(0, NONE, Terminator.returnVoid())
                    .build());
    assertThat(e).hasMessageThat().contains("Entry block 5");
  }

  @Test
  public void testDanglingEdge() {
    InvalidGraphException e =
        assertThrows(
            InvalidGraphException.class,
            () ->
                ControlFlowGraph.builder(0)
                    .addBlock(0, NONE, Terminator.conditional("c", 1, 9))
                    .addBlock(1, NONE, Terminator.returnVoid())
                    .build());
    assertThat(e.getEdge().orElseThrow()).isEqualTo(new BlockEdge(0, 9, EdgeKind.FALSE_BRANCH));
  }

  @Test
  public void testDispatchToUndefinedBlock() {
    DispatchTerminator dispatch =
        DispatchTerminator.builder("x").addCase(1, 0).setDefault(2).build();
    InvalidGraphException e =
        assertThrows(
            InvalidGraphException.class,
            () ->
                ControlFlowGraph.builder(0)
                    .addBlock(0, NONE, dispatch)
                    .addBlock(1, NONE, Terminator.returnVoid())
                    .build());
    assertThat(e).hasMessageThat().isEqualTo("Dispatch of block 0 references undefined block 2");
  }

  @Test
  public void testUnreachableBlock() {
    InvalidGraphException e =
        assertThrows(
            InvalidGraphException.class,
            () ->
                ControlFlowGraph.builder(0)
                    .addBlock(0, NONE, Terminator.returnVoid())
                    .addBlock(1, NONE, Terminator.fallthrough(0))
                    .build());
    assertThat(e.getBlockId().orElseThrow()).isEqualTo(1);
  }
}
