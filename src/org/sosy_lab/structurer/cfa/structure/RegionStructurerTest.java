// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.logging.Level;
import org.junit.Test;
import org.sosy_lab.common.log.BasicLogManager;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.common.log.StringBuildingLogHandler;
import org.sosy_lab.common.log.TimestampedLogFormatter;
import org.sosy_lab.structurer.ast.BreakNode;
import org.sosy_lab.structurer.ast.IfNode;
import org.sosy_lab.structurer.ast.LoopNode;
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.ast.StatementNodes;
import org.sosy_lab.structurer.ast.SwitchNode;
import org.sosy_lab.structurer.cfa.dominators.DominatorTree;
import org.sosy_lab.structurer.cfa.loops.LoopDetector;
import org.sosy_lab.structurer.cfa.loops.LoopKind;
import org.sosy_lab.structurer.cfa.model.BlockEdge;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.cfa.model.DispatchTerminator;
import org.sosy_lab.structurer.cfa.model.EdgeKind;
import org.sosy_lab.structurer.cfa.model.Terminator;
import org.sosy_lab.structurer.exceptions.StructuringException;
import org.sosy_lab.structurer.util.resources.WorkBudget;

public class RegionStructurerTest {

  private static final ImmutableList<String> NONE = ImmutableList.of();

  private RegionStructurer structurer;

  private static ImmutableList<String> stmt(String pStatement) {
    return ImmutableList.of(pStatement);
  }

  private SequenceNode structure(ControlFlowGraph pGraph) throws StructuringException {
    return structure(pGraph, LogManager.createTestLogManager());
  }

  private SequenceNode structure(ControlFlowGraph pGraph, LogManager pLogger)
      throws StructuringException {
    WorkBudget budget = new WorkBudget(1000000);
    DominatorTree dominators = DominatorTree.compute(pGraph, budget);
    structurer =
        new RegionStructurer(
            pGraph,
            dominators,
            new LoopDetector(pGraph, dominators, budget).findLoops(),
            budget,
            pLogger);
    return structurer.structure();
  }

  private FluentIterable<DiagnosticKind> diagnosticKinds() {
    return FluentIterable.from(structurer.getDiagnostics()).transform(Diagnostic::getKind);
  }

  @Test
  public void testNestedIfs() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, stmt("init()"), Terminator.conditional("a", 1, 7))
            .addBlock(1, stmt("x()"), Terminator.conditional("b", 2, 6))
            .addBlock(2, stmt("y()"), Terminator.conditional("c", 3, 5))
            .addBlock(3, ImmutableList.of("s1()", "s2()"), Terminator.fallthrough(5))
            .addBlock(5, NONE, Terminator.fallthrough(6))
            .addBlock(6, NONE, Terminator.fallthrough(7))
            .addBlock(7, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString()).isEqualTo("{#0; if (a) {#1; if (b) {#2; if (c) {#3}}}; return}");
    assertThat(StatementNodes.collect(body, IfNode.class).size()).isEqualTo(3);
    assertThat(structurer.getDiagnostics()).isEmpty();
    assertThat(FluentIterable.from(structurer.getRegions()).transform(Region::getEntry))
        .containsExactly(2, 1, 0, 0)
        .inOrder();
  }

  @Test
  public void testIfThenElse() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.conditional("c", 1, 2))
            .addBlock(1, stmt("a()"), Terminator.fallthrough(3))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(3))
            .addBlock(3, NONE, Terminator.returnValue("x"))
            .build();

    assertThat(structure(graph).toString()).isEqualTo("{if (c) {#1} else {#2}; return x}");

    Region region = structurer.getRegions().get(0);
    assertThat(region.getKind()).isEqualTo(RegionKind.IF_THEN_ELSE);
    assertThat(region.getMembers()).containsExactly(0, 1, 2);
    assertThat(region.getExits())
        .containsExactly(
            new BlockEdge(1, 3, EdgeKind.FALLTHROUGH), new BlockEdge(2, 3, EdgeKind.FALLTHROUGH));
    assertThat(Iterables.getLast(structurer.getRegions()).getKind())
        .isEqualTo(RegionKind.FUNCTION_BODY);
  }

  @Test
  public void testNegatedIfWithoutElse() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.conditional("c", 2, 1))
            .addBlock(1, stmt("a()"), Terminator.fallthrough(2))
            .addBlock(2, NONE, Terminator.returnVoid())
            .build();

    assertThat(structure(graph).toString()).isEqualTo("{if (!(c)) {#1}; return}");
  }

  @Test
  public void testEarlyReturn() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, stmt("a()"), Terminator.conditional("err", 1, 2))
            .addBlock(1, NONE, Terminator.returnValue("-1"))
            .addBlock(2, stmt("b()"), Terminator.returnVoid())
            .build();

    assertThat(structure(graph).toString()).isEqualTo("{#0; if (err) {return -1}; #2; return}");
    assertThat(structurer.getRegions().get(0).getKind()).isEqualTo(RegionKind.IF_THEN);
  }

  @Test
  public void testBothBranchesToSameBlock() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, stmt("a()"), Terminator.conditional("c", 1, 1))
            .addBlock(1, NONE, Terminator.returnVoid())
            .build();

    assertThat(structure(graph).toString()).isEqualTo("{#0; return}");
  }

  @Test
  public void testWhileLoop() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, stmt("i = 0"), Terminator.fallthrough(1))
            .addBlock(1, NONE, Terminator.conditional("i < n", 2, 3))
            .addBlock(2, stmt("i++"), Terminator.fallthrough(1))
            .addBlock(3, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString()).isEqualTo("{#0; while (i < n) {#2}; return}");
    assertThat(StatementNodes.collect(body, BreakNode.class)).isEmpty();
  }

  @Test
  public void testDoWhileLoop() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.fallthrough(1))
            .addBlock(1, stmt("a()"), Terminator.conditional("c", 1, 2))
            .addBlock(2, NONE, Terminator.returnVoid())
            .build();

    assertThat(structure(graph).toString()).isEqualTo("{do {#1} while (c); return}");
  }

  @Test
  public void testBreakStaysInsideGuard() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.fallthrough(1))
            .addBlock(1, stmt("a()"), Terminator.conditional("g", 2, 4))
            .addBlock(2, stmt("b()"), Terminator.conditional("done", 5, 4))
            .addBlock(4, stmt("c()"), Terminator.fallthrough(1))
            .addBlock(5, NONE, Terminator.returnVoid())
            .build();

    assertThat(structure(graph).toString())
        .isEqualTo("{while (true) {#1; if (g) {#2; if (done) {break}}; #4}; return}");
  }

  @Test
  public void testSwitchWithBreaks() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(
                0,
                stmt("x = read()"),
                DispatchTerminator.builder("x")
                    .addCase(1, 1)
                    .addCase(2, 2)
                    .addCase(3, 3)
                    .setDefault(4)
                    .build())
            .addBlock(1, stmt("a()"), Terminator.fallthrough(5))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(5))
            .addBlock(3, stmt("c()"), Terminator.fallthrough(5))
            .addBlock(4, stmt("d()"), Terminator.fallthrough(5))
            .addBlock(5, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString())
        .isEqualTo(
            "{#0; switch (x) {case 1: {#1; break} case 2: {#2; break} case 3: {#3; break}"
                + " default: {#4; break}}; return}");
    assertThat(StatementNodes.collect(body, BreakNode.class).size()).isEqualTo(4);
    SwitchNode node = Iterables.getOnlyElement(StatementNodes.collect(body, SwitchNode.class));
    assertThat(node.getMerge().orElseThrow()).isEqualTo(5);
    assertThat(node.getDefaultGroup().orElseThrow().getBody().toString()).isEqualTo("{#4; break}");
  }

  @Test
  public void testSwitchFallThrough() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(
                0,
                NONE,
                DispatchTerminator.builder("x").addCase(1, 1).addCase(2, 2).setDefault(3).build())
            .addBlock(1, stmt("a()"), Terminator.fallthrough(2))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(4))
            .addBlock(3, stmt("c()"), Terminator.fallthrough(4))
            .addBlock(4, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString())
        .isEqualTo("{switch (x) {case 1: {#1} case 2: {#2; break} default: {#3; break}}; return}");
    SwitchNode node = Iterables.getOnlyElement(StatementNodes.collect(body, SwitchNode.class));
    assertThat(node.getCaseGroups().get(0).fallsThrough()).isTrue();
    assertThat(node.getCaseGroups().get(1).fallsThrough()).isFalse();
  }

  @Test
  public void testGroupedLabelsAndDefaultAsMerge() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(
                0,
                NONE,
                DispatchTerminator.builder("x")
                    .addCase(1, 1, 2, 3)
                    .addCase(2, 4)
                    .setDefault(3)
                    .build())
            .addBlock(1, stmt("a()"), Terminator.fallthrough(3))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(3))
            .addBlock(3, stmt("done()"), Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString())
        .isEqualTo("{switch (x) {case 1, 2, 3: {#1; break} case 4: {#2; break}}; #3; return}");
    assertThat(structurer.getDiagnostics()).isEmpty();
  }

  @Test
  public void testSwitchCaseLeavesLoop() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.fallthrough(1))
            .addBlock(1, NONE, Terminator.conditional("i < n", 2, 9))
            .addBlock(
                2,
                stmt("v = a[i]"),
                DispatchTerminator.builder("v").addCase(9, 0).addCase(4, 1).setDefault(5).build())
            .addBlock(4, stmt("one()"), Terminator.fallthrough(6))
            .addBlock(5, stmt("other()"), Terminator.fallthrough(6))
            .addBlock(6, stmt("i++"), Terminator.fallthrough(1))
            .addBlock(9, NONE, Terminator.returnVoid())
            .build();

    assertThat(structure(graph).toString())
        .isEqualTo(
            "{L1: while (i < n) {#2; switch (v) {case 0: {break L1} case 1: {#4; break}"
                + " default: {#5; break}}; #6}; return}");
  }

  @Test
  public void testDefaultAsMergeWithPartialFallThrough() throws StructuringException {
    // case 1: a(); if (c) break; b(); case 2: d(); break;
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(
                0,
                NONE,
                DispatchTerminator.builder("x").addCase(1, 1).addCase(3, 2).setDefault(4).build())
            .addBlock(1, stmt("a()"), Terminator.conditional("c", 4, 2))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(3))
            .addBlock(3, stmt("d()"), Terminator.fallthrough(4))
            .addBlock(4, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString())
        .isEqualTo("{switch (x) {case 1: {#1; if (c) {break}; #2} case 2: {#3; break}}; return}");
    SwitchNode node = Iterables.getOnlyElement(StatementNodes.collect(body, SwitchNode.class));
    assertThat(node.getMerge().orElseThrow()).isEqualTo(4);
    assertThat(node.getCaseGroups().get(0).fallsThrough()).isTrue();
    assertThat(node.getCaseGroups().get(1).fallsThrough()).isFalse();
    assertThat(structurer.getDiagnostics()).isEmpty();
  }

  @Test
  public void testIrregularSwitch() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(
                0,
                NONE,
                DispatchTerminator.builder("x").addCase(1, 1).addCase(2, 2).addCase(3, 3).build())
            .addBlock(1, stmt("a()"), Terminator.fallthrough(3))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(1))
            .addBlock(3, stmt("c()"), Terminator.fallthrough(4))
            .addBlock(4, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString())
        .isEqualTo(
            "{switch (x) {case 1: {block1: #1; goto block3} case 2: {#2; goto block1}"
                + " case 3: {block3: #3; return}}}");
    SwitchNode node = Iterables.getOnlyElement(StatementNodes.collect(body, SwitchNode.class));
    assertThat(node.isIrregular()).isTrue();
    assertThat(node.getMerge().isPresent()).isFalse();
    assertThat(diagnosticKinds())
        .containsExactly(
            DiagnosticKind.IRREGULAR_SWITCH,
            DiagnosticKind.GOTO_FALLBACK,
            DiagnosticKind.GOTO_FALLBACK)
        .inOrder();
  }

  @Test
  public void testWhileLoopWithHeaderStatements() throws StructuringException {
    // while ((c = getc()) != EOF) put(c);
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.fallthrough(1))
            .addBlock(1, stmt("c = getc()"), Terminator.conditional("c != EOF", 2, 3))
            .addBlock(2, stmt("put(c)"), Terminator.fallthrough(1))
            .addBlock(3, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString()).isEqualTo("{while (#1, c != EOF) {#2}; return}");
    LoopNode loop = Iterables.getOnlyElement(StatementNodes.collect(body, LoopNode.class));
    assertThat(loop.getKind()).isEqualTo(LoopKind.PRETEST);
    assertThat(loop.getTestStatements()).containsExactly("c = getc()");
    assertThat(StatementNodes.collect(body, BreakNode.class)).isEmpty();
  }

  @Test
  public void testDiagnosticsAreLoggedAsInfo() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(
                0,
                NONE,
                DispatchTerminator.builder("x").addCase(1, 1).addCase(2, 2).addCase(3, 3).build())
            .addBlock(1, stmt("a()"), Terminator.fallthrough(3))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(1))
            .addBlock(3, stmt("c()"), Terminator.fallthrough(4))
            .addBlock(4, NONE, Terminator.returnVoid())
            .build();
    StringBuildingLogHandler handler = new StringBuildingLogHandler();
    handler.setLevel(Level.INFO);
    handler.setFormatter(TimestampedLogFormatter.withoutColors());

    structure(graph, BasicLogManager.createWithHandler(handler));

    assertThat(handler.getLog()).contains("IRREGULAR_SWITCH at block 0");
    assertThat(handler.getLog()).contains("GOTO_FALLBACK at block 3");
  }

  @Test
  public void testIrreducibleLoop() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0)
            .addBlock(0, NONE, Terminator.conditional("c", 1, 2))
            .addBlock(1, stmt("a()"), Terminator.conditional("d", 2, 3))
            .addBlock(2, stmt("b()"), Terminator.fallthrough(1))
            .addBlock(3, NONE, Terminator.returnVoid())
            .build();

    SequenceNode body = structure(graph);

    assertThat(body.toString())
        .isEqualTo("{if (c) {block1: #1; if (d) {block2: #2; goto block1}; return}; goto block2}");
    assertThat(structurer.getDiagnostics().get(0))
        .isEqualTo(
            new Diagnostic(
                DiagnosticKind.IRREDUCIBLE_LOOP,
                1,
                "Loop with entries [1, 2] and body [1, 2] has no dominating header"));
    assertThat(diagnosticKinds().filter(k -> k == DiagnosticKind.GOTO_FALLBACK)).hasSize(2);
    assertThat(structurer.getEmissionOrder()).containsExactly(0, 1, 2, 3);
  }

  @Test
  public void testStructurerIsUsedOnce() throws StructuringException {
    ControlFlowGraph graph =
        ControlFlowGraph.builder(0).addBlock(0, NONE, Terminator.returnVoid()).build();
    structure(graph);

    assertThrows(IllegalStateException.class, () -> structurer.structure());
  }
}
