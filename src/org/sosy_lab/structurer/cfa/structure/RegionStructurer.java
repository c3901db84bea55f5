// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurer.ast.BlockStatementNode;
import org.sosy_lab.structurer.ast.BreakNode;
import org.sosy_lab.structurer.ast.ContinueNode;
import org.sosy_lab.structurer.ast.GotoNode;
import org.sosy_lab.structurer.ast.LoopNode;
import org.sosy_lab.structurer.ast.ReturnNode;
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.ast.StatementNode;
import org.sosy_lab.structurer.cfa.dominators.DominatorTree;
import org.sosy_lab.structurer.cfa.loops.NaturalLoop;
import org.sosy_lab.structurer.cfa.model.BasicBlock;
import org.sosy_lab.structurer.cfa.model.ConditionalTerminator;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.cfa.model.DispatchTerminator;
import org.sosy_lab.structurer.cfa.model.FallthroughTerminator;
import org.sosy_lab.structurer.cfa.model.ReturnTerminator;
import org.sosy_lab.structurer.cfa.model.Terminator;
import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;
import org.sosy_lab.structurer.util.resources.WorkBudget;

/**
 * Contracts the regions of a control-flow graph into one structured statement tree.
 *
 * <p>The graph is traversed from the entry, and every recognized region (loop, if-then-else,
 * switch) is structured recursively and contracted into one statement as soon as its body is
 * complete. Thus inner regions are contracted before the regions around them, see {@link
 * #getRegions()}. At each block, the priority is fixed: a loop header starts a loop, otherwise
 * the terminator of the block decides between if-then-else, switch, and straight-line
 * continuation.
 *
 * <p>A jump to a block is resolved in this order:
 *
 * <ol>
 *   <li>the stop block of the current sequence ends the sequence silently,
 *   <li>the block after an enclosing loop or switch becomes a break,
 *   <li>the header (or latch) of an enclosing loop becomes a continue,
 *   <li>a block that belongs to an enclosing region or was already emitted becomes a goto,
 *   <li>any other block is emitted in place.
 * </ol>
 *
 * <p>Blocks that are never reached this way are appended to the function body with a label.
 * Every block is emitted exactly once.
 *
 * <p>An instance can be used for a single run only.
 */
public final class RegionStructurer {

  private final ControlFlowGraph graph;
  private final DominatorTree dominators;
  private final ImmutableMap<Integer, NaturalLoop> loopsByHeader;
  private final ImmutableList<NaturalLoop> irreducibleLoops;
  private final WorkBudget budget;
  private final LogManager logger;

  private final ConditionalStructuring conditionals;
  private final SwitchRecovery switches;

  private final Set<Integer> emitted = new HashSet<>();
  private final List<Integer> emissionOrder = new ArrayList<>();
  private final Set<Integer> gotoTargets = new TreeSet<>();
  private final Set<String> usedLabels = new HashSet<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final List<Region> regions = new ArrayList<>();
  private boolean done = false;

  public RegionStructurer(
      ControlFlowGraph pGraph,
      DominatorTree pDominators,
      List<NaturalLoop> pLoops,
      WorkBudget pBudget,
      LogManager pLogger) {
    graph = checkNotNull(pGraph);
    dominators = checkNotNull(pDominators);
    loopsByHeader =
        FluentIterable.from(pLoops)
            .filter(NaturalLoop::isReducible)
            .uniqueIndex(NaturalLoop::getHeader);
    irreducibleLoops =
        FluentIterable.from(pLoops).filter(loop -> !loop.isReducible()).toList();
    budget = checkNotNull(pBudget);
    logger = checkNotNull(pLogger);
    conditionals = new ConditionalStructuring(this);
    switches = new SwitchRecovery(this);
  }

  /** Structures the whole graph and returns the body of the function. */
  public SequenceNode structure() throws StructuringLimitExceededException {
    checkState(!done, "structurer was already used");
    done = true;

    for (NaturalLoop loop : irreducibleLoops) {
      report(
          DiagnosticKind.IRREDUCIBLE_LOOP,
          loop.getHeader(),
          "Loop with entries "
              + loop.getEntries()
              + " and body "
              + loop.getBody()
              + " has no dominating header");
    }

    List<StatementNode> body = new ArrayList<>();
    emitSequence(graph.getEntry(), StructuringContext.root(), body);

    for (int block : graph.getBlockIds()) {
      budget.tick();
      if (!emitted.contains(block)) {
        report(DiagnosticKind.RESIDUAL_BLOCK, block, "Block is not part of a structured region");
        gotoTargets.add(block);
        emitSequence(block, StructuringContext.root(), body);
      }
    }
    verify(
        emitted.size() == graph.getNumberOfBlocks(),
        "blocks %s were not emitted",
        FluentIterable.from(graph.getBlockIds()).filter(b -> !emitted.contains(b)));

    regions.add(
        new Region(
            RegionKind.FUNCTION_BODY,
            graph.getEntry(),
            graph.getBlockIds(),
            ImmutableSortedSet.of()));

    return new TreeFinisher(gotoTargets).finish(SequenceNode.copyOf(body));
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the contracted regions, inner regions before outer ones. */
  public ImmutableList<Region> getRegions() {
    return ImmutableList.copyOf(regions);
  }

  /** Returns the block ids in the order in which the blocks were emitted. */
  public ImmutableList<Integer> getEmissionOrder() {
    return ImmutableList.copyOf(emissionOrder);
  }

  /**
   * Structures a sequence of statements, starting with a jump to the given block. Every nested
   * region is structured by a recursive call of this method.
   */
  void emitSequence(int pStart, StructuringContext pContext, List<StatementNode> pOut)
      throws StructuringLimitExceededException {
    budget.enterNesting();
    try {
      @Nullable Integer next = pStart;
      while (next != null) {
        budget.tick();
        next = transferTo(next, pContext, pOut);
      }
    } finally {
      budget.exitNesting();
    }
  }

  SequenceNode structureArm(int pStart, StructuringContext pContext)
      throws StructuringLimitExceededException {
    List<StatementNode> arm = new ArrayList<>();
    emitSequence(pStart, pContext, arm);
    return SequenceNode.copyOf(arm);
  }

  /**
   * Handles a jump to a block and returns the block where the current sequence continues, or null
   * if it ends.
   */
  private @Nullable Integer transferTo(
      int pBlock, StructuringContext pContext, List<StatementNode> pOut)
      throws StructuringLimitExceededException {
    if (pContext.isStop(pBlock)) {
      return null;
    }
    Optional<StatementNode> jump = structuredJumpTo(pBlock, pContext);
    if (jump.isPresent()) {
      pOut.add(jump.orElseThrow());
      return null;
    }
    if (pContext.isOuterStop(pBlock) || emitted.contains(pBlock)) {
      gotoTargets.add(pBlock);
      report(
          DiagnosticKind.GOTO_FALLBACK,
          pBlock,
          "Jump to block " + pBlock + " cannot be expressed with structured statements");
      pOut.add(new GotoNode(pBlock));
      return null;
    }

    NaturalLoop loop = loopsByHeader.get(pBlock);
    if (loop != null) {
      return structureLoop(loop, pContext, pOut);
    }
    return emitBlock(pBlock, pContext, pOut);
  }

  private Optional<StatementNode> structuredJumpTo(int pBlock, StructuringContext pContext) {
    ImmutableList<JumpFrame> frames = pContext.getFrames();
    boolean innerLoopSeen = false;
    for (int i = frames.size() - 1; i >= 0; i--) {
      JumpFrame frame = frames.get(i);
      if (frame.isBreakTarget(pBlock)) {
        if (i == frames.size() - 1) {
          return Optional.of(BreakNode.unlabeled());
        }
        usedLabels.add(frame.getLabel());
        return Optional.of(BreakNode.to(frame.getLabel()));
      }
      if (frame.isLoop()) {
        if (frame.isContinueTarget(pBlock)) {
          if (!innerLoopSeen) {
            return Optional.of(ContinueNode.unlabeled());
          }
          usedLabels.add(frame.getLabel());
          return Optional.of(ContinueNode.to(frame.getLabel()));
        }
        innerLoopSeen = true;
      }
    }
    return Optional.empty();
  }

  /**
   * Emits the statements of a block and structures its terminator. Returns the block where the
   * current sequence continues, or null.
   */
  private @Nullable Integer emitBlock(
      int pBlock, StructuringContext pContext, List<StatementNode> pOut)
      throws StructuringLimitExceededException {
    BasicBlock block = graph.getBlock(pBlock);
    markEmitted(pBlock);
    pOut.add(new BlockStatementNode(pBlock, block.getStatements(), false));

    Terminator terminator = block.getTerminator();
    switch (terminator.getKind()) {
      case FALLTHROUGH:
        return ((FallthroughTerminator) terminator).getTarget();
      case RETURN:
        pOut.add(new ReturnNode(((ReturnTerminator) terminator).getValue()));
        return null;
      case UNREACHABLE:
        return null;
      case CONDITIONAL:
        return conditionals.structure(
            pBlock, (ConditionalTerminator) terminator, pContext, pOut);
      case DISPATCH:
        return switches.structure(pBlock, (DispatchTerminator) terminator, pContext, pOut);
      default:
        throw new AssertionError("unhandled terminator " + terminator);
    }
  }

  private @Nullable Integer structureLoop(
      NaturalLoop pLoop, StructuringContext pContext, List<StatementNode> pOut)
      throws StructuringLimitExceededException {
    int header = pLoop.getHeader();
    int mark = emissionOrder.size();
    int continueTarget = pLoop.getLatch().orElse(header);
    JumpFrame frame = JumpFrame.forLoop(header, pLoop.getFollow(), continueTarget);
    StructuringContext bodyContext = pContext.withStop(continueTarget).withFrame(frame);

    List<StatementNode> body = new ArrayList<>();
    ImmutableList<String> testStatements = ImmutableList.of();
    Optional<String> test;
    boolean negated;
    switch (pLoop.getKind()) {
      case PRETEST:
        {
          BasicBlock headerBlock = graph.getBlock(header);
          ConditionalTerminator condition = (ConditionalTerminator) headerBlock.getTerminator();
          markEmitted(header);
          // the statements of the header belong to the test, this block only carries the label
          pOut.add(new BlockStatementNode(header, ImmutableList.of(), false));
          boolean trueEntersBody = pLoop.contains(condition.getTrueTarget());
          testStatements = headerBlock.getStatements();
          test = Optional.of(condition.getTest());
          negated = !trueEntersBody;
          emitSequence(condition.getTarget(trueEntersBody), bodyContext, body);
          break;
        }
      case POSTTEST:
        {
          BasicBlock latch = graph.getBlock(continueTarget);
          if (continueTarget == header) {
            markEmitted(header);
            body.add(new BlockStatementNode(header, latch.getStatements(), false));
          } else {
            emitLoopBodyFromHeader(header, bodyContext, body);
            markEmitted(continueTarget);
            body.add(new BlockStatementNode(continueTarget, latch.getStatements(), false));
          }
          ConditionalTerminator condition = (ConditionalTerminator) latch.getTerminator();
          test = Optional.of(condition.getTest());
          negated = condition.getTrueTarget() != header;
          break;
        }
      case INFINITE_WITH_BREAKS:
        emitLoopBodyFromHeader(header, bodyContext, body);
        test = Optional.empty();
        negated = false;
        break;
      default:
        throw new AssertionError("unexpected loop " + pLoop);
    }

    pOut.add(
        new LoopNode(
            header,
            pLoop.getKind(),
            testStatements,
            test,
            negated,
            SequenceNode.copyOf(body),
            labelOf(frame)));
    recordRegion(RegionKind.LOOP, header, mark);
    return pLoop.getFollow().orElse(null);
  }

  /** The header of the loop is the first block of the body and must not start the loop again. */
  private void emitLoopBodyFromHeader(
      int pHeader, StructuringContext pContext, List<StatementNode> pBody)
      throws StructuringLimitExceededException {
    @Nullable Integer next = emitBlock(pHeader, pContext, pBody);
    if (next != null) {
      emitSequence(next, pContext, pBody);
    }
  }

  private void markEmitted(int pBlock) {
    verify(emitted.add(pBlock), "block %s emitted twice", pBlock);
    emissionOrder.add(pBlock);
  }

  boolean isEmitted(int pBlock) {
    return emitted.contains(pBlock);
  }

  Optional<String> labelOf(JumpFrame pFrame) {
    return usedLabels.contains(pFrame.getLabel())
        ? Optional.of(pFrame.getLabel())
        : Optional.empty();
  }

  ControlFlowGraph getGraph() {
    return graph;
  }

  DominatorTree getDominators() {
    return dominators;
  }

  WorkBudget getBudget() {
    return budget;
  }

  /**
   * Returns whether a target of a branching block starts a region that belongs to the branching
   * block: it is strictly dominated by the branching block and not yet handled elsewhere.
   */
  boolean isDominatedTarget(int pTarget, int pOwner, StructuringContext pContext) {
    return dominators.strictlyDominates(pOwner, pTarget)
        && !pContext.isKnownExit(pTarget)
        && !emitted.contains(pTarget);
  }

  /**
   * Returns the blocks where control may continue after the region starting at a target. For a
   * target that does not start a region of its own, this is the target itself.
   */
  ImmutableSortedSet<Integer> regionFrontier(int pTarget, boolean pIsRegionRoot) {
    if (!pIsRegionRoot) {
      return ImmutableSortedSet.of(pTarget);
    }
    return FluentIterable.from(dominators.getDominanceFrontier(pTarget))
        .filter(block -> block != pTarget)
        .toSortedSet(Comparator.naturalOrder());
  }

  /**
   * Selects the merge block of a branching block from candidates. Blocks inside the region of the
   * branching block are preferred, the closest one in reverse postorder first. Otherwise, the stop
   * block of the current sequence is preferred over other blocks of enclosing regions.
   */
  Optional<Integer> selectMerge(
      int pOwner, Collection<Integer> pCandidates, StructuringContext pContext) {
    Comparator<Integer> byReversePostorder =
        Comparator.comparingInt(dominators::getReversePostorderIndex);
    Optional<Integer> inside =
        pCandidates.stream()
            .filter(c -> dominators.strictlyDominates(pOwner, c) && !emitted.contains(c))
            .min(byReversePostorder);
    if (inside.isPresent()) {
      return inside;
    }
    Optional<Integer> stop = pContext.getStop();
    if (stop.isPresent() && pCandidates.contains(stop.orElseThrow())) {
      return stop;
    }
    return pCandidates.stream().filter(pContext::isKnownExit).min(byReversePostorder);
  }

  int markRegionStart() {
    return emissionOrder.size();
  }

  /** Records a contracted region consisting of the entry and all blocks emitted since the mark. */
  void recordRegion(RegionKind pKind, int pEntry, int pMark) {
    ImmutableSortedSet<Integer> members =
        ImmutableSortedSet.<Integer>naturalOrder()
            .add(pEntry)
            .addAll(emissionOrder.subList(pMark, emissionOrder.size()))
            .build();
    Region region =
        new Region(
            pKind,
            pEntry,
            members,
            FluentIterable.from(members)
                .transformAndConcat(graph::getLeavingEdges)
                .filter(edge -> !members.contains(edge.getTarget()))
                .toSortedSet(Comparator.naturalOrder()));
    logger.log(Level.FINEST, "Contracted region", region);
    regions.add(region);
  }

  void report(DiagnosticKind pKind, int pBlock, String pMessage) {
    Diagnostic diagnostic = new Diagnostic(pKind, pBlock, pMessage);
    logger.log(Level.INFO, diagnostic);
    diagnostics.add(diagnostic);
  }
}
