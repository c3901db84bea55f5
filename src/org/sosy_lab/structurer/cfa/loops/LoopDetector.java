// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.loops;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.google.common.collect.TreeMultimap;
import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurer.cfa.dominators.DominatorTree;
import org.sosy_lab.structurer.cfa.model.BasicBlock;
import org.sosy_lab.structurer.cfa.model.BlockEdge;
import org.sosy_lab.structurer.cfa.model.ConditionalTerminator;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.cfa.model.EdgeKind;
import org.sosy_lab.structurer.cfa.model.TerminatorKind;
import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;
import org.sosy_lab.structurer.util.resources.WorkBudget;

/**
 * Finds the loops of a control-flow graph.
 *
 * <p>A back edge is an edge whose target dominates its source. All back edges to the same header
 * form one natural loop, whose body is the closure over dominated predecessors starting at the
 * sources of the back edges. Afterwards, retreating edges of a depth-first search whose target does
 * not dominate their source are reported as irreducible loops.
 */
public final class LoopDetector {

  private final ControlFlowGraph graph;
  private final DominatorTree dominators;
  private final WorkBudget budget;

  public LoopDetector(ControlFlowGraph pGraph, DominatorTree pDominators, WorkBudget pBudget) {
    graph = checkNotNull(pGraph);
    dominators = checkNotNull(pDominators);
    budget = checkNotNull(pBudget);
  }

  /** Returns all loops, sorted by header and then by size of the body. */
  public ImmutableList<NaturalLoop> findLoops() throws StructuringLimitExceededException {
    List<NaturalLoop> loops = new ArrayList<>();

    TreeMultimap<Integer, BlockEdge> backEdges = TreeMultimap.create();
    for (BlockEdge edge : graph.getEdges()) {
      budget.tick();
      if (dominators.dominates(edge.getTarget(), edge.getSource())) {
        backEdges.put(edge.getTarget(), edge.asBackEdge());
      }
    }
    for (Map.Entry<Integer, Collection<BlockEdge>> entry : backEdges.asMap().entrySet()) {
      loops.add(buildNaturalLoop(entry.getKey(), ImmutableSortedSet.copyOf(entry.getValue())));
    }

    loops.addAll(findIrreducibleLoops());

    return ImmutableList.sortedCopyOf(
        Comparator.comparingInt(NaturalLoop::getHeader)
            .thenComparingInt(loop -> loop.getBody().size()),
        loops);
  }

  private NaturalLoop buildNaturalLoop(int pHeader, ImmutableSortedSet<BlockEdge> pBackEdges)
      throws StructuringLimitExceededException {
    ImmutableSortedSet<Integer> latches =
        FluentIterable.from(pBackEdges)
            .transform(BlockEdge::getSource)
            .toSortedSet(Integer::compare);

    Set<Integer> body = new TreeSet<>();
    body.add(pHeader);
    Deque<Integer> waitlist = new ArrayDeque<>(latches);
    while (!waitlist.isEmpty()) {
      budget.tick();
      int block = waitlist.pop();
      if (dominators.dominates(pHeader, block) && body.add(block)) {
        waitlist.addAll(graph.getPredecessors(block));
      }
    }

    ImmutableSortedSet<Integer> loopBody = ImmutableSortedSet.copyOf(body);
    ImmutableSortedSet<BlockEdge> exits = exitsOf(loopBody);
    ImmutableSortedSet<Integer> entries = ImmutableSortedSet.of(pHeader);

    BasicBlock header = graph.getBlock(pHeader);
    if (isPretestHeader(header, loopBody, exits)) {
      ConditionalTerminator test = (ConditionalTerminator) header.getTerminator();
      int follow =
          loopBody.contains(test.getTrueTarget()) ? test.getFalseTarget() : test.getTrueTarget();
      return new NaturalLoop(
          pHeader, loopBody, exits, pBackEdges, entries, LoopKind.PRETEST, follow, null);
    }

    if (latches.size() == 1) {
      int latch = latches.first();
      Optional<Integer> follow = getPosttestFollow(pHeader, latch, loopBody, exits);
      if (follow.isPresent()) {
        return new NaturalLoop(
            pHeader,
            loopBody,
            exits,
            pBackEdges,
            entries,
            LoopKind.POSTTEST,
            follow.orElseThrow(),
            latch);
      }
    }

    return new NaturalLoop(
        pHeader,
        loopBody,
        exits,
        pBackEdges,
        entries,
        LoopKind.INFINITE_WITH_BREAKS,
        getInfiniteLoopFollow(pHeader, exits),
        null);
  }

  private ImmutableSortedSet<BlockEdge> exitsOf(Set<Integer> pBody) {
    return FluentIterable.from(pBody)
        .transformAndConcat(graph::getLeavingEdges)
        .filter(edge -> !pBody.contains(edge.getTarget()))
        .toSortedSet(Comparator.naturalOrder());
  }

  /**
   * A while-loop header ends with the test, with one branch into the body. A header with
   * statements is only accepted if the test is the only exit of the loop, then the statements
   * become part of the test.
   */
  private static boolean isPretestHeader(
      BasicBlock pHeader, Set<Integer> pBody, Set<BlockEdge> pExits) {
    if (pHeader.getTerminator().getKind() != TerminatorKind.CONDITIONAL) {
      return false;
    }
    ConditionalTerminator test = (ConditionalTerminator) pHeader.getTerminator();
    if (pBody.contains(test.getTrueTarget()) == pBody.contains(test.getFalseTarget())) {
      return false;
    }
    return pHeader.getStatements().isEmpty()
        || FluentIterable.from(pExits).allMatch(edge -> edge.getSource() == pHeader.getId());
  }

  /**
   * Checks whether the single latch of a loop is the test of a do-while loop and returns the exit
   * target of the test in this case.
   *
   * <p>A latch with statements must not be the target of other jumps inside the loop, because
   * those would become <code>continue</code> statements that skip the statements of the latch.
   * Thus, such a latch needs a single predecessor.
   */
  private Optional<Integer> getPosttestFollow(
      int pHeader, int pLatch, Set<Integer> pBody, Set<BlockEdge> pExits) {
    BasicBlock latch = graph.getBlock(pLatch);
    if (latch.getTerminator().getKind() != TerminatorKind.CONDITIONAL) {
      return Optional.empty();
    }
    ConditionalTerminator test = (ConditionalTerminator) latch.getTerminator();
    boolean trueToHeader = test.getTrueTarget() == pHeader;
    if (trueToHeader == (test.getFalseTarget() == pHeader)) {
      return Optional.empty();
    }
    int exit = trueToHeader ? test.getFalseTarget() : test.getTrueTarget();
    if (pBody.contains(exit)) {
      return Optional.empty();
    }
    if (pLatch != pHeader
        && !latch.getStatements().isEmpty()
        && graph.getPredecessors(pLatch).size() > 1) {
      return Optional.empty();
    }
    for (BlockEdge otherExit : pExits) {
      if (otherExit.getSource() != pLatch && dominators.dominates(pLatch, otherExit.getSource())) {
        return Optional.empty();
      }
    }
    return Optional.of(exit);
  }

  /**
   * Selects the block after a loop without own test: the exit target that can be reached from most
   * of the other exit targets without passing the header. Ties are broken by the number of blocks
   * reachable from the target (more is better, the function continues there) and finally by the
   * reverse postorder.
   */
  private @Nullable Integer getInfiniteLoopFollow(int pHeader, Set<BlockEdge> pExits)
      throws StructuringLimitExceededException {
    ImmutableSortedSet<Integer> candidates =
        FluentIterable.from(pExits)
            .transform(BlockEdge::getTarget)
            .toSortedSet(Integer::compare);
    if (candidates.isEmpty()) {
      return null;
    }

    SuccessorsFunction<Integer> avoidingHeader =
        block ->
            FluentIterable.from(graph.getSuccessors(block)).filter(succ -> succ != pHeader);
    Map<Integer, ImmutableSet<Integer>> reach = new HashMap<>();
    for (int candidate : candidates) {
      ImmutableSet.Builder<Integer> reached = ImmutableSet.builder();
      for (int block : Traverser.forGraph(avoidingHeader).breadthFirst(candidate)) {
        budget.tick();
        reached.add(block);
      }
      reach.put(candidate, reached.build());
    }

    @Nullable Integer best = null;
    int bestScore = -1;
    for (int candidate : candidates) {
      int score = 0;
      for (int other : candidates) {
        if (other != candidate && reach.get(other).contains(candidate)) {
          score++;
        }
      }
      if (best == null
          || ComparisonChain.start()
                  .compare(score, bestScore)
                  .compare(reach.get(candidate).size(), reach.get(best).size())
                  .compare(
                      dominators.getReversePostorderIndex(best),
                      dominators.getReversePostorderIndex(candidate))
                  .result()
              > 0) {
        best = candidate;
        bestScore = score;
      }
    }
    return best;
  }

  private ImmutableList<NaturalLoop> findIrreducibleLoops()
      throws StructuringLimitExceededException {
    List<BlockEdge> retreatingEdges = findIrreducibleRetreatingEdges();
    if (retreatingEdges.isEmpty()) {
      return ImmutableList.of();
    }

    Traverser<Integer> forward = Traverser.forGraph(graph::getSuccessors);
    Traverser<Integer> backward = Traverser.forGraph(graph::getPredecessors);
    Map<Integer, Set<Integer>> forwardReach = new HashMap<>();
    Map<Integer, Set<Integer>> backwardReach = new HashMap<>();

    // regions with the same body are merged
    Map<ImmutableSortedSet<Integer>, SortedSet<BlockEdge>> regions = new LinkedHashMap<>();
    for (BlockEdge edge : retreatingEdges) {
      Set<Integer> fromTarget = forwardReach.get(edge.getTarget());
      if (fromTarget == null) {
        fromTarget = collect(forward.breadthFirst(edge.getTarget()));
        forwardReach.put(edge.getTarget(), fromTarget);
      }
      Set<Integer> toSource = backwardReach.get(edge.getSource());
      if (toSource == null) {
        toSource = collect(backward.breadthFirst(edge.getSource()));
        backwardReach.put(edge.getSource(), toSource);
      }
      budget.tick(fromTarget.size());
      ImmutableSortedSet<Integer> body =
          ImmutableSortedSet.copyOf(Sets.intersection(fromTarget, toSource));
      regions.computeIfAbsent(body, k -> new TreeSet<>()).add(edge);
    }

    ImmutableList.Builder<NaturalLoop> result = ImmutableList.builder();
    for (Map.Entry<ImmutableSortedSet<Integer>, SortedSet<BlockEdge>> region :
        regions.entrySet()) {
      ImmutableSortedSet<Integer> body = region.getKey();
      ImmutableSortedSet<Integer> entries = entriesOf(body);
      verify(!entries.isEmpty(), "irreducible region %s without entry", body);
      int header =
          entries.stream()
              .min(Comparator.comparingInt(dominators::getReversePostorderIndex))
              .orElseThrow();
      result.add(
          new NaturalLoop(
              header,
              body,
              exitsOf(body),
              ImmutableSortedSet.copyOfSorted(region.getValue()),
              entries,
              LoopKind.IRREDUCIBLE,
              null,
              null));
    }
    return result.build();
  }

  /**
   * Depth-first search in canonical successor order that returns all retreating edges whose target
   * does not dominate their source.
   */
  private List<BlockEdge> findIrreducibleRetreatingEdges()
      throws StructuringLimitExceededException {
    List<BlockEdge> result = new ArrayList<>();
    Set<Integer> visited = new HashSet<>();
    Set<Integer> onPath = new HashSet<>();
    Deque<Integer> path = new ArrayDeque<>();
    Deque<Iterator<Integer>> pending = new ArrayDeque<>();

    int entry = graph.getEntry();
    visited.add(entry);
    onPath.add(entry);
    path.push(entry);
    pending.push(graph.getSuccessors(entry).iterator());

    while (!path.isEmpty()) {
      budget.tick();
      Iterator<Integer> successors = pending.peek();
      if (!successors.hasNext()) {
        onPath.remove(path.pop());
        pending.pop();
        continue;
      }
      int current = path.peek();
      int successor = successors.next();
      if (onPath.contains(successor)) {
        if (!dominators.dominates(successor, current)) {
          result.add(new BlockEdge(current, successor, EdgeKind.BACK));
        }
      } else if (visited.add(successor)) {
        onPath.add(successor);
        path.push(successor);
        pending.push(graph.getSuccessors(successor).iterator());
      }
    }
    return result;
  }

  private Set<Integer> collect(Iterable<Integer> pBlocks)
      throws StructuringLimitExceededException {
    Set<Integer> result = new HashSet<>();
    for (int block : pBlocks) {
      budget.tick();
      result.add(block);
    }
    return result;
  }

  private ImmutableSortedSet<Integer> entriesOf(Set<Integer> pBody) {
    ImmutableSortedSet.Builder<Integer> entries = ImmutableSortedSet.naturalOrder();
    for (int block : pBody) {
      if (block == graph.getEntry()
          || !pBody.containsAll(graph.getPredecessors(block))) {
        entries.add(block);
      }
    }
    return entries.build();
  }
}
