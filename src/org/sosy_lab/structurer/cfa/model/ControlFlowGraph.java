// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimaps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.structurer.cfa.GraphCheck;
import org.sosy_lab.structurer.exceptions.InvalidGraphException;

/**
 * Immutable control-flow graph of one function: a single entry block and a table of basic blocks
 * keyed by id. Instances can only be created by {@link Builder#build()}, which rejects malformed
 * graphs, so every instance satisfies these invariants:
 *
 * <ul>
 *   <li>block ids are unique,
 *   <li>every edge references existing blocks,
 *   <li>every block is reachable from the entry.
 * </ul>
 */
public final class ControlFlowGraph {

  private final int entry;
  private final ImmutableSortedMap<Integer, BasicBlock> blocks;
  private final ImmutableList<BlockEdge> edges;
  private final ImmutableListMultimap<Integer, Integer> successors;
  private final ImmutableListMultimap<Integer, Integer> predecessors;
  private final ImmutableListMultimap<Integer, BlockEdge> enteringEdges;

  private ControlFlowGraph(int pEntry, List<BasicBlock> pBlocks) {
    entry = pEntry;
    blocks = ImmutableSortedMap.copyOf(Maps.uniqueIndex(pBlocks, BasicBlock::getId));
    edges =
        FluentIterable.from(blocks.values())
            .transformAndConcat(BasicBlock::getLeavingEdges)
            .toList();

    ImmutableListMultimap.Builder<Integer, Integer> succ = ImmutableListMultimap.builder();
    for (BasicBlock block : blocks.values()) {
      succ.putAll(block.getId(), block.getSuccessors());
    }
    successors = succ.build();

    // predecessors in ascending order of their ids, because blocks are visited in this order
    ImmutableListMultimap.Builder<Integer, Integer> pred = ImmutableListMultimap.builder();
    for (BasicBlock block : blocks.values()) {
      for (int s : block.getSuccessors()) {
        pred.put(s, block.getId());
      }
    }
    predecessors = pred.build();
    enteringEdges = Multimaps.index(edges, BlockEdge::getTarget);
  }

  public static Builder builder(int pEntry) {
    return new Builder(pEntry);
  }

  public int getEntry() {
    return entry;
  }

  public boolean containsBlock(int pId) {
    return blocks.containsKey(pId);
  }

  public BasicBlock getBlock(int pId) {
    BasicBlock block = blocks.get(pId);
    checkArgument(block != null, "no block with id %s", pId);
    return block;
  }

  public ImmutableCollection<BasicBlock> getBlocks() {
    return blocks.values();
  }

  public ImmutableSortedSet<Integer> getBlockIds() {
    return blocks.keySet();
  }

  /** Returns all edges, ordered by source block and by the order of its terminator's targets. */
  public ImmutableList<BlockEdge> getEdges() {
    return edges;
  }

  public ImmutableList<BlockEdge> getLeavingEdges(int pId) {
    return getBlock(pId).getLeavingEdges();
  }

  public ImmutableList<BlockEdge> getEnteringEdges(int pId) {
    return enteringEdges.get(pId);
  }

  /** Returns the distinct successors of a block in canonical order. */
  public ImmutableList<Integer> getSuccessors(int pId) {
    return successors.get(pId);
  }

  /** Returns the distinct predecessors of a block, ordered by id. */
  public ImmutableList<Integer> getPredecessors(int pId) {
    return predecessors.get(pId);
  }

  public int getNumberOfBlocks() {
    return blocks.size();
  }

  /** Returns the number of distinct (source, target) pairs. */
  public int getNumberOfSuccessorEdges() {
    return successors.size();
  }

  @Override
  public String toString() {
    return "CFG with entry " + entry + ": " + blocks.values();
  }

  public static final class Builder {

    private final int entry;
    private final List<BasicBlock> blocks = new ArrayList<>();

    private Builder(int pEntry) {
      entry = pEntry;
    }

    @CanIgnoreReturnValue
    public Builder addBlock(BasicBlock pBlock) {
      blocks.add(pBlock);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addBlock(int pId, List<String> pStatements, Terminator pTerminator) {
      return addBlock(new BasicBlock(pId, pStatements, pTerminator));
    }

    /**
     * Validates the blocks and creates the graph.
     *
     * @throws InvalidGraphException if the blocks do not form a well-formed graph
     */
    public ControlFlowGraph build() throws InvalidGraphException {
      GraphCheck.check(entry, blocks);
      return new ControlFlowGraph(entry, blocks);
    }
  }
}
