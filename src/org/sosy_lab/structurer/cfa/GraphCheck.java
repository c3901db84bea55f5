// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.Traverser;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.sosy_lab.structurer.cfa.model.BasicBlock;
import org.sosy_lab.structurer.cfa.model.BlockEdge;
import org.sosy_lab.structurer.cfa.model.TerminatorKind;
import org.sosy_lab.structurer.exceptions.InvalidGraphException;

/** Checks the well-formedness rules of control-flow graphs before they are built. */
public final class GraphCheck {

  private GraphCheck() {}

  /**
   * Traverse the blocks from the entry and check that they form a well-formed graph.
   *
   * @param pEntry id of the entry block
   * @param pBlocks all blocks of the graph, in any order
   * @throws InvalidGraphException for the first violated rule, with the offending block or edge
   */
  public static void check(int pEntry, List<BasicBlock> pBlocks) throws InvalidGraphException {
    Map<Integer, BasicBlock> byId = new TreeMap<>();
    for (BasicBlock block : pBlocks) {
      if (byId.put(block.getId(), block) != null) {
        throw new InvalidGraphException("Duplicate block id " + block.getId(), block.getId());
      }
    }

    if (!byId.containsKey(pEntry)) {
      throw new InvalidGraphException("Entry block " + pEntry + " does not exist", pEntry);
    }

    for (BasicBlock block : byId.values()) {
      for (BlockEdge edge : block.getLeavingEdges()) {
        if (!byId.containsKey(edge.getTarget())) {
          if (block.getTerminator().getKind() == TerminatorKind.DISPATCH) {
            throw new InvalidGraphException(
                "Dispatch of block "
                    + block.getId()
                    + " references undefined block "
                    + edge.getTarget(),
                edge);
          }
          throw new InvalidGraphException("Edge " + edge + " references an unknown block", edge);
        }
      }
    }

    Set<Integer> reached =
        ImmutableSet.copyOf(
            Traverser.<Integer>forGraph(id -> byId.get(id).getSuccessors()).breadthFirst(pEntry));
    Set<Integer> unreached = new TreeSet<>(Sets.difference(byId.keySet(), reached));
    if (!unreached.isEmpty()) {
      int first = unreached.iterator().next();
      throw new InvalidGraphException(
          "Blocks " + unreached + " are not reachable from entry block " + pEntry, first);
    }
  }
}
