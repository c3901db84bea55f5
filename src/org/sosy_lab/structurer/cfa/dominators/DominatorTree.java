// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.dominators;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.graph.Traverser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;
import org.sosy_lab.structurer.util.resources.WorkBudget;

/**
 * Dominator tree and dominance frontiers of a {@link ControlFlowGraph}.
 *
 * <p>The immediate dominators are computed with the iterative algorithm of Cooper, Harvey, and
 * Kennedy ("A Simple, Fast Dominance Algorithm") over the reverse postorder of the graph. The
 * dominator tree is numbered in preorder afterwards, so that {@link #dominates(int, int)} is a
 * constant-time interval check.
 *
 * <p>The entry block is treated as if it had one additional predecessor outside the graph. This
 * makes loops that are headed by the entry block visible in the dominance frontiers.
 *
 * <p>Internally, all arrays are indexed by the position of a block in the reverse postorder.
 */
public final class DominatorTree {

  private static final int UNDEFINED = -1;

  private final ImmutableList<Integer> reversePostorder;
  private final ImmutableMap<Integer, Integer> indexOf;
  private final int[] idom;
  private final int[] preorder;
  private final int[] lastDescendant;
  private final ImmutableList<ImmutableSortedSet<Integer>> frontiers;

  private DominatorTree(
      ImmutableList<Integer> pReversePostorder,
      ImmutableMap<Integer, Integer> pIndexOf,
      int[] pIdom,
      int[] pPreorder,
      int[] pLastDescendant,
      ImmutableList<ImmutableSortedSet<Integer>> pFrontiers) {
    reversePostorder = pReversePostorder;
    indexOf = pIndexOf;
    idom = pIdom;
    preorder = pPreorder;
    lastDescendant = pLastDescendant;
    frontiers = pFrontiers;
  }

  public static DominatorTree compute(ControlFlowGraph pGraph, WorkBudget pBudget)
      throws StructuringLimitExceededException {

    Iterable<Integer> postorder =
        Traverser.<Integer>forGraph(pGraph::getSuccessors).depthFirstPostOrder(pGraph.getEntry());
    ImmutableList<Integer> rpo = ImmutableList.copyOf(postorder).reverse();
    pBudget.tick(rpo.size());
    verify(rpo.size() == pGraph.getNumberOfBlocks(), "graph contains unreachable blocks");

    ImmutableMap.Builder<Integer, Integer> indexBuilder = ImmutableMap.builder();
    for (int i = 0; i < rpo.size(); i++) {
      indexBuilder.put(rpo.get(i), i);
    }
    ImmutableMap<Integer, Integer> indexOf = indexBuilder.buildOrThrow();

    int[] idom = computeImmediateDominators(pGraph, rpo, indexOf, pBudget);

    // number the dominator tree in preorder
    int n = rpo.size();
    List<List<Integer>> children = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      children.add(new ArrayList<>());
    }
    for (int i = 1; i < n; i++) {
      children.get(idom[i]).add(i);
    }
    int[] preorder = new int[n];
    int[] order = new int[n];
    int counter = 0;
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(0);
    while (!stack.isEmpty()) {
      pBudget.tick();
      int current = stack.pop();
      preorder[current] = counter;
      order[counter] = current;
      counter++;
      List<Integer> currentChildren = children.get(current);
      for (int i = currentChildren.size() - 1; i >= 0; i--) {
        stack.push(currentChildren.get(i));
      }
    }
    int[] subtreeSize = new int[n];
    Arrays.fill(subtreeSize, 1);
    for (int k = n - 1; k > 0; k--) {
      subtreeSize[idom[order[k]]] += subtreeSize[order[k]];
    }
    int[] lastDescendant = new int[n];
    for (int i = 0; i < n; i++) {
      lastDescendant[i] = preorder[i] + subtreeSize[i] - 1;
    }

    ImmutableList<ImmutableSortedSet<Integer>> frontiers =
        computeFrontiers(pGraph, rpo, indexOf, idom, pBudget);

    return new DominatorTree(rpo, indexOf, idom, preorder, lastDescendant, frontiers);
  }

  private static int[] computeImmediateDominators(
      ControlFlowGraph pGraph,
      ImmutableList<Integer> pRpo,
      ImmutableMap<Integer, Integer> pIndexOf,
      WorkBudget pBudget)
      throws StructuringLimitExceededException {
    int n = pRpo.size();
    int[] idom = new int[n];
    Arrays.fill(idom, UNDEFINED);
    idom[0] = 0;

    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = 1; i < n; i++) {
        int newIdom = UNDEFINED;
        for (int pred : pGraph.getPredecessors(pRpo.get(i))) {
          pBudget.tick();
          int p = pIndexOf.get(pred);
          if (idom[p] == UNDEFINED) {
            continue; // not processed yet
          }
          newIdom = newIdom == UNDEFINED ? p : intersect(idom, p, newIdom);
        }
        verify(newIdom != UNDEFINED, "block %s without processed predecessor", pRpo.get(i));
        if (idom[i] != newIdom) {
          idom[i] = newIdom;
          changed = true;
        }
      }
    }
    return idom;
  }

  private static int intersect(int[] pIdom, int pFirst, int pSecond) {
    int finger1 = pFirst;
    int finger2 = pSecond;
    while (finger1 != finger2) {
      while (finger1 > finger2) {
        finger1 = pIdom[finger1];
      }
      while (finger2 > finger1) {
        finger2 = pIdom[finger2];
      }
    }
    return finger1;
  }

  private static ImmutableList<ImmutableSortedSet<Integer>> computeFrontiers(
      ControlFlowGraph pGraph,
      ImmutableList<Integer> pRpo,
      ImmutableMap<Integer, Integer> pIndexOf,
      int[] pIdom,
      WorkBudget pBudget)
      throws StructuringLimitExceededException {
    int n = pRpo.size();
    List<SortedSet<Integer>> frontiers = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      frontiers.add(new TreeSet<>());
    }

    for (int i = 0; i < n; i++) {
      int block = pRpo.get(i);
      List<Integer> preds = pGraph.getPredecessors(block);
      boolean isEntry = i == 0;
      if (preds.size() + (isEntry ? 1 : 0) < 2) {
        continue;
      }
      int stop = isEntry ? UNDEFINED : pIdom[i];
      for (int pred : preds) {
        int runner = pIndexOf.get(pred);
        while (runner != stop) {
          pBudget.tick();
          frontiers.get(runner).add(block);
          runner = runner == 0 ? UNDEFINED : pIdom[runner];
        }
      }
    }

    ImmutableList.Builder<ImmutableSortedSet<Integer>> result = ImmutableList.builder();
    for (SortedSet<Integer> frontier : frontiers) {
      result.add(ImmutableSortedSet.copyOfSorted(frontier));
    }
    return result.build();
  }

  private int index(int pBlock) {
    Integer index = indexOf.get(pBlock);
    checkArgument(index != null, "block %s is not part of the graph", pBlock);
    return index;
  }

  public int getEntry() {
    return reversePostorder.get(0);
  }

  /** Returns the immediate dominator of a block, which is empty only for the entry block. */
  public Optional<Integer> getImmediateDominator(int pBlock) {
    int i = index(pBlock);
    return i == 0 ? Optional.empty() : Optional.of(reversePostorder.get(idom[i]));
  }

  /** Returns whether every path from the entry to block b passes block a (reflexive). */
  public boolean dominates(int pA, int pB) {
    int a = index(pA);
    int b = index(pB);
    return preorder[a] <= preorder[b] && preorder[b] <= lastDescendant[a];
  }

  public boolean strictlyDominates(int pA, int pB) {
    return pA != pB && dominates(pA, pB);
  }

  /**
   * Returns the dominance frontier of a block: all blocks y such that the block dominates a
   * predecessor of y, but does not strictly dominate y.
   */
  public ImmutableSortedSet<Integer> getDominanceFrontier(int pBlock) {
    return frontiers.get(index(pBlock));
  }

  /** Returns the blocks whose immediate dominator is the given block, in reverse postorder. */
  public ImmutableList<Integer> getChildren(int pBlock) {
    int parent = index(pBlock);
    ImmutableList.Builder<Integer> children = ImmutableList.builder();
    for (int i = 1; i < idom.length; i++) {
      if (idom[i] == parent) {
        children.add(reversePostorder.get(i));
      }
    }
    return children.build();
  }

  public ImmutableList<Integer> getReversePostorder() {
    return reversePostorder;
  }

  public int getReversePostorderIndex(int pBlock) {
    return index(pBlock);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("DominatorTree {");
    for (int i = 1; i < idom.length; i++) {
      sb.append(' ')
          .append(reversePostorder.get(idom[i]))
          .append("->")
          .append(reversePostorder.get(i));
    }
    return sb.append(" }").toString();
  }
}
