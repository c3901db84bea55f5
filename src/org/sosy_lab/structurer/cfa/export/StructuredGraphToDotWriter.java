// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.export;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurer.cfa.loops.NaturalLoop;
import org.sosy_lab.structurer.cfa.model.BasicBlock;
import org.sosy_lab.structurer.cfa.model.BlockEdge;
import org.sosy_lab.structurer.cfa.model.ControlFlowGraph;
import org.sosy_lab.structurer.cfa.model.TerminatorKind;
import org.sosy_lab.structurer.cfa.structure.Region;
import org.sosy_lab.structurer.core.StructuringResult;

/** This Writer can dump a control-flow graph with its contracted regions into a dot file. */
public class StructuredGraphToDotWriter {

  private static final String[] BACKGROUND = new String[] {"white", "lightgrey", "grey"};

  private final ControlFlowGraph graph;
  private final ImmutableList<Region> regions;
  private final ImmutableSet<Integer> loopHeaders;
  private final ImmutableSet<BlockEdge> backEdges;

  /** children of each region, by index in {@link #regions} */
  private final ListMultimap<Integer, Integer> innerRegions =
      MultimapBuilder.treeKeys().arrayListValues().build();

  private int clusterIndex = 0;

  public StructuredGraphToDotWriter(ControlFlowGraph pGraph, StructuringResult pResult) {
    graph = checkNotNull(pGraph);
    regions = pResult.getRegions();

    ImmutableSet.Builder<Integer> headers = ImmutableSet.builder();
    ImmutableSet.Builder<BlockEdge> back = ImmutableSet.builder();
    for (NaturalLoop loop : pResult.getLoops()) {
      if (loop.isReducible()) {
        headers.add(loop.getHeader());
      }
      back.addAll(loop.getBackEdges());
    }
    loopHeaders = headers.build();
    backEdges = back.build();

    // regions are contracted inside out, so the parent of a region comes later in the list
    for (int i = 0; i < regions.size() - 1; i++) {
      int parent = -1;
      for (int j = i + 1; j < regions.size(); j++) {
        if (regions.get(j).encloses(regions.get(i))
            && (parent < 0
                || regions.get(j).getMembers().size() < regions.get(parent).getMembers().size())) {
          parent = j;
        }
      }
      if (parent >= 0) {
        innerRegions.put(parent, i);
      }
    }
  }

  /** dump the graph with its regions into the given file. */
  public void dump(final Path pFile, LogManager pLogger) {
    try {
      MoreFiles.createParentDirectories(pFile);
    } catch (IOException e) {
      pLogger.logUserException(
          Level.WARNING, e, "Could not create parent directories to write regions to dot file");
      return;
    }

    try (Writer w = Files.newBufferedWriter(pFile, StandardCharsets.UTF_8)) {
      write(w);
    } catch (IOException e) {
      pLogger.logUserException(Level.WARNING, e, "Could not write regions to dot file");
    }
  }

  /** dump the graph with nested clusters for its regions. */
  public void write(final Appendable app) throws IOException {
    clusterIndex = 0;
    app.append("digraph structured_CFA {\n");
    final List<BlockEdge> edges = new ArrayList<>();
    final Set<Integer> finished = new HashSet<>();

    if (!regions.isEmpty()) {
      dumpRegion(app, finished, regions.size() - 1, edges, 0);
    }
    // blocks outside of every region, only possible if the outermost region is missing
    for (BasicBlock block : graph.getBlocks()) {
      if (finished.add(block.getId())) {
        app.append(formatNode(block));
        edges.addAll(block.getLeavingEdges());
      }
    }

    // edges come after all nodes and sub-graphs,
    // because Dot draws edges from an inner cluster to an outer one into the wrong cluster
    for (BlockEdge edge : edges) {
      app.append(formatEdge(edge));
    }

    app.append("}\n");
  }

  private void dumpRegion(
      final Appendable app,
      final Set<Integer> finished,
      final int pRegionIndex,
      final List<BlockEdge> edges,
      final int depth)
      throws IOException {
    final Region region = regions.get(pRegionIndex);
    app.append("subgraph cluster_r" + clusterIndex++ + " {\n");
    app.append("style=filled\n");
    app.append("fillcolor=" + BACKGROUND[depth % BACKGROUND.length] + "\n");
    app.append("label=\"" + region.getKind() + " at " + region.getEntry() + "\"\n");

    for (int inner : innerRegions.get(pRegionIndex)) {
      dumpRegion(app, finished, inner, edges, depth + 1);
    }

    // members of inner regions are already finished
    for (int id : region.getMembers()) {
      if (finished.add(id)) {
        BasicBlock block = graph.getBlock(id);
        app.append(formatNode(block));
        edges.addAll(block.getLeavingEdges());
      }
    }

    app.append("}\n");
  }

  private String formatNode(BasicBlock pBlock) {
    String shape = "";
    if (loopHeaders.contains(pBlock.getId())) {
      shape = "shape=doubleoctagon ";
    } else if (pBlock.getTerminator().getKind() == TerminatorKind.CONDITIONAL) {
      shape = "shape=diamond ";
    } else if (pBlock.getTerminator().getKind() == TerminatorKind.DISPATCH) {
      shape = "shape=hexagon ";
    }

    String label =
        "label=\"B" + pBlock.getId() + "\\n" + pBlock.getStatements().size() + " statements\" ";
    return pBlock.getId() + " [" + shape + label + "]\n";
  }

  private String formatEdge(BlockEdge pEdge) {
    StringBuilder sb = new StringBuilder();
    sb.append(pEdge.getSource());
    sb.append(" -> ");
    sb.append(pEdge.getTarget());
    sb.append(" [label=\"");
    sb.append(pEdge.getKind());
    sb.append("\"");
    if (backEdges.contains(pEdge.asBackEdge())) {
      sb.append(" style=\"dashed\"");
    }
    sb.append("]\n");
    return sb.toString();
  }
}
