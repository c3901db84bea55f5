// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.cfa.structure;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.sosy_lab.structurer.ast.BlockStatementNode;
import org.sosy_lab.structurer.ast.BreakNode;
import org.sosy_lab.structurer.ast.CaseGroup;
import org.sosy_lab.structurer.ast.ContinueNode;
import org.sosy_lab.structurer.ast.GotoNode;
import org.sosy_lab.structurer.ast.IfNode;
import org.sosy_lab.structurer.ast.LoopNode;
import org.sosy_lab.structurer.ast.ReturnNode;
import org.sosy_lab.structurer.ast.SequenceNode;
import org.sosy_lab.structurer.ast.StatementNode;
import org.sosy_lab.structurer.ast.StatementVisitor;
import org.sosy_lab.structurer.ast.SwitchNode;
import org.sosy_lab.structurer.exceptions.NoException;

/**
 * Last pass over the statement tree: labels the targets of gotos, drops empty block statements
 * without label, and flattens nested sequences.
 */
final class TreeFinisher implements StatementVisitor<StatementNode, NoException> {

  private final ImmutableSet<Integer> gotoTargets;

  TreeFinisher(Set<Integer> pGotoTargets) {
    gotoTargets = ImmutableSet.copyOf(pGotoTargets);
  }

  SequenceNode finish(SequenceNode pBody) {
    return finishSequence(pBody);
  }

  private SequenceNode finishSequence(SequenceNode pSequence) {
    List<StatementNode> result = new ArrayList<>(pSequence.size());
    for (StatementNode statement : pSequence.getStatements()) {
      StatementNode finished = statement.accept(this);
      if (finished instanceof SequenceNode) {
        result.addAll(((SequenceNode) finished).getStatements());
      } else if (!isEmptyUnlabeledBlock(finished)) {
        result.add(finished);
      }
    }
    return SequenceNode.copyOf(result);
  }

  private static boolean isEmptyUnlabeledBlock(StatementNode pNode) {
    if (!(pNode instanceof BlockStatementNode)) {
      return false;
    }
    BlockStatementNode block = (BlockStatementNode) pNode;
    return block.getStatements().isEmpty() && !block.isLabeled();
  }

  @Override
  public StatementNode visit(SequenceNode pNode) {
    return finishSequence(pNode);
  }

  @Override
  public StatementNode visit(BlockStatementNode pNode) {
    return gotoTargets.contains(pNode.getBlockId()) ? pNode.withLabel() : pNode;
  }

  @Override
  public StatementNode visit(IfNode pNode) {
    return new IfNode(
        pNode.getBlockId(),
        pNode.getTest(),
        pNode.isNegated(),
        finishSequence(pNode.getThenBranch()),
        pNode.getElseBranch().map(this::finishSequence));
  }

  @Override
  public StatementNode visit(LoopNode pNode) {
    return new LoopNode(
        pNode.getHeaderId(),
        pNode.getKind(),
        pNode.getTestStatements(),
        pNode.getTest(),
        pNode.isNegated(),
        finishSequence(pNode.getBody()),
        pNode.getLabel());
  }

  @Override
  public StatementNode visit(SwitchNode pNode) {
    List<CaseGroup> groups = new ArrayList<>(pNode.getCaseGroups().size());
    for (CaseGroup group : pNode.getCaseGroups()) {
      groups.add(
          new CaseGroup(
              group.getLabels(),
              group.isDefault(),
              finishSequence(group.getBody()),
              group.fallsThrough()));
    }
    return new SwitchNode(
        pNode.getBlockId(),
        pNode.getDiscriminant(),
        groups,
        pNode.getMerge(),
        pNode.getLabel(),
        pNode.isIrregular());
  }

  @Override
  public StatementNode visit(BreakNode pNode) {
    return pNode;
  }

  @Override
  public StatementNode visit(ContinueNode pNode) {
    return pNode;
  }

  @Override
  public StatementNode visit(GotoNode pNode) {
    return pNode;
  }

  @Override
  public StatementNode visit(ReturnNode pNode) {
    return pNode;
  }
}
