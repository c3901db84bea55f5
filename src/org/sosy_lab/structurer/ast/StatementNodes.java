// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.Traverser;
import org.sosy_lab.structurer.exceptions.NoException;

/** Helper methods for traversing statement trees. */
public final class StatementNodes {

  private static final StatementVisitor<ImmutableList<StatementNode>, NoException>
      CHILDREN_VISITOR = new ChildrenVisitor();

  private StatementNodes() {}

  /** Returns the direct children of a node, with the else branch after the then branch. */
  public static ImmutableList<StatementNode> childrenOf(StatementNode pNode) {
    return pNode.accept(CHILDREN_VISITOR);
  }

  /** Returns the node and all nodes below it, in depth-first preorder. */
  public static FluentIterable<StatementNode> preorder(StatementNode pNode) {
    return FluentIterable.from(
        Traverser.<StatementNode>forTree(StatementNodes::childrenOf).depthFirstPreOrder(pNode));
  }

  public static <T extends StatementNode> FluentIterable<T> collect(
      StatementNode pNode, Class<T> pType) {
    return preorder(pNode).filter(pType);
  }

  private static final class ChildrenVisitor
      implements StatementVisitor<ImmutableList<StatementNode>, NoException> {

    @Override
    public ImmutableList<StatementNode> visit(SequenceNode pNode) {
      return pNode.getStatements();
    }

    @Override
    public ImmutableList<StatementNode> visit(BlockStatementNode pNode) {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<StatementNode> visit(IfNode pNode) {
      if (pNode.getElseBranch().isPresent()) {
        return ImmutableList.of(pNode.getThenBranch(), pNode.getElseBranch().orElseThrow());
      }
      return ImmutableList.of(pNode.getThenBranch());
    }

    @Override
    public ImmutableList<StatementNode> visit(LoopNode pNode) {
      return ImmutableList.of(pNode.getBody());
    }

    @Override
    public ImmutableList<StatementNode> visit(SwitchNode pNode) {
      return FluentIterable.from(pNode.getCaseGroups())
          .<StatementNode>transform(CaseGroup::getBody)
          .toList();
    }

    @Override
    public ImmutableList<StatementNode> visit(BreakNode pNode) {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<StatementNode> visit(ContinueNode pNode) {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<StatementNode> visit(GotoNode pNode) {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<StatementNode> visit(ReturnNode pNode) {
      return ImmutableList.of();
    }
  }
}
