// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.ast;

/**
 * Visitor over the closed set of {@link StatementNode} subclasses.
 *
 * @param <R> the return type of an evaluation
 * @param <X> the exception thrown by an evaluation
 */
public interface StatementVisitor<R, X extends Exception> {

  R visit(SequenceNode pNode) throws X;

  R visit(BlockStatementNode pNode) throws X;

  R visit(IfNode pNode) throws X;

  R visit(LoopNode pNode) throws X;

  R visit(SwitchNode pNode) throws X;

  R visit(BreakNode pNode) throws X;

  R visit(ContinueNode pNode) throws X;

  R visit(GotoNode pNode) throws X;

  R visit(ReturnNode pNode) throws X;
}
