// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.exceptions;

/**
 * Exception that is never thrown. Use it as the exception type parameter of visitors that cannot
 * fail.
 */
public final class NoException extends RuntimeException {

  private static final long serialVersionUID = -8186542497658213218L;

  private NoException() {}
}
