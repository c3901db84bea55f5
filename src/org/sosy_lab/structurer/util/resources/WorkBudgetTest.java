// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurer.util.resources;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.sosy_lab.structurer.exceptions.StructuringLimitExceededException;

public class WorkBudgetTest {

  @Test
  public void testWithinLimit() throws StructuringLimitExceededException {
    WorkBudget budget = new WorkBudget(10);
    budget.tick();
    budget.tick(9);
    assertThat(budget.getSteps()).isEqualTo(10L);
  }

  @Test
  public void testExceededReportsPhase() throws StructuringLimitExceededException {
    WorkBudget budget = new WorkBudget(3);
    budget.enterPhase("loops");
    budget.tick(2);

    StructuringLimitExceededException e =
        assertThrows(StructuringLimitExceededException.class, () -> budget.tick(2));
    assertThat(e.getPhase()).isEqualTo("loops");
    assertThat(e.getResource()).isEqualTo("step");
    assertThat(e.getSteps()).isEqualTo(4L);
    assertThat(e.getLimit()).isEqualTo(3L);
  }

  @Test
  public void testNestingLimit() throws StructuringLimitExceededException {
    WorkBudget budget = new WorkBudget(10, 2);
    budget.enterPhase("structuring");
    budget.enterNesting();
    budget.enterNesting();
    budget.exitNesting();
    budget.enterNesting();

    StructuringLimitExceededException e =
        assertThrows(StructuringLimitExceededException.class, budget::enterNesting);
    assertThat(e.getResource()).isEqualTo("nesting depth");
    assertThat(e.getSteps()).isEqualTo(3L);
    assertThat(e.getLimit()).isEqualTo(2L);
    assertThat(budget.getSteps()).isEqualTo(0L);
  }

  @Test
  public void testNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> new WorkBudget(0));
    assertThrows(IllegalArgumentException.class, () -> new WorkBudget(10, 0));
    assertThrows(IllegalStateException.class, () -> new WorkBudget(10).exitNesting());
  }
}
