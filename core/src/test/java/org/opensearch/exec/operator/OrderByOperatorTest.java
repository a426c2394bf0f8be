/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.OperatorHarness.run;
import static org.opensearch.exec.testing.OperatorHarness.runRows;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.plan.SortKey;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OrderByOperatorTest {

  @Test
  void should_sort_every_row_after_input_ends() {
    OrderByOperator orderBy =
        new OrderByOperator(
            operatorContext("orderBy"), List.of(SortKey.ascending(0), SortKey.descending(1)));

    assertEquals(
        List.of(List.of(1L, "b"), List.of(1L, "a"), List.of(2L, "c"), List.of(3L, "a")),
        runRows(orderBy, page(row(3L, "a"), row(1L, "a")), page(row(2L, "c"), row(1L, "b"))));
  }

  @Test
  void should_put_nulls_last_in_both_directions() {
    OrderByOperator ascending =
        new OrderByOperator(operatorContext("orderBy"), List.of(SortKey.ascending(0)));
    OrderByOperator descending =
        new OrderByOperator(operatorContext("orderBy"), List.of(SortKey.descending(0)));

    assertEquals(
        Arrays.asList(List.of(1L), List.of(2L), Arrays.asList((Object) null)),
        runRows(ascending, page(row(2L), row((Object) null), row(1L))));
    assertEquals(
        Arrays.asList(List.of(2L), List.of(1L), Arrays.asList((Object) null)),
        runRows(descending, page(row(2L), row((Object) null), row(1L))));
  }

  @Test
  void should_put_nulls_first_when_asked() {
    OrderByOperator orderBy =
        new OrderByOperator(operatorContext("orderBy"), List.of(new SortKey(0, false, false)));

    assertEquals(
        Arrays.asList(Arrays.asList((Object) null), List.of(1L), List.of(2L)),
        runRows(orderBy, page(row(2L), row((Object) null), row(1L))));
  }

  @Test
  void should_emit_nothing_for_empty_input() {
    OrderByOperator orderBy =
        new OrderByOperator(operatorContext("orderBy"), List.of(SortKey.ascending(0)));

    assertTrue(run(orderBy).isEmpty());
    assertTrue(orderBy.isFinished());
  }
}
