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

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.plan.SortKey;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TopNOperatorTest {

  @Test
  void should_keep_smallest_rows_in_order() {
    TopNOperator topN =
        new TopNOperator(operatorContext("topN"), List.of(SortKey.ascending(0)), 2);

    assertEquals(
        List.of(List.of(1L), List.of(2L)),
        runRows(topN, page(row(5L), row(2L)), page(row(9L), row(1L), row(3L))));
  }

  @Test
  void should_keep_largest_rows_when_descending() {
    TopNOperator topN =
        new TopNOperator(operatorContext("topN"), List.of(SortKey.descending(0)), 3);

    assertEquals(
        List.of(List.of(9L), List.of(5L), List.of(3L)),
        runRows(topN, page(row(5L), row(2L)), page(row(9L), row(1L), row(3L))));
  }

  @Test
  void should_return_every_row_when_fewer_than_count() {
    TopNOperator topN =
        new TopNOperator(operatorContext("topN"), List.of(SortKey.ascending(0)), 10);

    assertEquals(List.of(List.of(1L), List.of(2L)), runRows(topN, page(row(2L), row(1L))));
  }

  @Test
  void should_finish_without_output_for_empty_input() {
    TopNOperator topN =
        new TopNOperator(operatorContext("topN"), List.of(SortKey.ascending(0)), 1);

    assertTrue(run(topN).isEmpty());
    assertTrue(topN.isFinished());
  }
}
