/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.OperatorHarness.runRows;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LimitOperatorTest {

  @Test
  void should_keep_first_rows_across_pages() {
    LimitOperator limit = new LimitOperator(operatorContext("limit"), 0, 3);

    assertEquals(
        List.of(List.of(1L), List.of(2L), List.of(3L)),
        runRows(limit, page(row(1L), row(2L)), page(row(3L), row(4L)), page(row(5L))));
  }

  @Test
  void should_skip_offset_rows() {
    LimitOperator limit = new LimitOperator(operatorContext("limit"), 3, 2);

    assertEquals(
        List.of(List.of(4L), List.of(5L)),
        runRows(limit, page(row(1L), row(2L)), page(row(3L), row(4L)), page(row(5L), row(6L))));
  }

  @Test
  void should_finish_without_input_once_count_is_reached() {
    LimitOperator limit = new LimitOperator(operatorContext("limit"), 0, 1);

    limit.addInput(page(row(1L), row(2L)));
    assertFalse(limit.needsInput());
    assertFalse(limit.isFinished());
    limit.getOutput();

    assertTrue(limit.isFinished());
  }

  @Test
  void should_finish_immediately_for_zero_count() {
    LimitOperator limit = new LimitOperator(operatorContext("limit"), 0, 0);

    assertFalse(limit.needsInput());
    assertTrue(limit.isFinished());
  }
}
