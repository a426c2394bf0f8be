/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.OperatorHarness.runRows;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.exception.QueryEngineException;
import org.opensearch.exec.page.RowPage;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EnforceSingleRowOperatorTest {

  @Test
  void should_pass_single_row_through() {
    EnforceSingleRowOperator operator =
        new EnforceSingleRowOperator(operatorContext("single"), 2);

    assertEquals(List.of(List.of(1L, 2L)), runRows(operator, RowPage.empty(2), page(row(1L, 2L))));
  }

  @Test
  void should_produce_null_row_for_empty_input() {
    EnforceSingleRowOperator operator =
        new EnforceSingleRowOperator(operatorContext("single"), 2);

    assertEquals(List.of(Arrays.asList(null, null)), runRows(operator));
  }

  @Test
  void should_fail_on_second_row() {
    EnforceSingleRowOperator operator =
        new EnforceSingleRowOperator(operatorContext("single"), 1);
    operator.addInput(page(row(1L)));

    QueryEngineException exception =
        assertThrows(QueryEngineException.class, () -> operator.addInput(page(row(2L))));
    assertEquals("Expected single row of input. Received 2 rows.", exception.getMessage());
  }
}
