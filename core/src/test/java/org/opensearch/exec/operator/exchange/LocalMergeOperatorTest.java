/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;
import static org.opensearch.exec.testing.TestingPlans.rows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.plan.SortKey;
import org.opensearch.exec.task.PageQueue;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LocalMergeOperatorTest {

  private PageQueue first;
  private PageQueue second;

  @BeforeEach
  void setUp() {
    first = new PageQueue("merge/0", 4, null);
    second = new PageQueue("merge/1", 4, null);
    first.addProducer();
    second.addProducer();
  }

  @Test
  void should_merge_sorted_sources_into_one_sorted_stream() {
    // Given
    first.consume(page(row(1L), row(4L)));
    first.consume(page(row(6L)));
    first.noMoreData();
    second.consume(page(row(2L), row(3L), row(5L)));
    second.noMoreData();
    LocalMergeOperator merge = merge(1024);

    // When
    List<Page> output = drain(merge);

    // Then
    assertEquals(
        List.of(List.of(1L), List.of(2L), List.of(3L), List.of(4L), List.of(5L), List.of(6L)),
        rows(output));
    assertTrue(merge.isFinished());
  }

  @Test
  void should_block_until_every_unfinished_source_has_a_row() {
    // Given: only the first source has data
    first.consume(page(row(1L)));
    LocalMergeOperator merge = merge(1024);

    // When
    Page output = merge.getOutput();

    // Then
    assertNull(output);
    assertFalse(merge.isBlocked().isDone());
    second.noMoreData();
    assertTrue(merge.isBlocked().isDone());
    first.noMoreData();
    assertEquals(List.of(List.of(1L)), rows(drain(merge)));
  }

  @Test
  void should_cut_output_into_pages_of_configured_size() {
    first.consume(page(row(1L), row(2L), row(3L)));
    first.noMoreData();
    second.noMoreData();

    List<Page> output = drain(merge(2));

    assertEquals(2, output.size());
    assertEquals(2, output.get(0).getPositionCount());
    assertEquals(1, output.get(1).getPositionCount());
  }

  @Test
  void should_close_every_source() {
    merge(1024).close();

    assertTrue(first.isFinished());
    assertTrue(second.isFinished());
  }

  private LocalMergeOperator merge(int outputPageRows) {
    return new LocalMergeOperator(
        operatorContext("merge"),
        List.of(first, second),
        List.of(SortKey.ascending(0)),
        1,
        outputPageRows);
  }

  private static List<Page> drain(LocalMergeOperator merge) {
    List<Page> output = new ArrayList<>();
    while (!merge.isFinished() && merge.isBlocked().isDone()) {
      Page page = merge.getOutput();
      if (page != null) {
        output.add(page);
      }
    }
    return output;
  }
}
