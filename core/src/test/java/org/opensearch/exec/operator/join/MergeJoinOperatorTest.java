/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.OperatorHarness.runRows;
import static org.opensearch.exec.testing.TestingPlans.bigintRow;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;
import static org.opensearch.exec.testing.TestingPlans.values;

import com.google.common.util.concurrent.ListenableFuture;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.plan.JoinType;
import org.opensearch.exec.plan.MergeJoinNode;
import org.opensearch.exec.task.PageQueue;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MergeJoinOperatorTest {

  private final PageQueue rightSource = new PageQueue("join", 4, null);

  @Test
  void should_wait_for_whole_right_side_before_reading_left() {
    // Given
    rightSource.addProducer();
    MergeJoinOperator join =
        new MergeJoinOperator(operatorContext("join"), node(JoinType.INNER), rightSource);

    // When
    rightSource.consume(page(row(1L, "x")));

    // Then
    ListenableFuture<Void> blocked = join.isBlocked();
    assertFalse(join.needsInput());
    assertFalse(blocked.isDone());
    rightSource.noMoreData();
    assertTrue(blocked.isDone());
    assertTrue(join.needsInput());
  }

  @Test
  void should_join_left_rows_in_order() {
    rightSource.addProducer();
    rightSource.consume(page(row(1L, "x"), row(2L, "y"), row(2L, "z")));
    rightSource.noMoreData();
    MergeJoinOperator join =
        new MergeJoinOperator(operatorContext("join"), node(JoinType.LEFT), rightSource);

    assertEquals(
        List.of(
            Arrays.asList(1L, "a", 1L, "x"),
            Arrays.asList(2L, "b", 2L, "y"),
            Arrays.asList(2L, "b", 2L, "z"),
            Arrays.asList(3L, "c", null, null)),
        runRows(join, page(row(1L, "a"), row(2L, "b")), page(row(3L, "c"))));
  }

  @Test
  void should_close_right_source() {
    rightSource.addProducer();
    MergeJoinOperator join =
        new MergeJoinOperator(operatorContext("join"), node(JoinType.INNER), rightSource);

    join.close();

    assertTrue(rightSource.isFinished());
  }

  private static MergeJoinNode node(JoinType joinType) {
    return new MergeJoinNode(
        "join",
        joinType,
        List.of(0),
        List.of(0),
        values("left", 2),
        values("right", 2),
        bigintRow(4));
  }
}
