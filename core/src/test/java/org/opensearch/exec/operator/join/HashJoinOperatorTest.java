/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.OperatorHarness.run;
import static org.opensearch.exec.testing.OperatorHarness.runRows;
import static org.opensearch.exec.testing.TestingPlans.bigintRow;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;
import static org.opensearch.exec.testing.TestingPlans.values;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.plan.HashJoinNode;
import org.opensearch.exec.plan.JoinType;
import org.opensearch.exec.task.HashJoinBridge;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashJoinOperatorTest {

  private final HashJoinBridge bridge = new HashJoinBridge("join");

  @Test
  void should_block_probe_until_every_builder_finished() {
    // Given: two build drivers
    HashBuildOperator first =
        new HashBuildOperator(operatorContext("join"), bridge, List.of(0));
    HashBuildOperator second =
        new HashBuildOperator(operatorContext("join"), bridge, List.of(0));
    HashProbeOperator probe =
        new HashProbeOperator(operatorContext("join"), join(JoinType.INNER), bridge);

    // When
    run(first, page(row(1L, "x")));

    // Then
    assertFalse(probe.isBlocked().isDone());
    assertFalse(probe.needsInput());
    run(second, page(row(2L, "y")));
    assertTrue(probe.isBlocked().isDone());
    assertTrue(probe.needsInput());
  }

  @Test
  void should_emit_every_match_of_inner_join() {
    build(page(row(1L, "x"), row(1L, "z"), row(2L, "y")));
    HashProbeOperator probe =
        new HashProbeOperator(operatorContext("join"), join(JoinType.INNER), bridge);

    assertEquals(
        List.of(List.of(1L, "a", 1L, "x"), List.of(1L, "a", 1L, "z")),
        runRows(probe, page(row(1L, "a"), row(3L, "b"))));
  }

  @Test
  void should_pad_unmatched_probe_rows_of_left_join() {
    build(page(row(1L, "x")));
    HashProbeOperator probe =
        new HashProbeOperator(operatorContext("join"), join(JoinType.LEFT), bridge);

    assertEquals(
        List.of(Arrays.asList(1L, "a", 1L, "x"), Arrays.asList(3L, "b", null, null)),
        runRows(probe, page(row(1L, "a"), row(3L, "b"))));
  }

  @Test
  void should_never_match_null_keys() {
    build(page(row(null, "x")));
    HashProbeOperator inner =
        new HashProbeOperator(operatorContext("join"), join(JoinType.INNER), bridge);

    assertTrue(run(inner, page(row(null, "a"))).isEmpty());
  }

  private void build(Page... pages) {
    HashBuildOperator builder =
        new HashBuildOperator(operatorContext("join"), bridge, List.of(0));
    run(builder, pages);
  }

  private static HashJoinNode join(JoinType joinType) {
    return new HashJoinNode(
        "join",
        joinType,
        List.of(0),
        List.of(0),
        values("left", 2),
        values("right", 2),
        bigintRow(4));
  }
}
