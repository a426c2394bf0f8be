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
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.task.CrossJoinBridge;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CrossJoinOperatorTest {

  private final CrossJoinBridge bridge = new CrossJoinBridge("cross");

  @Test
  void should_pair_every_probe_row_with_every_build_row() {
    CrossJoinBuildOperator build = new CrossJoinBuildOperator(operatorContext("cross"), bridge);
    CrossJoinProbeOperator probe =
        new CrossJoinProbeOperator(operatorContext("cross"), bridge, 1);
    assertFalse(probe.needsInput());

    run(build, page(row("x")), page(row("y")));

    assertTrue(probe.isBlocked().isDone());
    assertEquals(
        List.of(List.of(1L, "x"), List.of(1L, "y"), List.of(2L, "x"), List.of(2L, "y")),
        runRows(probe, page(row(1L), row(2L))));
  }

  @Test
  void should_emit_nothing_for_empty_build_side() {
    CrossJoinBuildOperator build = new CrossJoinBuildOperator(operatorContext("cross"), bridge);
    CrossJoinProbeOperator probe =
        new CrossJoinProbeOperator(operatorContext("cross"), bridge, 1);

    run(build);

    assertTrue(run(probe, page(row(1L))).isEmpty());
    assertTrue(probe.isFinished());
  }
}
