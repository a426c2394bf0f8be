/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.planner;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.TestingPlans.bigintRow;
import static org.opensearch.exec.testing.TestingPlans.values;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.expression.Literal;
import org.opensearch.exec.plan.CrossJoinNode;
import org.opensearch.exec.plan.FilterNode;
import org.opensearch.exec.plan.HashJoinNode;
import org.opensearch.exec.plan.JoinType;
import org.opensearch.exec.plan.LocalMergeNode;
import org.opensearch.exec.plan.LocalPartitionNode;
import org.opensearch.exec.plan.PlanNode;
import org.opensearch.exec.plan.SortKey;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PipelineBoundaryPolicyTest {

  private final PlanNode left = values("left", 1);
  private final PlanNode right = values("right", 1);

  @Test
  void should_cut_every_source_of_local_merge() {
    LocalMergeNode merge =
        new LocalMergeNode("merge", List.of(SortKey.ascending(0)), List.of(left));

    assertTrue(PipelineBoundaryPolicy.mustStartNewPipeline(merge, 0));
  }

  @Test
  void should_cut_every_source_of_local_partition() {
    LocalPartitionNode partition =
        new LocalPartitionNode("partition", List.of(left, right), List.of());

    assertTrue(PipelineBoundaryPolicy.mustStartNewPipeline(partition, 0));
    assertTrue(PipelineBoundaryPolicy.mustStartNewPipeline(partition, 1));
  }

  @Test
  void should_keep_first_source_of_join_in_pipeline() {
    HashJoinNode join =
        new HashJoinNode(
            "join", JoinType.INNER, List.of(0), List.of(0), left, right, bigintRow(2));
    CrossJoinNode cross = new CrossJoinNode("cross", left, right, bigintRow(2));

    assertFalse(PipelineBoundaryPolicy.mustStartNewPipeline(join, 0));
    assertTrue(PipelineBoundaryPolicy.mustStartNewPipeline(join, 1));
    assertFalse(PipelineBoundaryPolicy.mustStartNewPipeline(cross, 0));
    assertTrue(PipelineBoundaryPolicy.mustStartNewPipeline(cross, 1));
  }

  @Test
  void should_not_cut_single_source_node() {
    FilterNode filter = new FilterNode("filter", left, Literal.TRUE);

    assertFalse(PipelineBoundaryPolicy.mustStartNewPipeline(filter, 0));
  }
}
