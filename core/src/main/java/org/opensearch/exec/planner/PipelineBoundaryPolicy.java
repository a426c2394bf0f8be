/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.planner;

import lombok.experimental.UtilityClass;
import org.opensearch.exec.plan.LocalMergeNode;
import org.opensearch.exec.plan.LocalPartitionNode;
import org.opensearch.exec.plan.PlanNode;

/** Decides where the plan tree is cut into pipelines. */
@UtilityClass
public class PipelineBoundaryPolicy {

  /**
   * Returns true if the source at {@code sourceIndex} of {@code node} runs in a pipeline of its
   * own. Local merges and local partitions read every source from another pipeline; any other
   * node continues its pipeline with its first source only.
   */
  public static boolean mustStartNewPipeline(PlanNode node, int sourceIndex) {
    if (node instanceof LocalMergeNode || node instanceof LocalPartitionNode) {
      return true;
    }
    return sourceIndex != 0;
  }
}
