/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Hands the task's result to its output buffer, split into partitions by the hash of the key
 * channels. Without keys every row goes to partition 0.
 */
@Getter
public class PartitionedOutputNode extends SingleSourceNode {

  private final List<Integer> partitionKeys;
  private final int numPartitions;

  public PartitionedOutputNode(
      String id, PlanNode source, List<Integer> partitionKeys, int numPartitions) {
    super(id, source);
    Preconditions.checkArgument(
        numPartitions > 0, "PartitionedOutput %s needs at least one partition", id);
    this.partitionKeys = ImmutableList.copyOf(partitionKeys);
    this.numPartitions = numPartitions;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitPartitionedOutput(this, context);
  }
}
