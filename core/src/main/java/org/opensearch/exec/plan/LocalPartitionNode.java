/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;

/**
 * Redistributes the rows of its sources across the drivers of its own pipeline. Each source runs
 * in a pipeline of its own; rows are routed by the hash of the key channels, or round robin when
 * there are none.
 */
@Getter
public class LocalPartitionNode extends PlanNode {

  private final List<PlanNode> sources;
  private final List<Integer> partitionKeys;

  public LocalPartitionNode(String id, List<PlanNode> sources, List<Integer> partitionKeys) {
    super(id);
    this.sources = ImmutableList.copyOf(sources);
    this.partitionKeys = ImmutableList.copyOf(partitionKeys);
  }

  @Override
  public RelDataType getOutputType() {
    Preconditions.checkState(!sources.isEmpty(), "LocalPartition %s has no sources", getId());
    return sources.get(0).getOutputType();
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLocalPartition(this, context);
  }
}
