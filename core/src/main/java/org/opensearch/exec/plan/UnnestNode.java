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
 * Expands collection-valued channels into rows. Output columns are the replicated channels
 * followed by one element column per unnested channel; shorter collections are padded with nulls.
 */
@Getter
public class UnnestNode extends SingleSourceNode {

  private final List<Integer> replicateChannels;
  private final List<Integer> unnestChannels;
  private final RelDataType outputType;

  public UnnestNode(
      String id,
      PlanNode source,
      List<Integer> replicateChannels,
      List<Integer> unnestChannels,
      RelDataType outputType) {
    super(id, source);
    Preconditions.checkArgument(!unnestChannels.isEmpty(), "Unnest %s requires channels", id);
    this.replicateChannels = ImmutableList.copyOf(replicateChannels);
    this.unnestChannels = ImmutableList.copyOf(unnestChannels);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    Preconditions.checkArgument(
        outputType.getFieldCount() == replicateChannels.size() + unnestChannels.size(),
        "Unnest %s: row type has %s columns, expected %s",
        id,
        outputType.getFieldCount(),
        replicateChannels.size() + unnestChannels.size());
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnnest(this, context);
  }
}
