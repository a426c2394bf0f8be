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
 * Merges the sorted outputs of every driver of its source pipeline into one sorted stream. Its
 * source always runs in a pipeline of its own.
 */
@Getter
public class LocalMergeNode extends PlanNode {

  private final List<SortKey> sortKeys;
  private final List<PlanNode> sources;

  public LocalMergeNode(String id, List<SortKey> sortKeys, List<PlanNode> sources) {
    super(id);
    Preconditions.checkArgument(!sortKeys.isEmpty(), "LocalMerge %s requires sort keys", id);
    this.sortKeys = ImmutableList.copyOf(sortKeys);
    this.sources = ImmutableList.copyOf(sources);
  }

  @Override
  public RelDataType getOutputType() {
    Preconditions.checkState(!sources.isEmpty(), "LocalMerge %s has no sources", getId());
    return sources.get(0).getOutputType();
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLocalMerge(this, context);
  }
}
