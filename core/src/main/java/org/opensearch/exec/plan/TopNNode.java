/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/** Keeps the first {@code count} rows by the sort keys. */
@Getter
public class TopNNode extends SingleSourceNode {

  private final List<SortKey> sortKeys;
  private final int count;
  private final boolean partial;

  public TopNNode(String id, PlanNode source, List<SortKey> sortKeys, int count, boolean partial) {
    super(id, source);
    Preconditions.checkArgument(!sortKeys.isEmpty(), "TopN %s requires sort keys", id);
    Preconditions.checkArgument(count > 0, "TopN %s count must be positive: %s", id, count);
    this.sortKeys = ImmutableList.copyOf(sortKeys);
    this.count = count;
    this.partial = partial;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitTopN(this, context);
  }
}
