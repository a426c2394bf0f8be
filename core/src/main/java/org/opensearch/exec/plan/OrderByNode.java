/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/** Sorts all of its input. */
@Getter
public class OrderByNode extends SingleSourceNode {

  private final List<SortKey> sortKeys;
  private final boolean partial;

  public OrderByNode(String id, PlanNode source, List<SortKey> sortKeys, boolean partial) {
    super(id, source);
    Preconditions.checkArgument(!sortKeys.isEmpty(), "OrderBy %s requires sort keys", id);
    this.sortKeys = ImmutableList.copyOf(sortKeys);
    this.partial = partial;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitOrderBy(this, context);
  }
}
