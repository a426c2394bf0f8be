/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import lombok.Getter;

/** Skips {@code offset} rows, then passes at most {@code count} rows. */
@Getter
public class LimitNode extends SingleSourceNode {

  private final long offset;
  private final long count;
  private final boolean partial;

  public LimitNode(String id, PlanNode source, long offset, long count, boolean partial) {
    super(id, source);
    Preconditions.checkArgument(offset >= 0, "Limit %s offset must be non-negative", id);
    Preconditions.checkArgument(count >= 0, "Limit %s count must be non-negative", id);
    this.offset = offset;
    this.count = count;
    this.partial = partial;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
