/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/** Merges sorted remote streams into one sorted stream. */
public class MergeExchangeNode extends ExchangeNode {

  private final List<SortKey> sortKeys;

  public MergeExchangeNode(String id, RelDataType outputType, List<SortKey> sortKeys) {
    super(id, outputType);
    Preconditions.checkArgument(!sortKeys.isEmpty(), "MergeExchange %s requires sort keys", id);
    this.sortKeys = ImmutableList.copyOf(sortKeys);
  }

  public List<SortKey> getSortKeys() {
    return sortKeys;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitMergeExchange(this, context);
  }
}
