/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/** Aggregation over input already clustered on the grouping keys; emits each group once done. */
public class StreamingAggregationNode extends AggregationNode {

  public StreamingAggregationNode(
      String id,
      PlanNode source,
      Step step,
      List<Integer> groupingKeys,
      List<AggregateCall> aggregates,
      RelDataType outputType) {
    super(id, source, step, groupingKeys, aggregates, outputType);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitStreamingAggregation(this, context);
  }
}
