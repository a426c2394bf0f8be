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
 * Groups rows by key channels and computes aggregates. Output columns are the grouping keys
 * followed by one column per aggregate.
 */
@Getter
public class AggregationNode extends SingleSourceNode {

  /** Which half of a split aggregation this node computes. */
  public enum Step {
    /** Raw input, intermediate output. */
    PARTIAL,

    /** Intermediate input, intermediate output. */
    INTERMEDIATE,

    /** Intermediate input, final output. */
    FINAL,

    /** Raw input, final output. */
    SINGLE;

    /** Returns true if this step reads intermediate results rather than raw rows. */
    public boolean isInputIntermediate() {
      return this == INTERMEDIATE || this == FINAL;
    }
  }

  private final Step step;
  private final List<Integer> groupingKeys;
  private final List<AggregateCall> aggregates;
  private final RelDataType outputType;

  public AggregationNode(
      String id,
      PlanNode source,
      Step step,
      List<Integer> groupingKeys,
      List<AggregateCall> aggregates,
      RelDataType outputType) {
    super(id, source);
    this.step = Preconditions.checkNotNull(step, "step");
    this.groupingKeys = ImmutableList.copyOf(groupingKeys);
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    Preconditions.checkArgument(
        outputType.getFieldCount() == groupingKeys.size() + aggregates.size(),
        "Aggregation %s: row type has %s columns, expected %s",
        id,
        outputType.getFieldCount(),
        groupingKeys.size() + aggregates.size());
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAggregation(this, context);
  }

  @Override
  public String toString() {
    return super.toString() + "(" + step + ")";
  }
}
