/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.aggregation;

import java.util.List;
import org.opensearch.exec.plan.AggregateCall;
import org.opensearch.exec.plan.AggregationNode;

/** The accumulators of one group. */
class GroupedAccumulators {

  private final Accumulator[] accumulators;

  GroupedAccumulators(AggregationNode node) {
    boolean intermediateInput = node.getStep().isInputIntermediate();
    List<AggregateCall> calls = node.getAggregates();
    this.accumulators = new Accumulator[calls.size()];
    for (int i = 0; i < accumulators.length; i++) {
      accumulators[i] = new Accumulator(calls.get(i), intermediateInput);
    }
  }

  void add(Object[] row) {
    for (Accumulator accumulator : accumulators) {
      accumulator.add(row);
    }
  }

  /** Returns the output row: grouping key values followed by one result per aggregate. */
  Object[] toRow(List<Object> groupKey) {
    Object[] row = new Object[groupKey.size() + accumulators.length];
    for (int i = 0; i < groupKey.size(); i++) {
      row[i] = groupKey.get(i);
    }
    for (int i = 0; i < accumulators.length; i++) {
      row[groupKey.size() + i] = accumulators[i].result();
    }
    return row;
  }
}
