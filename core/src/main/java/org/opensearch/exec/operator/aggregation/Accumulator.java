/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.aggregation;

import org.opensearch.exec.operator.RowComparator;
import org.opensearch.exec.plan.AggregateCall;

/**
 * State of one aggregate call for one group. Raw input counts non-null values for COUNT (every
 * row when the call has no input channel); intermediate input adds up partial counts. SUM, MIN and
 * MAX combine raw and intermediate values the same way and ignore nulls.
 */
class Accumulator {

  private final AggregateCall call;
  private final boolean intermediateInput;
  private long count;
  private Object value;

  Accumulator(AggregateCall call, boolean intermediateInput) {
    this.call = call;
    this.intermediateInput = intermediateInput;
  }

  void add(Object[] row) {
    Object input = call.inputChannel() < 0 ? null : row[call.inputChannel()];
    switch (call.function()) {
      case COUNT:
        if (intermediateInput) {
          count += input == null ? 0 : ((Number) input).longValue();
        } else if (call.inputChannel() < 0 || input != null) {
          count++;
        }
        break;
      case SUM:
        if (input != null) {
          value = value == null ? widen((Number) input) : sum((Number) value, (Number) input);
        }
        break;
      case MIN:
        if (input != null && (value == null || RowComparator.compareValues(input, value) < 0)) {
          value = input;
        }
        break;
      case MAX:
        if (input != null && (value == null || RowComparator.compareValues(input, value) > 0)) {
          value = input;
        }
        break;
      default:
        throw new IllegalStateException("Unexpected aggregate function: " + call.function());
    }
  }

  Object result() {
    return call.function() == AggregateCall.Function.COUNT ? (Object) count : value;
  }

  private static Number widen(Number number) {
    return isFloating(number) ? (Number) number.doubleValue() : (Number) number.longValue();
  }

  private static Number sum(Number left, Number right) {
    if (isFloating(left) || isFloating(right)) {
      return left.doubleValue() + right.doubleValue();
    }
    return left.longValue() + right.longValue();
  }

  private static boolean isFloating(Number number) {
    return number instanceof Double || number instanceof Float;
  }
}
