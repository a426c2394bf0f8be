/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

/**
 * One aggregate of an {@link AggregationNode}.
 *
 * @param function the aggregate function
 * @param inputChannel the argument channel; -1 counts rows
 */
public record AggregateCall(Function function, int inputChannel) {

  public static AggregateCall countAll() {
    return new AggregateCall(Function.COUNT, -1);
  }

  public static AggregateCall of(Function function, int inputChannel) {
    return new AggregateCall(function, inputChannel);
  }

  /** Supported aggregate functions. */
  public enum Function {
    COUNT,
    SUM,
    MIN,
    MAX
  }
}
