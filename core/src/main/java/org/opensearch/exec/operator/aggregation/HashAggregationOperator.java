/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.aggregation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.plan.AggregationNode;

/**
 * Groups its input by the grouping keys and aggregates every group. Produces all groups once the
 * input is done, in first-seen order. A global aggregation always produces exactly one row.
 */
public class HashAggregationOperator implements Operator {

  private final OperatorContext context;
  private final AggregationNode node;
  private final Map<List<Object>, GroupedAccumulators> groups = new LinkedHashMap<>();

  private boolean inputFinished;
  private boolean outputReturned;

  public HashAggregationOperator(OperatorContext context, AggregationNode node) {
    this.context = context;
    this.node = node;
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    for (int position = 0; position < page.getPositionCount(); position++) {
      Object[] row = page.getRow(position);
      List<Object> key = new ArrayList<>(node.getGroupingKeys().size());
      for (int channel : node.getGroupingKeys()) {
        key.add(row[channel]);
      }
      groups.computeIfAbsent(key, k -> new GroupedAccumulators(node)).add(row);
    }
  }

  @Override
  public Page getOutput() {
    if (!inputFinished || outputReturned) {
      return null;
    }
    outputReturned = true;
    if (groups.isEmpty() && node.getGroupingKeys().isEmpty()) {
      groups.put(List.of(), new GroupedAccumulators(node));
    }
    if (groups.isEmpty()) {
      return null;
    }
    PageBuilder builder = new PageBuilder(node.getOutputType().getFieldCount());
    groups.forEach((key, accumulators) -> builder.appendRow(accumulators.toRow(key)));
    groups.clear();
    return builder.build();
  }

  @Override
  public boolean isFinished() {
    return outputReturned;
  }

  @Override
  public void finish() {
    inputFinished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    groups.clear();
  }
}
