/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.plan.AggregationNode;

/**
 * Aggregates input clustered by the grouping keys. A group is produced as soon as a row with a
 * different key arrives, so only one group is held at a time.
 */
public class StreamingAggregationOperator implements Operator {

  private final OperatorContext context;
  private final AggregationNode node;
  private final PageBuilder builder;

  private List<Object> currentKey;
  private GroupedAccumulators current;
  private Page pendingOutput;
  private boolean inputFinished;
  private boolean flushed;

  public StreamingAggregationOperator(OperatorContext context, AggregationNode node) {
    this.context = context;
    this.node = node;
    this.builder = new PageBuilder(node.getOutputType().getFieldCount());
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    for (int position = 0; position < page.getPositionCount(); position++) {
      Object[] row = page.getRow(position);
      List<Object> key = new ArrayList<>(node.getGroupingKeys().size());
      for (int channel : node.getGroupingKeys()) {
        key.add(row[channel]);
      }
      if (current == null || !Objects.equals(key, currentKey)) {
        closeGroup();
        currentKey = key;
        current = new GroupedAccumulators(node);
      }
      current.add(row);
    }
    if (!builder.isEmpty()) {
      pendingOutput = builder.build();
    }
  }

  private void closeGroup() {
    if (current != null) {
      builder.appendRow(current.toRow(currentKey));
      current = null;
    }
  }

  @Override
  public Page getOutput() {
    if (pendingOutput == null && inputFinished && !flushed) {
      flushed = true;
      if (current == null && node.getGroupingKeys().isEmpty()) {
        currentKey = List.of();
        current = new GroupedAccumulators(node);
      }
      closeGroup();
      if (!builder.isEmpty()) {
        pendingOutput = builder.build();
      }
    }
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return flushed && pendingOutput == null;
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
  public void close() {}
}
