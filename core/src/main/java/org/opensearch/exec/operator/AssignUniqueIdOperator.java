/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import java.util.concurrent.atomic.AtomicLong;
import org.opensearch.exec.exception.QueryEngineException;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.plan.AssignUniqueIdNode;

/**
 * Appends a column holding an id unique across the query: the task unique id in the high bits
 * and a counter shared by the drivers of the task in the low {@link
 * AssignUniqueIdNode#COUNTER_BITS} bits.
 */
public class AssignUniqueIdOperator implements Operator {

  private static final long MAX_COUNTER = 1L << AssignUniqueIdNode.COUNTER_BITS;

  private final OperatorContext context;
  private final long idPrefix;
  private final AtomicLong counter;

  private Page pendingOutput;
  private boolean inputFinished;

  public AssignUniqueIdOperator(OperatorContext context, int taskUniqueId, AtomicLong counter) {
    this.context = context;
    this.idPrefix = (long) taskUniqueId << AssignUniqueIdNode.COUNTER_BITS;
    this.counter = counter;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    int rows = page.getPositionCount();
    long first = counter.getAndAdd(rows);
    if (first + rows > MAX_COUNTER) {
      throw new QueryEngineException("Ran out of unique ids in " + context);
    }
    int width = page.getChannelCount() + 1;
    PageBuilder builder = new PageBuilder(width);
    for (int position = 0; position < rows; position++) {
      Object[] row = new Object[width];
      for (int channel = 0; channel < page.getChannelCount(); channel++) {
        row[channel] = page.getValue(position, channel);
      }
      row[width - 1] = idPrefix | (first + position);
      builder.appendRow(row);
    }
    pendingOutput = builder.build();
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return inputFinished && pendingOutput == null;
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
