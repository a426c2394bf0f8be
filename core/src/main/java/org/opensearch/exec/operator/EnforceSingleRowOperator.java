/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import org.opensearch.exec.exception.QueryEngineException;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;

/**
 * Passes exactly one row. Fails if the input has more than one row and produces a row of nulls
 * if the input is empty.
 */
public class EnforceSingleRowOperator implements Operator {

  private final OperatorContext context;
  private final int channelCount;

  private Page row;
  private long inputRows;
  private boolean inputFinished;
  private boolean outputReturned;

  public EnforceSingleRowOperator(OperatorContext context, int channelCount) {
    this.context = context;
    this.channelCount = channelCount;
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    inputRows += page.getPositionCount();
    if (inputRows > 1) {
      throw new QueryEngineException(
          String.format("Expected single row of input. Received %d rows.", inputRows));
    }
    if (page.getPositionCount() == 1) {
      row = page;
    }
  }

  @Override
  public Page getOutput() {
    if (!inputFinished || outputReturned) {
      return null;
    }
    outputReturned = true;
    if (row != null) {
      return row;
    }
    PageBuilder builder = new PageBuilder(channelCount);
    builder.appendRow(new Object[channelCount]);
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
  public void close() {}
}
