/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import org.opensearch.exec.page.Page;

/**
 * Operator that skips the first {@code offset} rows and passes at most {@code count} rows after
 * them. Truncates pages at both ends.
 */
public class LimitOperator implements Operator {

  private final OperatorContext context;

  private long remainingOffset;
  private long remainingRows;
  private Page pendingOutput;
  private boolean inputFinished;

  public LimitOperator(OperatorContext context, long offset, long count) {
    this.context = context;
    this.remainingOffset = offset;
    this.remainingRows = count;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && remainingRows > 0 && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (page == null || remainingRows <= 0) {
      return;
    }
    int start = (int) Math.min(remainingOffset, page.getPositionCount());
    remainingOffset -= start;
    int length = (int) Math.min(remainingRows, page.getPositionCount() - start);
    if (length <= 0) {
      return;
    }
    remainingRows -= length;
    pendingOutput =
        start == 0 && length == page.getPositionCount() ? page : page.getRegion(start, length);
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return pendingOutput == null && (remainingRows <= 0 || inputFinished);
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
