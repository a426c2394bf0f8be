/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.util.concurrent.ListenableFuture;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.connector.PageSink;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;

/**
 * Writes its input into a connector page sink. Once the input is done the sink is committed and a
 * single row holding the number of written rows is produced.
 */
@Log4j2
public class TableWriterOperator implements Operator {

  private final OperatorContext context;
  private final PageSink pageSink;

  private ListenableFuture<Void> blocked = NOT_BLOCKED;
  private long writtenRows;
  private boolean committed;
  private boolean outputReturned;

  public TableWriterOperator(OperatorContext context, PageSink pageSink) {
    this.context = context;
    this.pageSink = pageSink;
  }

  @Override
  public boolean needsInput() {
    return !committed && blocked.isDone();
  }

  @Override
  public void addInput(Page page) {
    if (!needsInput()) {
      throw new IllegalStateException("Operator does not need input: " + context);
    }
    writtenRows += page.getPositionCount();
    blocked = pageSink.appendPage(page);
  }

  @Override
  public Page getOutput() {
    if (!committed || outputReturned) {
      return null;
    }
    outputReturned = true;
    PageBuilder builder = new PageBuilder(1);
    builder.appendRow(new Object[] {writtenRows});
    return builder.build();
  }

  @Override
  public ListenableFuture<Void> isBlocked() {
    return blocked;
  }

  @Override
  public boolean isFinished() {
    return outputReturned;
  }

  @Override
  public void finish() {
    if (!committed) {
      pageSink.finish();
      committed = true;
      log.debug("{} wrote {} rows", context, writtenRows);
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    if (!committed) {
      pageSink.abort();
    }
  }
}
