/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.util.concurrent.ListenableFuture;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.connector.PageSource;
import org.opensearch.exec.page.Page;

/** Reads the pages of a connector table through the page source of this driver. */
@Log4j2
public class TableScanOperator implements SourceOperator {

  private final OperatorContext context;
  private final PageSource pageSource;
  private boolean finished;

  public TableScanOperator(OperatorContext context, PageSource pageSource) {
    this.context = context;
    this.pageSource = pageSource;
  }

  @Override
  public Page getOutput() {
    if (finished || context.isCancelled()) {
      return null;
    }
    return pageSource.getNextPage();
  }

  @Override
  public boolean isFinished() {
    return finished || pageSource.isFinished();
  }

  @Override
  public void finish() {
    finished = true;
  }

  @Override
  public ListenableFuture<Void> isBlocked() {
    return isFinished() ? NOT_BLOCKED : pageSource.isBlocked();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    log.debug("Closing page source of {}", context);
    pageSource.close();
  }
}
