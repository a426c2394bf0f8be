/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.exchange.PageStream;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.SourceOperator;
import org.opensearch.exec.page.Page;

/** Produces the pages of a stream fed by other tasks, in arrival order. */
public class ExchangeOperator implements SourceOperator {

  private final OperatorContext context;
  private final PageStream stream;

  public ExchangeOperator(OperatorContext context, PageStream stream) {
    this.context = context;
    this.stream = stream;
  }

  @Override
  public Page getOutput() {
    return stream.pollPage();
  }

  @Override
  public boolean isFinished() {
    return stream.isFinished();
  }

  @Override
  public void finish() {}

  @Override
  public ListenableFuture<Void> isBlocked() {
    return stream.isBlocked();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
