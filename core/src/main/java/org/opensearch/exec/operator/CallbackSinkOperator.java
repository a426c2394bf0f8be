/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.page.Page;

/** Hands every input page to a {@link PageConsumer}, waiting while the consumer is full. */
public class CallbackSinkOperator implements SinkOperator {

  private final OperatorContext context;
  private final PageConsumer consumer;

  private ListenableFuture<Void> blocked = NOT_BLOCKED;
  private boolean finished;

  public CallbackSinkOperator(OperatorContext context, PageConsumer consumer) {
    this.context = context;
    this.consumer = consumer;
  }

  @Override
  public boolean needsInput() {
    return !finished && blocked.isDone();
  }

  @Override
  public void addInput(Page page) {
    if (!needsInput()) {
      throw new IllegalStateException("Operator does not need input: " + context);
    }
    blocked = consumer.consume(page);
  }

  @Override
  public ListenableFuture<Void> isBlocked() {
    return blocked;
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public void finish() {
    if (!finished) {
      finished = true;
      consumer.noMoreData();
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
