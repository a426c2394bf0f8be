/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.task.PageQueue;

/** Reads the queue of a local exchange assigned to this driver. */
public class LocalExchangeSourceOperator extends ExchangeOperator {

  private final PageQueue queue;

  public LocalExchangeSourceOperator(OperatorContext context, PageQueue queue) {
    super(context, queue);
    this.queue = queue;
  }

  /** Closes the queue so producers stop waiting on a consumer that is gone. */
  @Override
  public void close() {
    queue.close();
  }
}
