/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.page.Page;

/** Receives the pages of one driver; the callback end of a {@link CallbackSinkOperator}. */
public interface PageConsumer {

  /**
   * Consumes a page.
   *
   * @return {@link Operator#NOT_BLOCKED}, or a future completing when more pages are accepted
   */
  ListenableFuture<Void> consume(Page page);

  /** Signals that the driver produces no more pages. Called once. */
  void noMoreData();
}
