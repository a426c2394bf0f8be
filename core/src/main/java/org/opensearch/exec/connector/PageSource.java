/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.connector;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.page.Page;

/** Produces the pages of one table scan driver. */
public interface PageSource extends AutoCloseable {

  /**
   * Returns the next page, or null if none is available yet. A source returning null before it is
   * finished should report a pending future from {@link #isBlocked()}; otherwise the driver
   * yields and is rescheduled at once.
   */
  Page getNextPage();

  /** Returns true when all pages have been returned. */
  boolean isFinished();

  /** Returns a future that completes when {@link #getNextPage()} may return data again. */
  default ListenableFuture<Void> isBlocked() {
    return Operator.NOT_BLOCKED;
  }

  @Override
  void close();
}
