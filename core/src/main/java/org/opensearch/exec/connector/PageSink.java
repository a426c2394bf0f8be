/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.connector;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.page.Page;

/** Consumes the pages written by one table writer driver. */
public interface PageSink {

  /**
   * Appends a page to the target.
   *
   * @return a future that completes when the sink can accept more pages
   */
  ListenableFuture<Void> appendPage(Page page);

  /** Commits all appended pages. Called once, after the last page. */
  void finish();

  /** Discards all appended pages. */
  void abort();
}
