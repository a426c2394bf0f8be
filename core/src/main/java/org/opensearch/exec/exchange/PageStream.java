/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.exchange;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.page.Page;

/** The reading end of a stream of pages produced elsewhere: another driver or another task. */
public interface PageStream {

  /** Returns a future that completes when {@link #pollPage()} may return a page. */
  ListenableFuture<Void> isBlocked();

  /** Returns the next page, or null if none is available now. */
  Page pollPage();

  /** Returns true when every page has been polled and no more will arrive. */
  boolean isFinished();
}
