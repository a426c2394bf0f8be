/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.exchange;

import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.page.Page;

/**
 * Holds the pages a task produces for remote consumers, one queue per partition. A producer that
 * gets a pending future from {@link #enqueue} must wait before adding more.
 */
public interface OutputBuffer extends AutoCloseable {

  /** Adds a page to one partition; the future is pending while the buffer is over size. */
  ListenableFuture<Void> enqueue(int partition, Page page);

  /** Called once every producer of the task has finished. */
  void setNoMorePages();

  int getPartitionCount();

  long getBufferedBytes();

  /** Drops everything buffered; used when the task fails or is cancelled. */
  void abort();

  /** True after {@link #setNoMorePages()} once all partitions are drained. */
  boolean isFinished();

  @Override
  void close();
}
