/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.exchange.OutputBuffer;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.page.Page;

/**
 * {@link OutputBuffer} keeping pages in memory until the consumer of each partition drains them.
 * Producers are blocked while more than {@code maxBufferedBytes} are held.
 */
@Log4j2
public class InMemoryOutputBuffer implements OutputBuffer {

  private final List<List<Page>> partitions;
  private final long maxBufferedBytes;
  private long bufferedBytes;
  private boolean noMorePages;
  private boolean aborted;
  private SettableFuture<Void> notFull;

  public InMemoryOutputBuffer(int partitionCount, long maxBufferedBytes) {
    Preconditions.checkArgument(partitionCount > 0, "partitionCount must be positive");
    Preconditions.checkArgument(maxBufferedBytes > 0, "maxBufferedBytes must be positive");
    this.maxBufferedBytes = maxBufferedBytes;
    this.partitions = new ArrayList<>(partitionCount);
    for (int i = 0; i < partitionCount; i++) {
      partitions.add(new ArrayList<>());
    }
  }

  @Override
  public synchronized ListenableFuture<Void> enqueue(int partition, Page page) {
    Preconditions.checkElementIndex(partition, partitions.size(), "partition");
    Preconditions.checkState(!noMorePages, "No more pages expected");
    if (aborted) {
      return Operator.NOT_BLOCKED;
    }
    partitions.get(partition).add(page);
    bufferedBytes += page.getRetainedSizeBytes();
    if (bufferedBytes > maxBufferedBytes) {
      if (notFull == null) {
        notFull = SettableFuture.create();
      }
      return notFull;
    }
    return Operator.NOT_BLOCKED;
  }

  /** Removes and returns every page buffered for a partition. */
  public List<Page> drain(int partition) {
    SettableFuture<Void> wake = null;
    List<Page> result;
    synchronized (this) {
      Preconditions.checkElementIndex(partition, partitions.size(), "partition");
      List<Page> pages = partitions.get(partition);
      result = ImmutableList.copyOf(pages);
      pages.clear();
      for (Page page : result) {
        bufferedBytes -= page.getRetainedSizeBytes();
      }
      if (bufferedBytes <= maxBufferedBytes) {
        wake = notFull;
        notFull = null;
      }
    }
    if (wake != null) {
      wake.set(null);
    }
    return result;
  }

  @Override
  public synchronized void setNoMorePages() {
    noMorePages = true;
  }

  @Override
  public int getPartitionCount() {
    return partitions.size();
  }

  @Override
  public synchronized long getBufferedBytes() {
    return bufferedBytes;
  }

  @Override
  public void abort() {
    SettableFuture<Void> wake;
    synchronized (this) {
      if (aborted) {
        return;
      }
      aborted = true;
      partitions.forEach(List::clear);
      bufferedBytes = 0;
      wake = notFull;
      notFull = null;
    }
    log.debug("Output buffer aborted");
    if (wake != null) {
      wake.set(null);
    }
  }

  @Override
  public synchronized boolean isFinished() {
    return aborted || (noMorePages && partitions.stream().allMatch(List::isEmpty));
  }

  @Override
  public void close() {
    abort();
  }
}
