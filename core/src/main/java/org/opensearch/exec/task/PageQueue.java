/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.exec.exchange.PageStream;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.PageConsumer;
import org.opensearch.exec.page.Page;

/**
 * Bounded queue handing pages from the drivers of one pipeline to a driver of another. Backs local
 * merge sources, merge-join sources and local exchange queues.
 *
 * <p>Producers register with {@link #addProducer()} when their sink is created and call {@link
 * #noMoreData()} when done; the queue is finished once every registered producer is done and the
 * queue is drained. Futures are completed outside the lock.
 */
public class PageQueue implements PageConsumer, PageStream {

  private final String name;
  private final int capacity;
  private final RelDataType rowType;

  private final Deque<Page> pages = new ArrayDeque<>();
  private int producers;
  private int finishedProducers;
  private boolean closed;
  private SettableFuture<Void> notFull;
  private SettableFuture<Void> notEmpty;

  /**
   * Creates a queue.
   *
   * @param name name used in errors and logs
   * @param capacity number of pages after which producers are blocked
   * @param rowType row type of accepted pages, or null to accept any
   */
  public PageQueue(String name, int capacity, RelDataType rowType) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.name = name;
    this.capacity = capacity;
    this.rowType = rowType;
  }

  public String getName() {
    return name;
  }

  public RelDataType getRowType() {
    return rowType;
  }

  /** Registers a producer. Must happen before any driver of the task runs. */
  public synchronized void addProducer() {
    Preconditions.checkState(!closed, "Queue %s is closed", name);
    producers++;
  }

  @Override
  public ListenableFuture<Void> consume(Page page) {
    Preconditions.checkArgument(
        rowType == null || page.getChannelCount() == rowType.getFieldCount(),
        "Queue %s accepts %s channels, got %s",
        name,
        rowType == null ? -1 : rowType.getFieldCount(),
        page.getChannelCount());
    SettableFuture<Void> wake;
    ListenableFuture<Void> result = Operator.NOT_BLOCKED;
    synchronized (this) {
      if (closed) {
        return Operator.NOT_BLOCKED;
      }
      pages.add(page);
      wake = notEmpty;
      notEmpty = null;
      if (pages.size() >= capacity) {
        if (notFull == null) {
          notFull = SettableFuture.create();
        }
        result = notFull;
      }
    }
    complete(wake);
    return result;
  }

  @Override
  public void noMoreData() {
    SettableFuture<Void> wake;
    synchronized (this) {
      finishedProducers++;
      Preconditions.checkState(
          finishedProducers <= producers, "Queue %s: more producers finished than added", name);
      wake = notEmpty;
      notEmpty = null;
    }
    complete(wake);
  }

  @Override
  public Page pollPage() {
    SettableFuture<Void> wake = null;
    Page page;
    synchronized (this) {
      page = pages.poll();
      if (page != null && pages.size() < capacity) {
        wake = notFull;
        notFull = null;
      }
    }
    complete(wake);
    return page;
  }

  @Override
  public synchronized ListenableFuture<Void> isBlocked() {
    if (!pages.isEmpty() || closed || allProducersFinished()) {
      return Operator.NOT_BLOCKED;
    }
    if (notEmpty == null) {
      notEmpty = SettableFuture.create();
    }
    return notEmpty;
  }

  @Override
  public synchronized boolean isFinished() {
    return closed || (pages.isEmpty() && allProducersFinished());
  }

  /** Discards buffered pages and wakes every waiter. */
  public void close() {
    SettableFuture<Void> wakeProducers;
    SettableFuture<Void> wakeConsumer;
    synchronized (this) {
      closed = true;
      pages.clear();
      wakeProducers = notFull;
      wakeConsumer = notEmpty;
      notFull = null;
      notEmpty = null;
    }
    complete(wakeProducers);
    complete(wakeConsumer);
  }

  public synchronized int size() {
    return pages.size();
  }

  private boolean allProducersFinished() {
    return producers > 0 && finishedProducers == producers;
  }

  private static void complete(SettableFuture<Void> future) {
    if (future != null) {
      future.set(null);
    }
  }

  @Override
  public String toString() {
    return "PageQueue{" + name + '}';
  }
}
