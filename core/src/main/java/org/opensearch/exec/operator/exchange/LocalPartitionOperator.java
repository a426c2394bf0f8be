/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import com.google.common.util.concurrent.ListenableFuture;
import java.util.ArrayList;
import java.util.List;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.SinkOperator;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.task.LocalExchange;
import org.opensearch.exec.task.PageQueue;

/**
 * Fans its input out to the consumer drivers of a local exchange: by the hash of the partition
 * keys, or page by page round robin when there are no keys.
 */
public class LocalPartitionOperator implements SinkOperator {

  private final OperatorContext context;
  private final LocalExchange exchange;
  private final HashPartitioner partitioner;

  private ListenableFuture<Void> blocked = NOT_BLOCKED;
  private int nextQueue;
  private boolean finished;

  public LocalPartitionOperator(
      OperatorContext context, LocalExchange exchange, List<Integer> partitionKeys) {
    this.context = context;
    this.exchange = exchange;
    this.partitioner =
        partitionKeys.isEmpty()
            ? null
            : new HashPartitioner(partitionKeys, exchange.getQueueCount());
    exchange.addProducer();
  }

  @Override
  public boolean needsInput() {
    return !finished && blocked.isDone();
  }

  @Override
  public void addInput(Page page) {
    if (partitioner == null) {
      PageQueue queue = exchange.getQueue(nextQueue);
      nextQueue = (nextQueue + 1) % exchange.getQueueCount();
      blocked = queue.consume(page);
      return;
    }
    List<ListenableFuture<Void>> futures = new ArrayList<>();
    List<Page> pages = partitioner.split(page);
    for (int i = 0; i < pages.size(); i++) {
      if (pages.get(i) != null) {
        futures.add(exchange.getQueue(i).consume(pages.get(i)));
      }
    }
    blocked = PartitionedOutputOperator.allOf(futures);
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
      exchange.getQueues().forEach(PageQueue::noMoreData);
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
