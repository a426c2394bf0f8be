/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import org.opensearch.exec.exchange.OutputBuffer;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.SinkOperator;
import org.opensearch.exec.page.Page;

/**
 * Sends its input to the task's output buffer, split by the hash of the partition keys. With a
 * single partition pages are sent unchanged.
 */
public class PartitionedOutputOperator implements SinkOperator {

  private final OperatorContext context;
  private final OutputBuffer outputBuffer;
  private final HashPartitioner partitioner;
  private final int partitionCount;

  private ListenableFuture<Void> blocked = NOT_BLOCKED;
  private boolean finished;

  public PartitionedOutputOperator(
      OperatorContext context,
      OutputBuffer outputBuffer,
      List<Integer> partitionKeys,
      int partitionCount) {
    Preconditions.checkArgument(
        outputBuffer.getPartitionCount() == partitionCount,
        "Output buffer has %s partitions, %s expects %s",
        outputBuffer.getPartitionCount(),
        context,
        partitionCount);
    this.context = context;
    this.outputBuffer = outputBuffer;
    this.partitionCount = partitionCount;
    this.partitioner = new HashPartitioner(partitionKeys, partitionCount);
  }

  @Override
  public boolean needsInput() {
    return !finished && blocked.isDone();
  }

  @Override
  public void addInput(Page page) {
    if (partitionCount == 1) {
      blocked = outputBuffer.enqueue(0, page);
      return;
    }
    List<ListenableFuture<Void>> futures = new ArrayList<>();
    List<Page> pages = partitioner.split(page);
    for (int partition = 0; partition < pages.size(); partition++) {
      if (pages.get(partition) != null) {
        futures.add(outputBuffer.enqueue(partition, pages.get(partition)));
      }
    }
    blocked = allOf(futures);
  }

  static ListenableFuture<Void> allOf(List<ListenableFuture<Void>> futures) {
    if (futures.stream().allMatch(ListenableFuture::isDone)) {
      return NOT_BLOCKED;
    }
    return Futures.transform(
        Futures.successfulAsList(futures), ignored -> null, MoreExecutors.directExecutor());
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
    finished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
