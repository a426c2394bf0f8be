/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/**
 * Queues of a local partition: one per consumer driver. Every producer feeds every queue, so each
 * producer registers with all of them.
 */
public class LocalExchange {

  private final String planNodeId;
  private final List<PageQueue> queues;

  public LocalExchange(
      String planNodeId, int consumerCount, int queueCapacity, RelDataType rowType) {
    Preconditions.checkArgument(
        consumerCount > 0, "Local exchange %s needs at least one consumer", planNodeId);
    this.planNodeId = planNodeId;
    ImmutableList.Builder<PageQueue> builder = ImmutableList.builder();
    for (int i = 0; i < consumerCount; i++) {
      builder.add(new PageQueue(planNodeId + "/" + i, queueCapacity, rowType));
    }
    this.queues = builder.build();
  }

  public String getPlanNodeId() {
    return planNodeId;
  }

  public void addProducer() {
    queues.forEach(PageQueue::addProducer);
  }

  public int getQueueCount() {
    return queues.size();
  }

  /** Returns the queue read by the consumer driver with the given id. */
  public PageQueue getQueue(int consumerId) {
    Preconditions.checkElementIndex(consumerId, queues.size(), "consumer of " + planNodeId);
    return queues.get(consumerId);
  }

  public List<PageQueue> getQueues() {
    return queues;
  }

  public void close() {
    queues.forEach(PageQueue::close);
  }
}
