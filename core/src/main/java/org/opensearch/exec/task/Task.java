/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.exec.common.setting.Settings;
import org.opensearch.exec.exchange.OutputBuffer;

/**
 * The unit of work the drivers of one plan belong to. Owns the coordination state that links
 * pipelines: sinks and sources at a pipeline boundary find each other through it by plan node id.
 */
public interface Task {

  String getTaskId();

  Settings getSettings();

  /**
   * Creates the merge sources of a local merge, one per producer driver.
   *
   * @param planNodeId id of the local merge node
   * @param count number of producer drivers
   * @param rowType row type of the merged pages
   * @throws IllegalStateException if the sources of this node already exist
   */
  void createLocalMergeSources(String planNodeId, int count, RelDataType rowType);

  /** Returns the merge source fed by producer driver {@code sourceId} of a local merge. */
  PageQueue getLocalMergeSource(String planNodeId, int sourceId);

  /** Returns every merge source of a local merge, in producer driver order. */
  List<PageQueue> getLocalMergeSources(String planNodeId);

  /**
   * Creates the source the right side of a merge join feeds.
   *
   * @throws IllegalStateException if the source of this node already exists
   */
  PageQueue createMergeJoinSource(String planNodeId);

  PageQueue getMergeJoinSource(String planNodeId);

  /** Returns the bridge of a hash join, creating it on first use. */
  HashJoinBridge getHashJoinBridge(String planNodeId);

  /** Returns the bridge of a cross join, creating it on first use. */
  CrossJoinBridge getCrossJoinBridge(String planNodeId);

  /** Returns the exchange of a local partition node. */
  LocalExchange getLocalExchange(String planNodeId);

  /** Returns the row counter shared by every driver of an assign-unique-id node. */
  AtomicLong getUniqueIdCounter(String planNodeId);

  /** Returns the buffer partitioned output is written to. */
  OutputBuffer getOutputBuffer();

  /** Returns the number of drivers the given pipeline runs in this task. */
  int numDrivers(int pipelineId);
}
