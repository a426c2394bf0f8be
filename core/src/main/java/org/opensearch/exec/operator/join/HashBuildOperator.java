/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.SinkOperator;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.task.HashJoinBridge;

/** Builds the hash table of a join from the rows of the build side. */
@Log4j2
public class HashBuildOperator implements SinkOperator {

  private final OperatorContext context;
  private final HashJoinBridge bridge;
  private final List<Integer> keyChannels;
  private final ListMultimap<List<Object>, Object[]> table = ArrayListMultimap.create();
  private boolean finished;

  public HashBuildOperator(
      OperatorContext context, HashJoinBridge bridge, List<Integer> keyChannels) {
    this.context = context;
    this.bridge = bridge;
    this.keyChannels = ImmutableList.copyOf(keyChannels);
    bridge.addBuilder();
  }

  @Override
  public boolean needsInput() {
    return !finished;
  }

  @Override
  public void addInput(Page page) {
    for (int position = 0; position < page.getPositionCount(); position++) {
      List<Object> key = JoinKeys.extract(page, position, keyChannels);
      if (key != null) {
        table.put(key, page.getRow(position));
      }
    }
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public void finish() {
    if (!finished) {
      finished = true;
      log.debug("{} built {} rows", context, table.size());
      bridge.builderFinished(table);
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
