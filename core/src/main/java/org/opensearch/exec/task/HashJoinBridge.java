/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.List;

/** Build side of a hash join: build rows grouped by their join key values. */
public class HashJoinBridge extends JoinBridge<ListMultimap<List<Object>, Object[]>> {

  private final ListMultimap<List<Object>, Object[]> table = ArrayListMultimap.create();

  public HashJoinBridge(String planNodeId) {
    super(planNodeId);
  }

  @Override
  protected void merge(ListMultimap<List<Object>, Object[]> partial) {
    table.putAll(partial);
  }

  @Override
  protected ListMultimap<List<Object>, Object[]> publish() {
    return ImmutableListMultimap.copyOf(table);
  }
}
