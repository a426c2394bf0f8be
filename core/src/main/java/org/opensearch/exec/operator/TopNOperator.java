/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.RowPage;
import org.opensearch.exec.plan.SortKey;

/** Keeps the first {@code count} rows by sort order and produces them sorted. */
public class TopNOperator implements Operator {

  private final OperatorContext context;
  private final RowComparator comparator;
  private final int count;
  // head is the largest kept row
  private final PriorityQueue<Object[]> heap;

  private int channelCount = -1;
  private boolean inputFinished;
  private boolean outputReturned;

  public TopNOperator(OperatorContext context, List<SortKey> sortKeys, int count) {
    this.context = context;
    this.comparator = new RowComparator(sortKeys);
    this.count = count;
    this.heap = new PriorityQueue<>(Math.max(1, count), comparator.reversed());
  }

  @Override
  public boolean needsInput() {
    return !inputFinished && count > 0;
  }

  @Override
  public void addInput(Page page) {
    channelCount = page.getChannelCount();
    for (int position = 0; position < page.getPositionCount(); position++) {
      Object[] row = page.getRow(position);
      if (heap.size() < count) {
        heap.add(row);
      } else if (comparator.compare(row, heap.peek()) < 0) {
        heap.poll();
        heap.add(row);
      }
    }
  }

  @Override
  public Page getOutput() {
    if (!inputFinished || outputReturned) {
      return null;
    }
    outputReturned = true;
    if (heap.isEmpty()) {
      return null;
    }
    List<Object[]> rows = new ArrayList<>(heap);
    rows.sort(comparator);
    heap.clear();
    return RowPage.of(channelCount, rows);
  }

  @Override
  public boolean isFinished() {
    return outputReturned || (count == 0 && inputFinished);
  }

  @Override
  public void finish() {
    inputFinished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    heap.clear();
  }
}
