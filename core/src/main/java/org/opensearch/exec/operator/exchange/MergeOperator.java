/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;
import org.opensearch.exec.exchange.PageStream;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.RowComparator;
import org.opensearch.exec.operator.SourceOperator;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.plan.SortKey;

/**
 * Merges streams that are each sorted by the same keys into one sorted stream. A row is only
 * emitted once every unfinished stream has a current row, so the operator blocks on the slowest
 * stream.
 */
public abstract class MergeOperator implements SourceOperator {

  private final OperatorContext context;
  private final List<? extends PageStream> streams;
  private final RowComparator comparator;
  private final int outputPageRows;
  private final int channelCount;

  private final Page[] currentPages;
  private final int[] positions;
  private final PageBuilder builder;
  private ListenableFuture<Void> blocked = NOT_BLOCKED;
  private boolean finished;

  protected MergeOperator(
      OperatorContext context,
      List<? extends PageStream> streams,
      List<SortKey> sortKeys,
      int channelCount,
      int outputPageRows) {
    this.context = context;
    this.streams = ImmutableList.copyOf(streams);
    this.comparator = new RowComparator(sortKeys);
    this.outputPageRows = outputPageRows;
    this.channelCount = channelCount;
    this.currentPages = new Page[streams.size()];
    this.positions = new int[streams.size()];
    this.builder = new PageBuilder(channelCount);
  }

  @Override
  public Page getOutput() {
    if (finished || !blocked.isDone()) {
      return null;
    }
    while (builder.getRowCount() < outputPageRows) {
      int next = -1;
      Object[] nextRow = null;
      for (int i = 0; i < streams.size(); i++) {
        if (!advance(i)) {
          if (streams.get(i).isFinished()) {
            continue;
          }
          blocked = streams.get(i).isBlocked();
          return null;
        }
        Object[] row = currentPages[i].getRow(positions[i]);
        if (nextRow == null || comparator.compare(row, nextRow) < 0) {
          next = i;
          nextRow = row;
        }
      }
      if (nextRow == null) {
        finished = true;
        return builder.isEmpty() ? null : builder.build();
      }
      builder.appendRow(nextRow);
      positions[next]++;
    }
    return builder.build();
  }

  /** Makes sure stream {@code i} has a current row. Returns false if none is available now. */
  private boolean advance(int i) {
    while (currentPages[i] == null || positions[i] >= currentPages[i].getPositionCount()) {
      Page page = streams.get(i).pollPage();
      if (page == null) {
        currentPages[i] = null;
        return false;
      }
      if (page.getChannelCount() != channelCount) {
        throw new IllegalStateException(
            String.format(
                "%s expects %d channels, stream %d produced %d",
                context, channelCount, i, page.getChannelCount()));
      }
      currentPages[i] = page;
      positions[i] = 0;
    }
    return true;
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
  public void finish() {}

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
