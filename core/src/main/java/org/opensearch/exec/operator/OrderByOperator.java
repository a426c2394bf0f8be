/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import java.util.ArrayList;
import java.util.List;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.RowPage;
import org.opensearch.exec.plan.SortKey;

/** Buffers all input rows and produces them sorted once the input is done. */
public class OrderByOperator implements Operator {

  private final OperatorContext context;
  private final RowComparator comparator;
  private final List<Object[]> rows = new ArrayList<>();

  private int channelCount = -1;
  private boolean inputFinished;
  private boolean outputReturned;

  public OrderByOperator(OperatorContext context, List<SortKey> sortKeys) {
    this.context = context;
    this.comparator = new RowComparator(sortKeys);
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    channelCount = page.getChannelCount();
    for (int position = 0; position < page.getPositionCount(); position++) {
      rows.add(page.getRow(position));
    }
  }

  @Override
  public Page getOutput() {
    if (!inputFinished || outputReturned) {
      return null;
    }
    outputReturned = true;
    if (rows.isEmpty()) {
      return null;
    }
    rows.sort(comparator);
    Page output = RowPage.of(channelCount, rows);
    rows.clear();
    return output;
  }

  @Override
  public boolean isFinished() {
    return outputReturned;
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
    rows.clear();
  }
}
