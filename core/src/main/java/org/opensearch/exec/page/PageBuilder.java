/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.page;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/** Collects rows of a fixed width into pages. {@link #build()} starts a new page. */
public class PageBuilder {

  private final int channelCount;
  private List<Object[]> rows = new ArrayList<>();

  public PageBuilder(int channelCount) {
    Preconditions.checkArgument(channelCount >= 0, "Negative channel count %s", channelCount);
    this.channelCount = channelCount;
  }

  /** Adds a row. The builder takes ownership of the array. */
  public void appendRow(Object[] row) {
    Preconditions.checkArgument(
        row.length == channelCount,
        "Row has %s values, builder has %s channels",
        row.length,
        channelCount);
    rows.add(row);
  }

  public int getChannelCount() {
    return channelCount;
  }

  public int getRowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Returns the rows appended since the last call as a page. */
  public Page build() {
    List<Object[]> built = rows;
    rows = new ArrayList<>();
    return RowPage.of(channelCount, built);
  }
}
