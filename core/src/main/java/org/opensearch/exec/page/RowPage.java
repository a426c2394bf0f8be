/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.page;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** {@link Page} keeping one value array per position. */
public class RowPage implements Page {

  private final List<Object[]> rows;
  private final int channelCount;

  private RowPage(List<Object[]> rows, int channelCount) {
    this.rows = rows;
    this.channelCount = channelCount;
  }

  /**
   * Creates a page over {@code rows}. The arrays are not copied; the caller must not change them
   * afterwards.
   *
   * @throws IllegalArgumentException if a row does not have {@code channelCount} values
   */
  public static RowPage of(int channelCount, List<Object[]> rows) {
    Preconditions.checkArgument(channelCount >= 0, "Negative channel count %s", channelCount);
    for (Object[] row : rows) {
      Preconditions.checkArgument(
          row.length == channelCount,
          "Row has %s values, page has %s channels",
          row.length,
          channelCount);
    }
    return new RowPage(ImmutableList.copyOf(rows), channelCount);
  }

  public static RowPage empty(int channelCount) {
    return of(channelCount, ImmutableList.of());
  }

  @Override
  public int getPositionCount() {
    return rows.size();
  }

  @Override
  public int getChannelCount() {
    return channelCount;
  }

  @Override
  public Object getValue(int position, int channel) {
    Preconditions.checkElementIndex(channel, channelCount, "channel");
    return rows.get(Preconditions.checkElementIndex(position, rows.size(), "position"))[channel];
  }

  @Override
  public Object[] getRow(int position) {
    Preconditions.checkElementIndex(position, rows.size(), "position");
    return Arrays.copyOf(rows.get(position), channelCount);
  }

  @Override
  public Page getRegion(int offset, int length) {
    Preconditions.checkPositionIndexes(offset, offset + length, rows.size());
    return new RowPage(rows.subList(offset, offset + length), channelCount);
  }

  @Override
  public String toString() {
    return "RowPage[" + rows.size() + "x" + channelCount + "]";
  }
}
