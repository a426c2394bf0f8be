/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.page;

/**
 * Unit of data moved between operators: a fixed number of positions (rows), each with the same
 * number of channels (columns). A page is never changed after it is handed to another operator.
 */
public interface Page {

  /** Estimated bytes retained by one value. */
  long BYTES_PER_VALUE = 8L;

  int getPositionCount();

  int getChannelCount();

  /** Returns the value at {@code position} in {@code channel}; null for a null value. */
  Object getValue(int position, int channel);

  /** Returns the {@code length} positions starting at {@code offset} as a page of their own. */
  Page getRegion(int offset, int length);

  /** Returns the values of one position in a new array the caller may keep and change. */
  default Object[] getRow(int position) {
    Object[] row = new Object[getChannelCount()];
    for (int channel = 0; channel < row.length; channel++) {
      row[channel] = getValue(position, channel);
    }
    return row;
  }

  /** Used by buffers bounded in bytes. */
  default long getRetainedSizeBytes() {
    return BYTES_PER_VALUE * getPositionCount() * getChannelCount();
  }
}
