/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;

/** Splits pages by the hash of a set of key channels. */
public class HashPartitioner {

  private final List<Integer> keyChannels;
  private final int partitionCount;

  public HashPartitioner(List<Integer> keyChannels, int partitionCount) {
    Preconditions.checkArgument(partitionCount > 0, "partitionCount must be positive");
    this.keyChannels = ImmutableList.copyOf(keyChannels);
    this.partitionCount = partitionCount;
  }

  /** Returns the partition of one row. Rows with equal key values land in the same partition. */
  public int partition(Page page, int position) {
    Object[] key = new Object[keyChannels.size()];
    for (int i = 0; i < key.length; i++) {
      key[i] = page.getValue(position, keyChannels.get(i));
    }
    return Math.floorMod(Arrays.hashCode(key), partitionCount);
  }

  /**
   * Splits a page.
   *
   * @return one page per partition, null where a partition received no rows
   */
  public List<Page> split(Page page) {
    List<PageBuilder> builders = new ArrayList<>(partitionCount);
    for (int i = 0; i < partitionCount; i++) {
      builders.add(new PageBuilder(page.getChannelCount()));
    }
    for (int position = 0; position < page.getPositionCount(); position++) {
      builders.get(partition(page, position)).appendRow(page.getRow(position));
    }
    List<Page> result = new ArrayList<>(partitionCount);
    for (PageBuilder builder : builders) {
      result.add(builder.isEmpty() ? null : builder.build());
    }
    return result;
  }
}
