/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import org.opensearch.exec.plan.SortKey;

/** Orders rows by a list of sort keys. Values of a channel must be mutually {@link Comparable}. */
public class RowComparator implements Comparator<Object[]> {

  private final List<SortKey> sortKeys;

  public RowComparator(List<SortKey> sortKeys) {
    this.sortKeys = ImmutableList.copyOf(sortKeys);
  }

  @Override
  public int compare(Object[] left, Object[] right) {
    for (SortKey key : sortKeys) {
      Object l = left[key.channel()];
      Object r = right[key.channel()];
      if (l == null || r == null) {
        if (l != r) {
          return (l == null) == key.nullsLast() ? 1 : -1;
        }
        continue;
      }
      int result = compareValues(l, r);
      if (result != 0) {
        return key.descending() ? -result : result;
      }
    }
    return 0;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compareValues(Object left, Object right) {
    return ((Comparable) left).compareTo(right);
  }
}
