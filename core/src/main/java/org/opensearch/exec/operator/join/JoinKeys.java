/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.opensearch.exec.page.Page;

@UtilityClass
class JoinKeys {

  /** Returns the key values of a row, or null if any of them is null. Null keys never match. */
  static List<Object> extract(Page page, int position, List<Integer> keyChannels) {
    List<Object> key = new ArrayList<>(keyChannels.size());
    for (int channel : keyChannels) {
      Object value = page.getValue(position, channel);
      if (value == null) {
        return null;
      }
      key.add(value);
    }
    return key;
  }

  static Object[] concat(Object[] left, Object[] right) {
    Object[] row = new Object[left.length + right.length];
    System.arraycopy(left, 0, row, 0, left.length);
    System.arraycopy(right, 0, row, left.length, right.length);
    return row;
  }
}
