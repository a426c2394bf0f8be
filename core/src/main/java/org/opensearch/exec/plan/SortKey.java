/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

/** One ordering key: an input channel, its direction and where nulls go. */
public record SortKey(int channel, boolean descending, boolean nullsLast) {

  public static SortKey ascending(int channel) {
    return new SortKey(channel, false, true);
  }

  public static SortKey descending(int channel) {
    return new SortKey(channel, true, true);
  }
}
