/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.page.Page;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashPartitionerTest {

  @Test
  void should_send_equal_keys_to_same_partition() {
    HashPartitioner partitioner = new HashPartitioner(List.of(0), 4);
    Page page = page(row("a", 1L), row("b", 2L), row("a", 3L), row(null, 4L), row(null, 5L));

    assertEquals(partitioner.partition(page, 0), partitioner.partition(page, 2));
    assertEquals(partitioner.partition(page, 3), partitioner.partition(page, 4));
  }

  @Test
  void should_split_page_by_partition_keeping_every_row() {
    HashPartitioner partitioner = new HashPartitioner(List.of(0), 3);
    Page page = page(row(1L), row(2L), row(3L), row(4L), row(5L), row(6L));

    List<Page> parts = partitioner.split(page);

    assertEquals(3, parts.size());
    int rows = 0;
    for (int partition = 0; partition < parts.size(); partition++) {
      Page part = parts.get(partition);
      if (part == null) {
        continue;
      }
      for (int position = 0; position < part.getPositionCount(); position++) {
        assertEquals(partition, partitioner.partition(part, position));
      }
      rows += part.getPositionCount();
    }
    assertEquals(6, rows);
  }

  @Test
  void should_leave_empty_partitions_null() {
    HashPartitioner partitioner = new HashPartitioner(List.of(0), 2);
    Page page = page(row(7L));

    List<Page> parts = partitioner.split(page);

    assertNull(parts.get(1 - partitioner.partition(page, 0)));
  }

  @Test
  void should_reject_zero_partitions() {
    assertThrows(IllegalArgumentException.class, () -> new HashPartitioner(List.of(0), 0));
  }
}
