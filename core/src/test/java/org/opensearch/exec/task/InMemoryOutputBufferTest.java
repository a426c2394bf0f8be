/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import com.google.common.util.concurrent.ListenableFuture;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.page.Page;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class InMemoryOutputBufferTest {

  @Test
  void should_keep_pages_per_partition() {
    InMemoryOutputBuffer buffer = new InMemoryOutputBuffer(2, 1024);

    buffer.enqueue(0, page(row(1L)));
    buffer.enqueue(1, page(row(2L)));
    buffer.enqueue(1, page(row(3L)));

    assertEquals(1, buffer.drain(0).size());
    assertEquals(2, buffer.drain(1).size());
    assertEquals(0, buffer.getBufferedBytes());
  }

  @Test
  void should_block_producers_over_byte_limit_until_drained() {
    // Given: a one-row page retains 8 bytes
    InMemoryOutputBuffer buffer = new InMemoryOutputBuffer(1, 8);
    Page page = page(row(1L));

    // When
    ListenableFuture<Void> first = buffer.enqueue(0, page);
    ListenableFuture<Void> second = buffer.enqueue(0, page);

    // Then
    assertTrue(first.isDone());
    assertFalse(second.isDone());
    buffer.drain(0);
    assertTrue(second.isDone());
  }

  @Test
  void should_finish_when_no_more_pages_and_drained() {
    InMemoryOutputBuffer buffer = new InMemoryOutputBuffer(1, 1024);
    buffer.enqueue(0, page(row(1L)));
    buffer.setNoMorePages();

    assertFalse(buffer.isFinished());
    buffer.drain(0);
    assertTrue(buffer.isFinished());
    assertThrows(IllegalStateException.class, () -> buffer.enqueue(0, page(row(2L))));
  }

  @Test
  void should_discard_pages_and_wake_producers_when_aborted() {
    InMemoryOutputBuffer buffer = new InMemoryOutputBuffer(1, 8);
    buffer.enqueue(0, page(row(1L)));
    ListenableFuture<Void> blocked = buffer.enqueue(0, page(row(2L)));

    buffer.abort();

    assertTrue(blocked.isDone());
    assertTrue(buffer.isFinished());
    assertTrue(buffer.drain(0).isEmpty());
    assertTrue(buffer.enqueue(0, page(row(3L))).isDone());
  }
}
