/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.exec.testing.OperatorHarness.operatorContext;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import com.google.common.util.concurrent.ListenableFuture;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.task.PageQueue;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LocalExchangeSourceOperatorTest {

  @Test
  void should_read_pages_until_producers_finish() {
    PageQueue queue = new PageQueue("exchange", 4, null);
    queue.addProducer();
    LocalExchangeSourceOperator source =
        new LocalExchangeSourceOperator(operatorContext("exchange"), queue);
    Page page = page(row(1L));

    assertFalse(source.isBlocked().isDone());
    queue.consume(page);

    assertTrue(source.isBlocked().isDone());
    assertSame(page, source.getOutput());
    assertFalse(source.isFinished());
    queue.noMoreData();
    assertTrue(source.isFinished());
  }

  @Test
  void should_release_blocked_producer_when_closed() {
    // Given
    PageQueue queue = new PageQueue("exchange", 1, null);
    queue.addProducer();
    LocalExchangeSourceOperator source =
        new LocalExchangeSourceOperator(operatorContext("exchange"), queue);
    ListenableFuture<Void> producer = queue.consume(page(row(1L)));
    assertFalse(producer.isDone());

    // When
    source.close();

    // Then
    assertTrue(producer.isDone());
    assertTrue(source.isFinished());
    assertNull(source.getOutput());
  }
}
