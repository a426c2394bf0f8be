/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.opensearch.exec.testing.TestingPlans.page;
import static org.opensearch.exec.testing.TestingPlans.row;

import com.google.common.util.concurrent.ListenableFuture;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.exec.expression.Expression;
import org.opensearch.exec.operator.CallbackSinkOperator;
import org.opensearch.exec.operator.FilterProjectOperator;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.ValuesOperator;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.task.PageQueue;
import org.opensearch.exec.testing.CollectingConsumer;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DriverTest {

  private final DriverContext context = new DriverContext(null, 0, 0);

  @Test
  void should_run_source_to_sink_pipeline() {
    // Given: Values -> FilterProject keeping odd values -> consumer
    CollectingConsumer consumer = new CollectingConsumer();
    Expression odd = (page, position) -> (Long) page.getValue(position, 0) % 2 == 1;
    List<Operator> operators =
        List.of(
            values(page(row(1L), row(2L)), page(row(3L))),
            new FilterProjectOperator(operatorContext(1), odd, List.of(Expression.field(0))),
            new CallbackSinkOperator(operatorContext(2), consumer.get()));

    // When
    Driver driver = new Driver(context, operators, 100);
    ListenableFuture<Void> blocked = driver.process();

    // Then
    assertTrue(blocked.isDone());
    assertTrue(driver.isFinished());
    assertEquals(DriverContext.Status.FINISHED, context.getStatus());
    assertEquals(List.of(List.of(1L), List.of(3L)), consumer.getRows());
    assertEquals(1, consumer.getFinishedDrivers());
  }

  @Test
  void should_collect_output_of_last_operator_without_sink() {
    Driver driver = new Driver(context, List.of(values(page(row(1L)), page(row(2L)))), 100);

    driver.process();

    assertTrue(driver.isFinished());
    assertEquals(2, driver.getOutputPages().size());
  }

  @Test
  void should_yield_blocked_future_when_sink_is_full() {
    // Given: a queue holding one page that nobody reads
    PageQueue queue = new PageQueue("queue", 1, null);
    queue.addProducer();
    Driver driver =
        new Driver(
            context,
            List.of(
                values(page(row(1L)), page(row(2L))),
                new CallbackSinkOperator(operatorContext(1), queue)),
            100);

    // When
    ListenableFuture<Void> blocked = driver.process();

    // Then
    assertFalse(blocked.isDone());
    assertFalse(driver.isFinished());
    queue.pollPage();
    assertTrue(blocked.isDone());
    driver.process();
    queue.pollPage();
    driver.process();
    assertTrue(driver.isFinished());
  }

  @Test
  void should_give_thread_back_after_iteration_quantum() {
    Driver driver =
        new Driver(context, List.of(values(page(row(1L)), page(row(2L)), page(row(3L)))), 1);

    assertTrue(driver.process().isDone());
    assertFalse(driver.isFinished());
    driver.process();
    driver.process();
    assertTrue(driver.isFinished());
  }

  @Test
  void should_stop_when_cancelled() {
    Driver driver = new Driver(context, List.of(values(page(row(1L)))), 100);

    context.cancel();
    driver.process();

    assertFalse(driver.isFinished());
    assertEquals(DriverContext.Status.CANCELLED, context.getStatus());
  }

  @Test
  void should_wake_blocked_driver_when_cancelled() {
    // Given: a driver blocked on a sink nobody drains
    PageQueue queue = new PageQueue("queue", 1, null);
    queue.addProducer();
    Driver driver =
        new Driver(
            context,
            List.of(
                values(page(row(1L)), page(row(2L))),
                new CallbackSinkOperator(operatorContext(1), queue)),
            100);
    ListenableFuture<Void> blocked = driver.process();
    assertFalse(blocked.isDone());

    // When
    context.cancel();

    // Then
    assertTrue(blocked.isDone());
    assertTrue(driver.process().isDone());
    assertEquals(DriverContext.Status.CANCELLED, context.getStatus());
  }

  @Test
  void should_listen_once_to_future_that_stays_pending() {
    PageQueue queue = new PageQueue("queue", 1, null);
    queue.addProducer();
    Driver driver =
        new Driver(
            context,
            List.of(
                values(page(row(1L)), page(row(2L))),
                new CallbackSinkOperator(operatorContext(1), queue)),
            100);

    ListenableFuture<Void> first = driver.process();
    ListenableFuture<Void> second = driver.process();

    assertSame(first, second);
    assertEquals(1, driver.listenerCount());
    queue.pollPage();
    assertTrue(first.isDone());
    assertEquals(0, driver.listenerCount());
  }

  @Test
  void should_yield_after_idle_pass_when_nothing_is_blocked() {
    // Given: a source with no page yet and no future to wait on
    Operator idle = mock(Operator.class);
    when(idle.isBlocked()).thenReturn(Operator.NOT_BLOCKED);
    Driver driver = new Driver(context, List.of(idle), 100);

    // When
    ListenableFuture<Void> blocked = driver.process();

    // Then
    assertTrue(blocked.isDone());
    assertFalse(driver.isFinished());
    verify(idle, times(1)).getOutput();
  }

  @Test
  void should_mark_driver_failed_when_operator_throws() {
    Operator failing = mock(Operator.class);
    when(failing.needsInput()).thenReturn(true);
    when(failing.isBlocked()).thenReturn(Operator.NOT_BLOCKED);
    doThrow(new IllegalStateException("boom")).when(failing).addInput(any());
    Driver driver = new Driver(context, List.of(values(page(row(1L))), failing), 100);

    IllegalStateException exception = assertThrows(IllegalStateException.class, driver::process);

    assertEquals("boom", exception.getMessage());
    assertEquals(DriverContext.Status.FAILED, context.getStatus());
    assertEquals("boom", context.getFailureMessage());
  }

  @Test
  void should_close_every_operator_even_if_one_fails() throws Exception {
    Operator first = mock(Operator.class);
    Operator second = mock(Operator.class);
    doThrow(new IllegalStateException("close failed")).when(first).close();
    Driver driver = new Driver(context, List.of(first, second), 100);

    driver.close();
    driver.close();

    verify(first).close();
    verify(second).close();
  }

  @Test
  void should_reject_driver_without_operators() {
    assertThrows(IllegalArgumentException.class, () -> new Driver(context, new ArrayList<>(), 1));
  }

  private ValuesOperator values(Page... pages) {
    return new ValuesOperator(operatorContext(0), List.of(pages));
  }

  private OperatorContext operatorContext(int operatorId) {
    return new OperatorContext(operatorId, "node" + operatorId, "Test", context);
  }
}
