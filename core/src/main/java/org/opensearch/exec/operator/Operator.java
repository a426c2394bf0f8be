/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.opensearch.exec.page.Page;

/**
 * One processing stage of a driver. The driver moves {@link Page}s between neighbouring operators:
 * it pulls from an operator with {@link #getOutput()} and pushes into the next one with {@link
 * #addInput(Page)} while that one {@link #needsInput()}. Once an upstream operator is finished the
 * driver calls {@link #finish()} downstream; an operator is done when {@link #isFinished()}.
 * Operators that wait on another driver report it through {@link #isBlocked()}.
 */
public interface Operator extends AutoCloseable {

  ListenableFuture<Void> NOT_BLOCKED = Futures.immediateVoidFuture();

  boolean needsInput();

  /** Only called while {@link #needsInput()} is true. */
  void addInput(Page page);

  /** Returns a page, or null if none is ready. Null says nothing about being finished. */
  Page getOutput();

  boolean isFinished();

  /** No more input will arrive. May be called more than once. */
  void finish();

  /**
   * Returns a pending future while the operator waits on state owned by another driver, such as a
   * full queue or a join side still being built. The driver gives up its thread until the future
   * completes or is cancelled.
   */
  default ListenableFuture<Void> isBlocked() {
    return NOT_BLOCKED;
  }

  OperatorContext getContext();
}
