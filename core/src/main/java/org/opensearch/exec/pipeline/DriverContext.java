/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.pipeline;

import com.google.common.util.concurrent.SettableFuture;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import org.opensearch.exec.task.Task;

/**
 * Identifies one driver within its task (pipeline id and driver id) and tracks its state. Once
 * FINISHED, FAILED or CANCELLED the state no longer changes.
 */
public class DriverContext {

  public enum Status {
    CREATED,
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  private static final Set<Status> TERMINAL =
      EnumSet.of(Status.FINISHED, Status.FAILED, Status.CANCELLED);

  @Getter private final Task task;
  @Getter private final int pipelineId;
  @Getter private final int driverId;

  private final AtomicReference<Status> status = new AtomicReference<>(Status.CREATED);
  private final AtomicBoolean cancelRequested = new AtomicBoolean();
  private final AtomicReference<SettableFuture<Void>> waiting = new AtomicReference<>();
  @Getter private volatile String failureMessage;

  public DriverContext(Task task, int pipelineId, int driverId) {
    this.task = task;
    this.pipelineId = pipelineId;
    this.driverId = driverId;
  }

  public Status getStatus() {
    return status.get();
  }

  void markRunning() {
    moveTo(Status.RUNNING);
  }

  void markFinished() {
    moveTo(Status.FINISHED);
  }

  void markFailed(String message) {
    if (moveTo(Status.FAILED)) {
      failureMessage = message;
    }
  }

  void markCancelled() {
    cancelRequested.set(true);
    moveTo(Status.CANCELLED);
  }

  private boolean moveTo(Status next) {
    Status current;
    do {
      current = status.get();
      if (TERMINAL.contains(current)) {
        return false;
      }
    } while (!status.compareAndSet(current, next));
    return true;
  }

  /**
   * Registers the future the driver returned while blocked. A cancel, earlier or later, completes
   * it so the driver runs again and observes the cancellation.
   */
  void setWaiting(SettableFuture<Void> future) {
    waiting.set(future);
    if (cancelRequested.get()) {
      future.set(null);
    }
  }

  /** Asks the driver to stop, waking it if it is blocked. It stops the next time it runs. */
  public void cancel() {
    cancelRequested.set(true);
    SettableFuture<Void> future = waiting.get();
    if (future != null) {
      future.set(null);
    }
  }

  public boolean isCancelled() {
    return cancelRequested.get();
  }

  @Override
  public String toString() {
    return (task == null ? "?" : task.getTaskId()) + "/" + pipelineId + "." + driverId;
  }
}
