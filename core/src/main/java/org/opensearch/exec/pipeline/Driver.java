/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.pipeline;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.SinkOperator;
import org.opensearch.exec.page.Page;

/**
 * Runs one instance of a pipeline by moving pages through its chain of operators. The driver
 * implements a pull/push loop: it pulls output from each operator and pushes it as input to the
 * next one.
 *
 * <p>Execution model:
 *
 * <ol>
 *   <li>The first operator produces pages from a connector, another task or another pipeline
 *   <li>Each intermediate operator transforms pages
 *   <li>The last operator is either a sink handing pages to another pipeline or the task's
 *       consumer, or a plain operator whose output the driver collects
 *   <li>When the last operator is finished, the driver is complete
 * </ol>
 *
 * <p>A driver never waits: {@link #process()} returns a pending future when no operator can make
 * progress, and the caller reschedules the driver once it completes.
 */
@Log4j2
public class Driver implements AutoCloseable {

  private final DriverContext context;
  private final List<Operator> operators;
  private final boolean[] finishCalled;
  private final int maxIterations;
  private final List<Page> outputPages = new ArrayList<>();
  private boolean closed;

  // Guarded by this. Each pending operator future gets one listener, which wakes the current
  // waiting future.
  private final Set<ListenableFuture<Void>> listening = Sets.newIdentityHashSet();
  private SettableFuture<Void> waiting;

  /**
   * Creates a driver.
   *
   * @param context the driver's context
   * @param operators operators in source-to-sink order
   * @param maxIterations loop iterations one {@link #process()} call runs before yielding
   */
  public Driver(DriverContext context, List<Operator> operators, int maxIterations) {
    Preconditions.checkArgument(!operators.isEmpty(), "Driver %s has no operators", context);
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive");
    this.context = context;
    this.operators = ImmutableList.copyOf(operators);
    this.finishCalled = new boolean[operators.size()];
    this.maxIterations = maxIterations;
  }

  /**
   * Moves pages through the operators until the driver is finished, is blocked, or has used its
   * iteration quantum.
   *
   * @return a pending future if every operator that could move is blocked, otherwise {@link
   *     Operator#NOT_BLOCKED}
   */
  public ListenableFuture<Void> process() {
    Preconditions.checkState(!closed, "Driver %s is closed", context);
    if (context.isCancelled()) {
      context.markCancelled();
      return Operator.NOT_BLOCKED;
    }
    context.markRunning();
    try {
      for (int iteration = 0; iteration < maxIterations; iteration++) {
        boolean madeProgress = processOnce();
        if (isFinished()) {
          context.markFinished();
          return Operator.NOT_BLOCKED;
        }
        if (context.isCancelled()) {
          context.markCancelled();
          return Operator.NOT_BLOCKED;
        }
        if (!madeProgress) {
          List<ListenableFuture<Void>> blocked = blockedFutures();
          if (!blocked.isEmpty()) {
            return awaitAny(blocked);
          }
          log.debug("Driver {} made no progress and is not blocked, yielding", context);
          return Operator.NOT_BLOCKED;
        }
      }
      return Operator.NOT_BLOCKED;
    } catch (RuntimeException e) {
      context.markFailed(e.getMessage());
      throw e;
    }
  }

  /** Processes one pass over the operator pairs. Returns true if data or state moved. */
  boolean processOnce() {
    boolean madeProgress = false;

    // Drive operator[i] -> operator[i+1]
    for (int i = 0; i < operators.size() - 1; i++) {
      Operator current = operators.get(i);
      Operator next = operators.get(i + 1);
      if (!current.isBlocked().isDone() || !next.isBlocked().isDone()) {
        continue;
      }
      if (!current.isFinished() && next.needsInput()) {
        Page output = current.getOutput();
        if (output != null && output.getPositionCount() > 0) {
          next.addInput(output);
          madeProgress = true;
        }
      }
      if (current.isFinished() && !finishCalled[i + 1]) {
        finishCalled[i + 1] = true;
        next.finish();
        madeProgress = true;
      }
    }

    // Collect the output of a last operator that is not a sink.
    Operator last = operators.get(operators.size() - 1);
    if (!(last instanceof SinkOperator) && last.isBlocked().isDone() && !last.isFinished()) {
      Page output = last.getOutput();
      if (output != null) {
        if (output.getPositionCount() > 0) {
          outputPages.add(output);
        }
        madeProgress = true;
      }
    }
    return madeProgress;
  }

  /** Returns true if the last operator has finished. */
  public boolean isFinished() {
    return operators.get(operators.size() - 1).isFinished();
  }

  public DriverContext getContext() {
    return context;
  }

  public List<Operator> getOperators() {
    return operators;
  }

  /** Returns the pages produced by a last operator that is not a sink. */
  public List<Page> getOutputPages() {
    return outputPages;
  }

  /** Closes all operators, releasing resources. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (Operator op : operators) {
      try {
        op.close();
      } catch (Exception e) {
        log.warn("Error closing operator {}", op.getContext(), e);
      }
    }
  }

  private List<ListenableFuture<Void>> blockedFutures() {
    List<ListenableFuture<Void>> blocked = new ArrayList<>();
    for (Operator op : operators) {
      ListenableFuture<Void> future = op.isBlocked();
      if (!future.isDone()) {
        blocked.add(future);
      }
    }
    return blocked;
  }

  /**
   * Returns a future completing when any of {@code blocked} completes or the driver is cancelled.
   * The future is shared until it completes.
   */
  private ListenableFuture<Void> awaitAny(List<ListenableFuture<Void>> blocked) {
    SettableFuture<Void> current;
    synchronized (this) {
      if (waiting == null || waiting.isDone()) {
        waiting = SettableFuture.create();
        context.setWaiting(waiting);
      }
      current = waiting;
      for (ListenableFuture<Void> future : blocked) {
        if (listening.add(future)) {
          future.addListener(() -> wake(future), MoreExecutors.directExecutor());
        }
      }
    }
    return current;
  }

  private void wake(ListenableFuture<Void> completed) {
    SettableFuture<Void> current;
    synchronized (this) {
      listening.remove(completed);
      current = waiting;
    }
    if (current != null) {
      current.set(null);
    }
  }

  /** Returns the number of operator futures the driver listens to. */
  synchronized int listenerCount() {
    return listening.size();
  }

  @Override
  public String toString() {
    return "Driver{" + context + '}';
  }
}
