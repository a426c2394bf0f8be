/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

/**
 * Hands the build side of a join from the build pipeline's drivers to the probe drivers. Every
 * build driver registers with {@link #addBuilder()} when created and delivers its share with
 * {@link #builderFinished(Object)}; the result is published once the last builder is done.
 *
 * @param <T> the build-side data structure
 */
public abstract class JoinBridge<T> {

  private final String planNodeId;
  private final SettableFuture<T> buildResult = SettableFuture.create();
  private int builders;
  private int finishedBuilders;

  protected JoinBridge(String planNodeId) {
    this.planNodeId = planNodeId;
  }

  public String getPlanNodeId() {
    return planNodeId;
  }

  public synchronized void addBuilder() {
    Preconditions.checkState(
        !buildResult.isDone(), "Join %s: build side already published", planNodeId);
    builders++;
  }

  /** Adds one builder's share; publishes the result if this was the last builder. */
  public void builderFinished(T partial) {
    T result = null;
    synchronized (this) {
      Preconditions.checkState(
          finishedBuilders < builders, "Join %s: more builders finished than added", planNodeId);
      merge(partial);
      finishedBuilders++;
      if (finishedBuilders == builders) {
        result = publish();
      }
    }
    if (result != null) {
      buildResult.set(result);
    }
  }

  /** Returns a future holding the complete build side. */
  public ListenableFuture<T> getBuildResult() {
    return buildResult;
  }

  /** Wakes every probe waiting on the build side. */
  public void cancel() {
    buildResult.cancel(false);
  }

  /** Merges a builder's share. Called under the bridge's lock. */
  protected abstract void merge(T partial);

  /** Returns the complete build side. Called once, under the bridge's lock. */
  protected abstract T publish();
}
