/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.task.CrossJoinBridge;

/** Pairs every probe row with every build row. */
public class CrossJoinProbeOperator implements Operator {

  private final OperatorContext context;
  private final int buildChannelCount;
  private final ListenableFuture<List<Page>> buildResult;
  private final ListenableFuture<Void> buildBlocked;

  private Page pendingOutput;
  private boolean inputFinished;

  public CrossJoinProbeOperator(
      OperatorContext context, CrossJoinBridge bridge, int buildChannelCount) {
    this.context = context;
    this.buildChannelCount = buildChannelCount;
    this.buildResult = bridge.getBuildResult();
    this.buildBlocked =
        Futures.transform(buildResult, ignored -> null, MoreExecutors.directExecutor());
  }

  @Override
  public ListenableFuture<Void> isBlocked() {
    return buildResult.isDone() ? NOT_BLOCKED : buildBlocked;
  }

  @Override
  public boolean needsInput() {
    return buildResult.isDone() && pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    List<Page> buildPages = Futures.getUnchecked(buildResult);
    PageBuilder builder = new PageBuilder(page.getChannelCount() + buildChannelCount);
    for (int position = 0; position < page.getPositionCount(); position++) {
      Object[] probeRow = page.getRow(position);
      for (Page buildPage : buildPages) {
        for (int buildPosition = 0;
            buildPosition < buildPage.getPositionCount();
            buildPosition++) {
          builder.appendRow(JoinKeys.concat(probeRow, buildPage.getRow(buildPosition)));
        }
      }
    }
    if (!builder.isEmpty()) {
      pendingOutput = builder.build();
    }
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return inputFinished && pendingOutput == null;
  }

  @Override
  public void finish() {
    inputFinished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
