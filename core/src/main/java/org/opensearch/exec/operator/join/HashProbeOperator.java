/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.plan.EquiJoinNode;
import org.opensearch.exec.plan.JoinType;
import org.opensearch.exec.task.HashJoinBridge;

/**
 * Probes the hash table of a join with the rows of the probe side. Blocks until every build driver
 * has delivered its rows.
 */
public class HashProbeOperator implements Operator {

  private final OperatorContext context;
  private final JoinType joinType;
  private final List<Integer> probeKeys;
  private final int buildChannelCount;
  private final ListenableFuture<ListMultimap<List<Object>, Object[]>> buildResult;

  private final ListenableFuture<Void> buildBlocked;

  private Page pendingOutput;
  private boolean inputFinished;

  public HashProbeOperator(OperatorContext context, EquiJoinNode node, HashJoinBridge bridge) {
    this.context = context;
    this.joinType = node.getJoinType();
    this.probeKeys = node.getLeftKeys();
    this.buildChannelCount = node.getRight().getOutputType().getFieldCount();
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
    ListMultimap<List<Object>, Object[]> table = Futures.getUnchecked(buildResult);
    int width = page.getChannelCount() + buildChannelCount;
    PageBuilder builder = new PageBuilder(width);
    for (int position = 0; position < page.getPositionCount(); position++) {
      List<Object> key = JoinKeys.extract(page, position, probeKeys);
      List<Object[]> matches = key == null ? List.of() : table.get(key);
      Object[] probeRow = page.getRow(position);
      for (Object[] buildRow : matches) {
        builder.appendRow(JoinKeys.concat(probeRow, buildRow));
      }
      if (matches.isEmpty() && joinType == JoinType.LEFT) {
        builder.appendRow(JoinKeys.concat(probeRow, new Object[buildChannelCount]));
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
