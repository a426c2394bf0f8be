/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;
import org.opensearch.exec.plan.JoinType;
import org.opensearch.exec.plan.MergeJoinNode;
import org.opensearch.exec.task.PageQueue;

/**
 * Joins the left input with the right side delivered through the task's merge-join source. Both
 * sides arrive sorted by their keys; output follows left order with matching right rows in right
 * order. The right side is read completely before the first left page is joined.
 */
public class MergeJoinOperator implements Operator {

  private final OperatorContext context;
  private final JoinType joinType;
  private final List<Integer> leftKeys;
  private final List<Integer> rightKeys;
  private final int rightChannelCount;
  private final PageQueue rightSource;
  private final ListMultimap<List<Object>, Object[]> rightRows = ArrayListMultimap.create();

  private boolean rightFinished;
  private Page pendingOutput;
  private boolean inputFinished;

  public MergeJoinOperator(OperatorContext context, MergeJoinNode node, PageQueue rightSource) {
    this.context = context;
    this.joinType = node.getJoinType();
    this.leftKeys = node.getLeftKeys();
    this.rightKeys = node.getRightKeys();
    this.rightChannelCount = node.getRight().getOutputType().getFieldCount();
    this.rightSource = rightSource;
  }

  /** Reads every right page available now. Returns true once the right side is complete. */
  private boolean drainRight() {
    while (!rightFinished) {
      Page page = rightSource.pollPage();
      if (page == null) {
        rightFinished = rightSource.isFinished();
        return rightFinished;
      }
      for (int position = 0; position < page.getPositionCount(); position++) {
        List<Object> key = JoinKeys.extract(page, position, rightKeys);
        if (key != null) {
          rightRows.put(key, page.getRow(position));
        }
      }
    }
    return true;
  }

  @Override
  public ListenableFuture<Void> isBlocked() {
    return drainRight() ? NOT_BLOCKED : rightSource.isBlocked();
  }

  @Override
  public boolean needsInput() {
    return drainRight() && pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    PageBuilder builder = new PageBuilder(page.getChannelCount() + rightChannelCount);
    for (int position = 0; position < page.getPositionCount(); position++) {
      List<Object> key = JoinKeys.extract(page, position, leftKeys);
      List<Object[]> matches = key == null ? List.of() : rightRows.get(key);
      Object[] leftRow = page.getRow(position);
      for (Object[] rightRow : matches) {
        builder.appendRow(JoinKeys.concat(leftRow, rightRow));
      }
      if (matches.isEmpty() && joinType == JoinType.LEFT) {
        builder.appendRow(JoinKeys.concat(leftRow, new Object[rightChannelCount]));
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

  /** Closes the merge-join source, waking right-side drivers still blocked on it. */
  @Override
  public void close() {
    rightSource.close();
  }
}
