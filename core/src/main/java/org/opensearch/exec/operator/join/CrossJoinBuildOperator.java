/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.join;

import java.util.ArrayList;
import java.util.List;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.SinkOperator;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.task.CrossJoinBridge;

/** Collects the pages of the build side of a cross join. */
public class CrossJoinBuildOperator implements SinkOperator {

  private final OperatorContext context;
  private final CrossJoinBridge bridge;
  private final List<Page> pages = new ArrayList<>();
  private boolean finished;

  public CrossJoinBuildOperator(OperatorContext context, CrossJoinBridge bridge) {
    this.context = context;
    this.bridge = bridge;
    bridge.addBuilder();
  }

  @Override
  public boolean needsInput() {
    return !finished;
  }

  @Override
  public void addInput(Page page) {
    pages.add(page);
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public void finish() {
    if (!finished) {
      finished = true;
      bridge.builderFinished(pages);
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
