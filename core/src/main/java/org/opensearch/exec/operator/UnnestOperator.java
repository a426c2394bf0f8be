/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;

/**
 * Expands collection values into rows. Each input row produces as many rows as its longest
 * unnested collection; shorter collections are padded with nulls and replicated channels are
 * repeated. A row whose collections are all null or empty produces nothing.
 */
public class UnnestOperator implements Operator {

  private final OperatorContext context;
  private final List<Integer> replicateChannels;
  private final List<Integer> unnestChannels;

  private Page pendingOutput;
  private boolean inputFinished;

  public UnnestOperator(
      OperatorContext context, List<Integer> replicateChannels, List<Integer> unnestChannels) {
    this.context = context;
    this.replicateChannels = ImmutableList.copyOf(replicateChannels);
    this.unnestChannels = ImmutableList.copyOf(unnestChannels);
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    int width = replicateChannels.size() + unnestChannels.size();
    PageBuilder builder = new PageBuilder(width);
    for (int position = 0; position < page.getPositionCount(); position++) {
      List<List<Object>> collections = new ArrayList<>(unnestChannels.size());
      int rows = 0;
      for (int channel : unnestChannels) {
        List<Object> elements = elements(page.getValue(position, channel));
        collections.add(elements);
        rows = Math.max(rows, elements.size());
      }
      for (int i = 0; i < rows; i++) {
        Object[] row = new Object[width];
        int out = 0;
        for (int channel : replicateChannels) {
          row[out++] = page.getValue(position, channel);
        }
        for (List<Object> elements : collections) {
          row[out++] = i < elements.size() ? elements.get(i) : null;
        }
        builder.appendRow(row);
      }
    }
    if (!builder.isEmpty()) {
      pendingOutput = builder.build();
    }
  }

  private List<Object> elements(Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    throw new IllegalArgumentException(
        "Cannot unnest value of type " + value.getClass().getSimpleName() + " in " + context);
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
