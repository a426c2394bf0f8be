/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.exec.expression.Expression;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.PageBuilder;

/**
 * Keeps the rows of a page matching a predicate and evaluates a list of projections over them, in
 * one pass. A filter alone runs with the identity projection, a projection alone with a predicate
 * that is always true.
 */
public class FilterProjectOperator implements Operator {

  private final OperatorContext context;
  @Getter private final Expression filter;
  @Getter private final List<Expression> projections;

  private Page pendingOutput;
  private boolean inputFinished;

  public FilterProjectOperator(
      OperatorContext context, Expression filter, List<Expression> projections) {
    this.context = context;
    this.filter = filter;
    this.projections = ImmutableList.copyOf(projections);
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (pendingOutput != null) {
      throw new IllegalStateException("Cannot add input when output is pending");
    }
    PageBuilder builder = new PageBuilder(projections.size());
    for (int position = 0; position < page.getPositionCount(); position++) {
      if (!Boolean.TRUE.equals(filter.evaluate(page, position))) {
        continue;
      }
      Object[] row = new Object[projections.size()];
      for (int channel = 0; channel < row.length; channel++) {
        row[channel] = projections.get(channel).evaluate(page, position);
      }
      builder.appendRow(row);
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
