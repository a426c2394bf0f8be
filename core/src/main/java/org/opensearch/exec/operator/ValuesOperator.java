/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.opensearch.exec.page.Page;

/** Produces a fixed list of pages. */
public class ValuesOperator implements SourceOperator {

  private final OperatorContext context;
  private final List<Page> values;
  private int index;

  public ValuesOperator(OperatorContext context, List<Page> values) {
    this.context = context;
    this.values = ImmutableList.copyOf(values);
  }

  @Override
  public Page getOutput() {
    if (index >= values.size()) {
      return null;
    }
    return values.get(index++);
  }

  @Override
  public boolean isFinished() {
    return index >= values.size();
  }

  @Override
  public void finish() {
    index = values.size();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {}
}
