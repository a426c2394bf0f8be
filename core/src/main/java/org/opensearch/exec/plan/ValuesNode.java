/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.exec.page.Page;

/**
 * Produces a fixed list of pages. Unless marked parallelizable, the pipeline reading it runs a
 * single driver, so the rows are produced exactly once.
 */
@Getter
public class ValuesNode extends PlanNode {

  private final RelDataType outputType;
  private final List<Page> values;
  private final boolean parallelizable;

  public ValuesNode(String id, RelDataType outputType, List<Page> values) {
    this(id, outputType, values, false);
  }

  /**
   * Creates a values node.
   *
   * @param id node id
   * @param outputType row type of the pages
   * @param values pages to produce, in order
   * @param parallelizable true if every driver may produce the full list, as tests do
   */
  public ValuesNode(String id, RelDataType outputType, List<Page> values, boolean parallelizable) {
    super(id);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    this.values = ImmutableList.copyOf(values);
    this.parallelizable = parallelizable;
    for (Page page : this.values) {
      Preconditions.checkArgument(
          page.getChannelCount() == outputType.getFieldCount(),
          "Values %s: page has %s channels, row type has %s",
          id,
          page.getChannelCount(),
          outputType.getFieldCount());
    }
  }

  @Override
  public List<PlanNode> getSources() {
    return List.of();
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitValues(this, context);
  }
}
