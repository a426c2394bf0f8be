/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/** Reads pages produced by other tasks through the task's exchange client. */
public class ExchangeNode extends PlanNode {

  private final RelDataType outputType;

  public ExchangeNode(String id, RelDataType outputType) {
    super(id);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
  }

  @Override
  public List<PlanNode> getSources() {
    return List.of();
  }

  @Override
  public RelDataType getOutputType() {
    return outputType;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitExchange(this, context);
  }
}
