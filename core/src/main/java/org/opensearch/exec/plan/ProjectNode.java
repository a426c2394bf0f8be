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
import org.opensearch.exec.expression.Expression;

/** Computes one output column per projection expression. */
@Getter
public class ProjectNode extends SingleSourceNode {

  private final List<Expression> projections;
  private final RelDataType outputType;

  public ProjectNode(
      String id, PlanNode source, List<Expression> projections, RelDataType outputType) {
    super(id, source);
    this.projections = ImmutableList.copyOf(projections);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    Preconditions.checkArgument(
        projections.size() == outputType.getFieldCount(),
        "Project %s: %s projections for %s output columns",
        id,
        projections.size(),
        outputType.getFieldCount());
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
