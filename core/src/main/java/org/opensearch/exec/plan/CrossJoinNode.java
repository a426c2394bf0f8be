/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import org.apache.calcite.rel.type.RelDataType;

/** Cartesian product; the right input is materialized and every left row is paired with it. */
public class CrossJoinNode extends AbstractJoinNode {

  public CrossJoinNode(String id, PlanNode left, PlanNode right, RelDataType outputType) {
    super(id, left, right, outputType);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitCrossJoin(this, context);
  }
}
