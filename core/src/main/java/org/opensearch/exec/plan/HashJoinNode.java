/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/** Equi-join that builds a hash table from the right input and probes it with the left input. */
public class HashJoinNode extends EquiJoinNode {

  public HashJoinNode(
      String id,
      JoinType joinType,
      List<Integer> leftKeys,
      List<Integer> rightKeys,
      PlanNode left,
      PlanNode right,
      RelDataType outputType) {
    super(id, joinType, leftKeys, rightKeys, left, right, outputType);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitHashJoin(this, context);
  }
}
