/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import java.util.List;
import java.util.OptionalInt;
import org.apache.calcite.rel.type.RelDataType;

/**
 * Equi-join of two inputs sorted on the join keys. The right input is handed over through a
 * merge-join source the task creates for this node, so the probe side runs a single driver.
 */
public class MergeJoinNode extends EquiJoinNode {

  public MergeJoinNode(
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
  public OptionalInt getMaxDrivers() {
    return OptionalInt.of(1);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitMergeJoin(this, context);
  }
}
