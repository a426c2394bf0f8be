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

/** A join on equality of key channels. */
@Getter
public abstract class EquiJoinNode extends AbstractJoinNode {

  private final JoinType joinType;
  private final List<Integer> leftKeys;
  private final List<Integer> rightKeys;

  protected EquiJoinNode(
      String id,
      JoinType joinType,
      List<Integer> leftKeys,
      List<Integer> rightKeys,
      PlanNode left,
      PlanNode right,
      RelDataType outputType) {
    super(id, left, right, outputType);
    this.joinType = Preconditions.checkNotNull(joinType, "joinType");
    this.leftKeys = ImmutableList.copyOf(leftKeys);
    this.rightKeys = ImmutableList.copyOf(rightKeys);
    Preconditions.checkArgument(
        !leftKeys.isEmpty() && leftKeys.size() == rightKeys.size(),
        "Join %s: key lists must be non-empty and of equal size",
        id);
  }
}
