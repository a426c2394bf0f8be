/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;

/**
 * Appends a column of ids unique across the cluster: the task's unique id in the high bits and a
 * counter shared by all drivers of the task in the low bits.
 */
@Getter
public class AssignUniqueIdNode extends SingleSourceNode {

  /** Number of low bits holding the per-task counter. */
  public static final int COUNTER_BITS = 40;

  private final int taskUniqueId;
  private final RelDataType outputType;

  public AssignUniqueIdNode(
      String id, PlanNode source, int taskUniqueId, RelDataType outputType) {
    super(id, source);
    Preconditions.checkArgument(
        taskUniqueId >= 0 && taskUniqueId < (1 << 23),
        "AssignUniqueId %s: task unique id out of range: %s",
        id,
        taskUniqueId);
    this.taskUniqueId = taskUniqueId;
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    Preconditions.checkArgument(
        outputType.getFieldCount() == source.getOutputType().getFieldCount() + 1,
        "AssignUniqueId %s must append exactly one column",
        id);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAssignUniqueId(this, context);
  }
}
