/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;

/**
 * Base class of two-input joins. The left input is the probe side and stays in the join's
 * pipeline; the right input is the build side and runs in a pipeline of its own. Output columns are
 * the left columns followed by the right columns.
 */
@Getter
public abstract class AbstractJoinNode extends PlanNode {

  private final PlanNode left;
  private final PlanNode right;
  private final RelDataType outputType;

  protected AbstractJoinNode(String id, PlanNode left, PlanNode right, RelDataType outputType) {
    super(id);
    this.left = Preconditions.checkNotNull(left, "Join %s requires a left source", id);
    this.right = Preconditions.checkNotNull(right, "Join %s requires a right source", id);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    int expected =
        left.getOutputType().getFieldCount() + right.getOutputType().getFieldCount();
    Preconditions.checkArgument(
        outputType.getFieldCount() == expected,
        "Join %s: row type has %s columns, expected %s",
        id,
        outputType.getFieldCount(),
        expected);
  }

  @Override
  public List<PlanNode> getSources() {
    return List.of(left, right);
  }
}
