/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.exec.connector.ConnectorInsertTableHandle;

/** Writes its input into a connector table and produces the written row count. */
@Getter
public class TableWriteNode extends SingleSourceNode {

  private final ConnectorInsertTableHandle insertTableHandle;
  private final RelDataType outputType;

  /**
   * Creates a table write node.
   *
   * @param id node id
   * @param source the rows to write
   * @param insertTableHandle the write target
   * @param outputType a single-column row type holding the written row count
   */
  public TableWriteNode(
      String id,
      PlanNode source,
      ConnectorInsertTableHandle insertTableHandle,
      RelDataType outputType) {
    super(id, source);
    this.insertTableHandle = Preconditions.checkNotNull(insertTableHandle, "insertTableHandle");
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    Preconditions.checkArgument(
        outputType.getFieldCount() == 1, "Table write %s must produce a single column", id);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitTableWrite(this, context);
  }
}
