/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.OptionalInt;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.exec.connector.ConnectorTableHandle;

/** Reads a connector table. */
@Getter
public class TableScanNode extends PlanNode {

  private final RelDataType outputType;
  private final ConnectorTableHandle tableHandle;

  public TableScanNode(String id, RelDataType outputType, ConnectorTableHandle tableHandle) {
    super(id);
    this.outputType = Preconditions.checkNotNull(outputType, "outputType");
    this.tableHandle = Preconditions.checkNotNull(tableHandle, "tableHandle");
  }

  @Override
  public List<PlanNode> getSources() {
    return List.of();
  }

  /** The connector decides how many drivers may scan the table. */
  @Override
  public OptionalInt getMaxDrivers() {
    return tableHandle.getMaxParallelism();
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitTableScan(this, context);
  }

  @Override
  public String toString() {
    return super.toString() + "(" + tableHandle.getTableName() + ")";
  }
}
