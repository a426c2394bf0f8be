/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.connector;

import java.util.OptionalInt;
import org.opensearch.exec.pipeline.DriverContext;

/** A connector table a {@code TableScanNode} reads from. */
public interface ConnectorTableHandle {

  /** Returns the qualified table name, used in plan descriptions and logs. */
  String getTableName();

  /**
   * Opens the page source read by one driver. Implementations split the table across drivers by
   * {@link DriverContext#getDriverId()}.
   */
  PageSource createPageSource(DriverContext driverContext);

  /** Returns the largest number of drivers that may scan this table concurrently, if limited. */
  default OptionalInt getMaxParallelism() {
    return OptionalInt.empty();
  }
}
