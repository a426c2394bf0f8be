/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.connector;

import org.opensearch.exec.pipeline.DriverContext;

/** A connector write target a {@code TableWriteNode} writes into. */
public interface ConnectorInsertTableHandle {

  /** Returns the qualified table name. */
  String getTableName();

  /**
   * Returns true if several drivers may write into this target at the same time. When false the
   * writing pipeline runs a single driver.
   */
  boolean supportsMultiThreading();

  /** Opens the page sink written by one driver. */
  PageSink createPageSink(DriverContext driverContext);
}
