/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import org.opensearch.exec.pipeline.DriverContext;

/** Creates the sink operator that ends each driver of a pipeline. */
@FunctionalInterface
public interface OperatorSupplier {

  /**
   * Creates one sink operator.
   *
   * @param operatorId id of the operator within its driver
   * @param driverContext the driver the operator belongs to
   * @return a new operator
   */
  Operator create(int operatorId, DriverContext driverContext);
}
