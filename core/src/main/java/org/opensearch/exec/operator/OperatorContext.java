/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import lombok.Getter;
import org.opensearch.exec.pipeline.DriverContext;
import org.opensearch.exec.task.Task;

/** Identity of one operator within its driver, and access to the owning driver and task. */
@Getter
public class OperatorContext {

  private final int operatorId;
  private final String planNodeId;
  private final String operatorType;
  private final DriverContext driverContext;

  public OperatorContext(
      int operatorId, String planNodeId, String operatorType, DriverContext driverContext) {
    this.operatorId = operatorId;
    this.planNodeId = planNodeId;
    this.operatorType = operatorType;
    this.driverContext = driverContext;
  }

  /** Returns the task owning the driver. */
  public Task getTask() {
    return driverContext.getTask();
  }

  /** Returns true if the driver has been cancelled. */
  public boolean isCancelled() {
    return driverContext.isCancelled();
  }

  @Override
  public String toString() {
    return operatorType + "#" + operatorId + "[" + planNodeId + "]@" + driverContext;
  }
}
