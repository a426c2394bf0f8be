/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.exception;

import lombok.Getter;

/** Thrown when a plan tree violates a structural rule, such as a duplicated node id. */
@Getter
public class MalformedPlanException extends QueryEngineException {

  private final String planNodeId;

  public MalformedPlanException(String planNodeId, String message) {
    super(String.format("Malformed plan at node %s: %s", planNodeId, message));
    this.planNodeId = planNodeId;
  }
}
