/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.exception;

import lombok.Getter;
import org.opensearch.exec.plan.PlanNode;

/** Thrown when no operator can be created for a plan node. */
@Getter
public class UnsupportedPlanNodeException extends QueryEngineException {

  private final String planNodeId;

  public UnsupportedPlanNodeException(PlanNode node) {
    super("Unsupported plan node: " + node);
    this.planNodeId = node.getId();
  }
}
