/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import java.util.OptionalInt;
import org.opensearch.exec.pipeline.DriverContext;
import org.opensearch.exec.plan.PlanNode;

/**
 * Turns plan node kinds unknown to the engine into operators. Translators are registered with a
 * {@link PlanNodeTranslatorRegistry}, explicitly or as {@code java.util.ServiceLoader} services.
 */
public interface PlanNodeTranslator {

  /**
   * Creates the operator for a node.
   *
   * @param driverContext the driver the operator belongs to
   * @param operatorId id of the operator within its driver
   * @param node the plan node
   * @return the operator, or null if this translator does not handle the node
   */
  Operator toOperator(DriverContext driverContext, int operatorId, PlanNode node);

  /** Returns the largest number of drivers the node may run in, if this translator limits it. */
  default OptionalInt maxDrivers(PlanNode node) {
    return OptionalInt.empty();
  }
}
