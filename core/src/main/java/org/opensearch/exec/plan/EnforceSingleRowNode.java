/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

/** Fails on more than one input row; produces a row of nulls for empty input. */
public class EnforceSingleRowNode extends SingleSourceNode {

  public EnforceSingleRowNode(String id, PlanNode source) {
    super(id, source);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitEnforceSingleRow(this, context);
  }
}
