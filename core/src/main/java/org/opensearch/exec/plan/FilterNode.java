/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.opensearch.exec.expression.Expression;

/** Keeps the rows for which the predicate evaluates to true. */
@Getter
public class FilterNode extends SingleSourceNode {

  private final Expression predicate;

  public FilterNode(String id, PlanNode source, Expression predicate) {
    super(id, source);
    this.predicate = Preconditions.checkNotNull(predicate, "predicate");
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
