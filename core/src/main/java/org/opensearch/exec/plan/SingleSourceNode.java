/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/** Base class of nodes with exactly one input. */
public abstract class SingleSourceNode extends PlanNode {

  private final PlanNode source;

  protected SingleSourceNode(String id, PlanNode source) {
    super(id);
    this.source = Preconditions.checkNotNull(source, "Plan node %s requires a source", id);
  }

  public PlanNode getSource() {
    return source;
  }

  @Override
  public List<PlanNode> getSources() {
    return List.of(source);
  }

  /** Returns the source's row type. Nodes that change the row type override this. */
  @Override
  public RelDataType getOutputType() {
    return source.getOutputType();
  }
}
