/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.OptionalInt;
import org.apache.calcite.rel.type.RelDataType;

/**
 * An immutable node of a physical plan tree. A node may be referenced from several places in a
 * tree, so it never changes after construction.
 *
 * <p>Built-in node kinds dispatch to their own method of {@link PlanNodeVisitor}. Any other
 * subclass is an extension kind: it reaches {@link PlanNodeVisitor#visitPlan} and is turned into
 * an operator by a registered {@code PlanNodeTranslator}.
 */
public abstract class PlanNode {

  private final String id;

  protected PlanNode(String id) {
    Preconditions.checkArgument(id != null && !id.isEmpty(), "Plan node id is required");
    this.id = id;
  }

  /** Returns the id of this node, unique within its plan tree. */
  public String getId() {
    return id;
  }

  /** Returns the input nodes, in order. Empty for leaf nodes. */
  public abstract List<PlanNode> getSources();

  /** Returns the row type this node produces. */
  public abstract RelDataType getOutputType();

  /**
   * Returns the largest number of drivers this node may run in, if it limits parallelism. Built-in
   * kinds whose parallelism is fixed by their semantics do not use this hint.
   */
  public OptionalInt getMaxDrivers() {
    return OptionalInt.empty();
  }

  /** Accepts a visitor. Extension kinds use this default, which calls the fallback method. */
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitPlan(this, context);
  }

  /** Returns the kind name, e.g. {@code HashJoin} for a {@code HashJoinNode}. */
  public String getName() {
    String name = getClass().getSimpleName();
    return name.endsWith("Node") ? name.substring(0, name.length() - 4) : name;
  }

  @Override
  public String toString() {
    return getName() + "[" + id + "]";
  }
}
