/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.planner;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.opensearch.exec.operator.PlanNodeTranslatorRegistry;
import org.opensearch.exec.plan.AggregationNode;
import org.opensearch.exec.plan.LimitNode;
import org.opensearch.exec.plan.LocalMergeNode;
import org.opensearch.exec.plan.MergeExchangeNode;
import org.opensearch.exec.plan.OrderByNode;
import org.opensearch.exec.plan.PlanNode;
import org.opensearch.exec.plan.PlanNodeVisitor;
import org.opensearch.exec.plan.TableWriteNode;
import org.opensearch.exec.plan.TopNNode;
import org.opensearch.exec.plan.ValuesNode;

/** Computes how many drivers may run a pipeline at the same time. */
@RequiredArgsConstructor
public class ParallelismAnalyzer {

  /** No node of the pipeline limits its parallelism. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private static final SingleThreadedVisitor SINGLE_THREADED = new SingleThreadedVisitor();

  private final PlanNodeTranslatorRegistry registry;

  /**
   * Returns the largest number of drivers the pipeline made of {@code nodes} may run in.
   *
   * <p>Returns 1 as soon as a node requires a single thread: a final or single aggregation, a
   * non-partial top-N, limit or order-by, a values node that is not parallelizable, a local merge,
   * a merge exchange, or a table write whose target cannot be written by several threads. Other
   * nodes may declare a cap, through a registered translator or their own hint; a cap of 1 also
   * returns 1 and the other caps are folded into a minimum.
   *
   * @return a count of at least 1, or {@link #UNBOUNDED}
   * @throws IllegalStateException if a node declares a cap of 0
   */
  public int maxDrivers(List<PlanNode> nodes) {
    int count = UNBOUNDED;
    for (PlanNode node : nodes) {
      Boolean singleThreaded = node.accept(SINGLE_THREADED, null);
      if (singleThreaded != null) {
        if (singleThreaded) {
          return 1;
        }
        continue;
      }
      OptionalInt declared = declaredMaxDrivers(node);
      if (declared.isPresent()) {
        int cap = declared.getAsInt();
        Preconditions.checkState(
            cap > 0, "Plan node %s declares max drivers %s, expected a positive count", node, cap);
        if (cap == 1) {
          return 1;
        }
        count = Math.min(cap, count);
      }
    }
    return count;
  }

  private OptionalInt declaredMaxDrivers(PlanNode node) {
    OptionalInt declared = registry.maxDrivers(node);
    return declared.isPresent() ? declared : node.getMaxDrivers();
  }

  /**
   * True if the node requires a single thread, false if its kind could require one but this node
   * does not, null for every other kind.
   */
  private static class SingleThreadedVisitor extends PlanNodeVisitor<Boolean, Void> {

    @Override
    public Boolean visitAggregation(AggregationNode node, Void context) {
      return node.getStep() == AggregationNode.Step.FINAL
          || node.getStep() == AggregationNode.Step.SINGLE;
    }

    @Override
    public Boolean visitTopN(TopNNode node, Void context) {
      return !node.isPartial();
    }

    @Override
    public Boolean visitValues(ValuesNode node, Void context) {
      return !node.isParallelizable();
    }

    @Override
    public Boolean visitLimit(LimitNode node, Void context) {
      return !node.isPartial();
    }

    @Override
    public Boolean visitOrderBy(OrderByNode node, Void context) {
      return !node.isPartial();
    }

    @Override
    public Boolean visitLocalMerge(LocalMergeNode node, Void context) {
      return true;
    }

    @Override
    public Boolean visitMergeExchange(MergeExchangeNode node, Void context) {
      return true;
    }

    @Override
    public Boolean visitTableWrite(TableWriteNode node, Void context) {
      return !node.getInsertTableHandle().supportsMultiThreading();
    }
  }
}
