/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

/**
 * Visitor over the built-in plan node kinds. Every method defaults to {@link #visitPlan}, which is
 * also the only method extension kinds reach.
 *
 * @param <R> return type
 * @param <C> context type
 */
public abstract class PlanNodeVisitor<R, C> {

  /** Fallback for kinds without a dedicated method. Returns null by default. */
  public R visitPlan(PlanNode node, C context) {
    return null;
  }

  public R visitTableScan(TableScanNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitTableWrite(TableWriteNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitValues(ValuesNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitFilter(FilterNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitProject(ProjectNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitAggregation(AggregationNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitStreamingAggregation(StreamingAggregationNode node, C context) {
    return visitAggregation(node, context);
  }

  public R visitHashJoin(HashJoinNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitCrossJoin(CrossJoinNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitMergeJoin(MergeJoinNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitTopN(TopNNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitLimit(LimitNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitOrderBy(OrderByNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitExchange(ExchangeNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitMergeExchange(MergeExchangeNode node, C context) {
    return visitExchange(node, context);
  }

  public R visitPartitionedOutput(PartitionedOutputNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitLocalPartition(LocalPartitionNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitLocalMerge(LocalMergeNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitUnnest(UnnestNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitEnforceSingleRow(EnforceSingleRowNode node, C context) {
    return visitPlan(node, context);
  }

  public R visitAssignUniqueId(AssignUniqueIdNode node, C context) {
    return visitPlan(node, context);
  }
}
