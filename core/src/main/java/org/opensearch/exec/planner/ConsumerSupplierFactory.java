/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.planner;

import lombok.experimental.UtilityClass;
import org.opensearch.exec.operator.CallbackSinkOperator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.OperatorSupplier;
import org.opensearch.exec.operator.PageConsumerSupplier;
import org.opensearch.exec.operator.exchange.LocalPartitionOperator;
import org.opensearch.exec.operator.join.CrossJoinBuildOperator;
import org.opensearch.exec.operator.join.HashBuildOperator;
import org.opensearch.exec.plan.CrossJoinNode;
import org.opensearch.exec.plan.HashJoinNode;
import org.opensearch.exec.plan.LocalMergeNode;
import org.opensearch.exec.plan.LocalPartitionNode;
import org.opensearch.exec.plan.MergeJoinNode;
import org.opensearch.exec.plan.PlanNode;
import org.opensearch.exec.plan.PlanNodeVisitor;
import org.opensearch.exec.task.PageQueue;

/**
 * Makes the suppliers of the sink operators that end a pipeline. A pipeline feeding a parent in
 * another pipeline ends with a sink chosen by the parent's kind; the pipeline producing the task's
 * result ends with the caller's consumer.
 */
@UtilityClass
public class ConsumerSupplierFactory {

  /** Plan node id reported by the sink of the task's result. */
  public static final String ROOT_CONSUMER_ID = "root";

  private static final SinkSupplierVisitor SINK_SUPPLIERS = new SinkSupplierVisitor();

  /** Wraps the caller's consumer. Returns null if there is none. */
  public static OperatorSupplier fromConsumer(PageConsumerSupplier consumerSupplier) {
    if (consumerSupplier == null) {
      return null;
    }
    return (operatorId, ctx) ->
        new CallbackSinkOperator(
            new OperatorContext(operatorId, ROOT_CONSUMER_ID, "CallbackSink", ctx),
            consumerSupplier.get());
  }

  /**
   * Returns the supplier of the sink feeding {@code parent} from another pipeline, or null if the
   * parent's kind reads no source across a pipeline boundary.
   */
  public static OperatorSupplier fromPlanNode(PlanNode parent) {
    return parent.accept(SINK_SUPPLIERS, null);
  }

  private static class SinkSupplierVisitor extends PlanNodeVisitor<OperatorSupplier, Void> {

    @Override
    public OperatorSupplier visitLocalMerge(LocalMergeNode node, Void context) {
      return (operatorId, ctx) -> {
        PageQueue source = ctx.getTask().getLocalMergeSource(node.getId(), ctx.getDriverId());
        source.addProducer();
        return new CallbackSinkOperator(
            new OperatorContext(operatorId, node.getId(), "LocalMergeSink", ctx), source);
      };
    }

    @Override
    public OperatorSupplier visitLocalPartition(LocalPartitionNode node, Void context) {
      return (operatorId, ctx) ->
          new LocalPartitionOperator(
              new OperatorContext(operatorId, node.getId(), "LocalPartition", ctx),
              ctx.getTask().getLocalExchange(node.getId()),
              node.getPartitionKeys());
    }

    @Override
    public OperatorSupplier visitHashJoin(HashJoinNode node, Void context) {
      return (operatorId, ctx) ->
          new HashBuildOperator(
              new OperatorContext(operatorId, node.getId(), "HashBuild", ctx),
              ctx.getTask().getHashJoinBridge(node.getId()),
              node.getRightKeys());
    }

    @Override
    public OperatorSupplier visitCrossJoin(CrossJoinNode node, Void context) {
      return (operatorId, ctx) ->
          new CrossJoinBuildOperator(
              new OperatorContext(operatorId, node.getId(), "CrossJoinBuild", ctx),
              ctx.getTask().getCrossJoinBridge(node.getId()));
    }

    @Override
    public OperatorSupplier visitMergeJoin(MergeJoinNode node, Void context) {
      return (operatorId, ctx) -> {
        PageQueue source = ctx.getTask().getMergeJoinSource(node.getId());
        source.addProducer();
        return new CallbackSinkOperator(
            new OperatorContext(operatorId, node.getId(), "MergeJoinSink", ctx), source);
      };
    }
  }
}
