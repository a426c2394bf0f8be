/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.common.setting.Settings;
import org.opensearch.exec.exception.UnsupportedPlanNodeException;
import org.opensearch.exec.exchange.ExchangeClient;
import org.opensearch.exec.expression.Expression;
import org.opensearch.exec.expression.Literal;
import org.opensearch.exec.operator.AssignUniqueIdOperator;
import org.opensearch.exec.operator.EnforceSingleRowOperator;
import org.opensearch.exec.operator.FilterProjectOperator;
import org.opensearch.exec.operator.LimitOperator;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.operator.OrderByOperator;
import org.opensearch.exec.operator.PlanNodeTranslatorRegistry;
import org.opensearch.exec.operator.TableScanOperator;
import org.opensearch.exec.operator.TableWriterOperator;
import org.opensearch.exec.operator.TopNOperator;
import org.opensearch.exec.operator.UnnestOperator;
import org.opensearch.exec.operator.ValuesOperator;
import org.opensearch.exec.operator.aggregation.HashAggregationOperator;
import org.opensearch.exec.operator.aggregation.StreamingAggregationOperator;
import org.opensearch.exec.operator.exchange.ExchangeOperator;
import org.opensearch.exec.operator.exchange.LocalExchangeSourceOperator;
import org.opensearch.exec.operator.exchange.LocalMergeOperator;
import org.opensearch.exec.operator.exchange.MergeExchangeOperator;
import org.opensearch.exec.operator.exchange.PartitionedOutputOperator;
import org.opensearch.exec.operator.join.CrossJoinProbeOperator;
import org.opensearch.exec.operator.join.HashProbeOperator;
import org.opensearch.exec.operator.join.MergeJoinOperator;
import org.opensearch.exec.pipeline.DriverContext;
import org.opensearch.exec.pipeline.DriverFactory;
import org.opensearch.exec.plan.AggregationNode;
import org.opensearch.exec.plan.AssignUniqueIdNode;
import org.opensearch.exec.plan.CrossJoinNode;
import org.opensearch.exec.plan.EnforceSingleRowNode;
import org.opensearch.exec.plan.ExchangeNode;
import org.opensearch.exec.plan.FilterNode;
import org.opensearch.exec.plan.HashJoinNode;
import org.opensearch.exec.plan.LimitNode;
import org.opensearch.exec.plan.LocalMergeNode;
import org.opensearch.exec.plan.LocalPartitionNode;
import org.opensearch.exec.plan.MergeExchangeNode;
import org.opensearch.exec.plan.MergeJoinNode;
import org.opensearch.exec.plan.OrderByNode;
import org.opensearch.exec.plan.PartitionedOutputNode;
import org.opensearch.exec.plan.PlanNode;
import org.opensearch.exec.plan.PlanNodeVisitor;
import org.opensearch.exec.plan.ProjectNode;
import org.opensearch.exec.plan.StreamingAggregationNode;
import org.opensearch.exec.plan.TableScanNode;
import org.opensearch.exec.plan.TableWriteNode;
import org.opensearch.exec.plan.TopNNode;
import org.opensearch.exec.plan.UnnestNode;
import org.opensearch.exec.plan.ValuesNode;
import org.opensearch.exec.task.Task;

/**
 * Turns the plan nodes of a pipeline into the operators of one driver. A filter directly followed
 * by a project becomes a single {@link FilterProjectOperator}; every other node becomes one
 * operator. Nodes of a kind this class does not know are handed to the registered translators.
 * Operator ids are assigned in order, starting at 0, after fusion.
 */
@Log4j2
@RequiredArgsConstructor
public class OperatorInstantiator {

  private final PlanNodeTranslatorRegistry registry;

  public List<Operator> createOperators(
      DriverFactory factory,
      DriverContext driverContext,
      ExchangeClient exchangeClient,
      IntUnaryOperator numDrivers) {
    List<PlanNode> nodes = factory.getPlanNodes();
    OperatorVisitor visitor =
        new OperatorVisitor(driverContext, exchangeClient, numDrivers, factory.getPipelineId());
    List<Operator> operators = new ArrayList<>(nodes.size() + 1);
    for (int i = 0; i < nodes.size(); i++) {
      PlanNode node = nodes.get(i);
      int operatorId = operators.size();
      if (node instanceof FilterNode filter
          && i + 1 < nodes.size()
          && nodes.get(i + 1) instanceof ProjectNode project) {
        operators.add(
            new FilterProjectOperator(
                new OperatorContext(operatorId, project.getId(), "FilterProject", driverContext),
                filter.getPredicate(),
                project.getProjections()));
        i++;
        continue;
      }
      Operator operator = node.accept(visitor, operatorId);
      if (operator == null) {
        operator =
            registry
                .toOperator(driverContext, operatorId, node)
                .orElseThrow(() -> new UnsupportedPlanNodeException(node));
      }
      operators.add(operator);
    }
    if (factory.getConsumerSupplier() != null) {
      operators.add(factory.getConsumerSupplier().create(operators.size(), driverContext));
    }
    log.debug("Created {} operators for driver {}", operators.size(), driverContext);
    return operators;
  }

  /** Returns the identity projection over {@code channelCount} channels. */
  static List<Expression> identity(int channelCount) {
    ImmutableList.Builder<Expression> projections = ImmutableList.builder();
    for (int channel = 0; channel < channelCount; channel++) {
      projections.add(Expression.field(channel));
    }
    return projections.build();
  }

  /** Creates the operator of a node of a known kind; the context is the operator id. */
  private static class OperatorVisitor extends PlanNodeVisitor<Operator, Integer> {

    private final DriverContext driverContext;
    private final ExchangeClient exchangeClient;
    private final IntUnaryOperator numDrivers;
    private final int pipelineId;

    OperatorVisitor(
        DriverContext driverContext,
        ExchangeClient exchangeClient,
        IntUnaryOperator numDrivers,
        int pipelineId) {
      this.driverContext = driverContext;
      this.exchangeClient = exchangeClient;
      this.numDrivers = numDrivers;
      this.pipelineId = pipelineId;
    }

    private OperatorContext context(int operatorId, PlanNode node, String operatorType) {
      return new OperatorContext(operatorId, node.getId(), operatorType, driverContext);
    }

    private Task task() {
      return driverContext.getTask();
    }

    private int outputPageRows() {
      return task().getSettings().getSettingValue(Settings.Key.OUTPUT_PAGE_ROWS);
    }

    @Override
    public Operator visitTableScan(TableScanNode node, Integer operatorId) {
      return new TableScanOperator(
          context(operatorId, node, "TableScan"),
          node.getTableHandle().createPageSource(driverContext));
    }

    @Override
    public Operator visitTableWrite(TableWriteNode node, Integer operatorId) {
      return new TableWriterOperator(
          context(operatorId, node, "TableWrite"),
          node.getInsertTableHandle().createPageSink(driverContext));
    }

    @Override
    public Operator visitValues(ValuesNode node, Integer operatorId) {
      return new ValuesOperator(context(operatorId, node, "Values"), node.getValues());
    }

    @Override
    public Operator visitFilter(FilterNode node, Integer operatorId) {
      return new FilterProjectOperator(
          context(operatorId, node, "FilterProject"),
          node.getPredicate(),
          identity(node.getOutputType().getFieldCount()));
    }

    @Override
    public Operator visitProject(ProjectNode node, Integer operatorId) {
      return new FilterProjectOperator(
          context(operatorId, node, "FilterProject"), Literal.TRUE, node.getProjections());
    }

    @Override
    public Operator visitAggregation(AggregationNode node, Integer operatorId) {
      return new HashAggregationOperator(context(operatorId, node, "HashAggregation"), node);
    }

    @Override
    public Operator visitStreamingAggregation(StreamingAggregationNode node, Integer operatorId) {
      return new StreamingAggregationOperator(
          context(operatorId, node, "StreamingAggregation"), node);
    }

    @Override
    public Operator visitHashJoin(HashJoinNode node, Integer operatorId) {
      return new HashProbeOperator(
          context(operatorId, node, "HashProbe"),
          node,
          task().getHashJoinBridge(node.getId()));
    }

    @Override
    public Operator visitCrossJoin(CrossJoinNode node, Integer operatorId) {
      return new CrossJoinProbeOperator(
          context(operatorId, node, "CrossJoinProbe"),
          task().getCrossJoinBridge(node.getId()),
          node.getRight().getOutputType().getFieldCount());
    }

    @Override
    public Operator visitMergeJoin(MergeJoinNode node, Integer operatorId) {
      return new MergeJoinOperator(
          context(operatorId, node, "MergeJoin"),
          node,
          task().createMergeJoinSource(node.getId()));
    }

    @Override
    public Operator visitTopN(TopNNode node, Integer operatorId) {
      return new TopNOperator(
          context(operatorId, node, "TopN"), node.getSortKeys(), node.getCount());
    }

    @Override
    public Operator visitLimit(LimitNode node, Integer operatorId) {
      return new LimitOperator(
          context(operatorId, node, "Limit"), node.getOffset(), node.getCount());
    }

    @Override
    public Operator visitOrderBy(OrderByNode node, Integer operatorId) {
      return new OrderByOperator(context(operatorId, node, "OrderBy"), node.getSortKeys());
    }

    @Override
    public Operator visitExchange(ExchangeNode node, Integer operatorId) {
      checkExchangeClient(node);
      return new ExchangeOperator(context(operatorId, node, "Exchange"), exchangeClient);
    }

    @Override
    public Operator visitMergeExchange(MergeExchangeNode node, Integer operatorId) {
      checkExchangeClient(node);
      return new MergeExchangeOperator(
          context(operatorId, node, "MergeExchange"),
          exchangeClient,
          node.getSortKeys(),
          node.getOutputType().getFieldCount(),
          outputPageRows());
    }

    private void checkExchangeClient(ExchangeNode node) {
      Preconditions.checkState(
          exchangeClient != null, "Exchange node %s requires an exchange client", node);
    }

    @Override
    public Operator visitPartitionedOutput(PartitionedOutputNode node, Integer operatorId) {
      return new PartitionedOutputOperator(
          context(operatorId, node, "PartitionedOutput"),
          task().getOutputBuffer(),
          node.getPartitionKeys(),
          node.getNumPartitions());
    }

    @Override
    public Operator visitLocalPartition(LocalPartitionNode node, Integer operatorId) {
      return new LocalExchangeSourceOperator(
          context(operatorId, node, "LocalExchangeSource"),
          task().getLocalExchange(node.getId()).getQueue(driverContext.getDriverId()));
    }

    @Override
    public Operator visitLocalMerge(LocalMergeNode node, Integer operatorId) {
      // The only source of a local merge is the pipeline right after this one.
      int numSources = numDrivers.applyAsInt(pipelineId + 1);
      task().createLocalMergeSources(node.getId(), numSources, node.getOutputType());
      return new LocalMergeOperator(
          context(operatorId, node, "LocalMerge"),
          task().getLocalMergeSources(node.getId()),
          node.getSortKeys(),
          node.getOutputType().getFieldCount(),
          outputPageRows());
    }

    @Override
    public Operator visitUnnest(UnnestNode node, Integer operatorId) {
      return new UnnestOperator(
          context(operatorId, node, "Unnest"),
          node.getReplicateChannels(),
          node.getUnnestChannels());
    }

    @Override
    public Operator visitEnforceSingleRow(EnforceSingleRowNode node, Integer operatorId) {
      return new EnforceSingleRowOperator(
          context(operatorId, node, "EnforceSingleRow"), node.getOutputType().getFieldCount());
    }

    @Override
    public Operator visitAssignUniqueId(AssignUniqueIdNode node, Integer operatorId) {
      return new AssignUniqueIdOperator(
          context(operatorId, node, "AssignUniqueId"),
          node.getTaskUniqueId(),
          task().getUniqueIdCounter(node.getId()));
    }
  }
}
