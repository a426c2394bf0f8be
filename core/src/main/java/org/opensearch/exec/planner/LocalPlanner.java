/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.exception.MalformedPlanException;
import org.opensearch.exec.operator.OperatorSupplier;
import org.opensearch.exec.operator.PageConsumerSupplier;
import org.opensearch.exec.operator.PlanNodeTranslatorRegistry;
import org.opensearch.exec.pipeline.DriverFactory;
import org.opensearch.exec.plan.LocalMergeNode;
import org.opensearch.exec.plan.LocalPartitionNode;
import org.opensearch.exec.plan.PlanNode;

/**
 * Compiles a plan tree into the pipelines a task runs.
 *
 * <p>The tree is walked depth first. A node joins the pipeline of its parent through its first
 * source; every source the {@link PipelineBoundaryPolicy} cuts off starts a new pipeline, which
 * ends with the sink {@link ConsumerSupplierFactory} picks for the parent. The first pipeline
 * produces the task's result and ends with the caller's consumer. Pipelines are numbered in
 * creation order, so a consumer pipeline always has a lower id than the pipelines feeding it.
 */
@Log4j2
public class LocalPlanner {

  private final ParallelismAnalyzer parallelismAnalyzer;
  private final OperatorInstantiator operatorInstantiator;

  public LocalPlanner(PlanNodeTranslatorRegistry registry) {
    this.parallelismAnalyzer = new ParallelismAnalyzer(registry);
    this.operatorInstantiator = new OperatorInstantiator(registry);
  }

  /**
   * Compiles a plan tree.
   *
   * @param root root of the plan tree
   * @param consumerSupplier consumer of the task's result, or null if the root writes its output
   *     elsewhere
   * @return the pipelines, the first one producing the task's result
   * @throws MalformedPlanException if the tree breaks a structural rule
   */
  public List<DriverFactory> plan(PlanNode root, PageConsumerSupplier consumerSupplier) {
    Preconditions.checkNotNull(root, "Plan root must not be null");
    validate(root, new HashSet<>());

    List<PendingPipeline> pipelines = new ArrayList<>();
    plan(root, null, ConsumerSupplierFactory.fromConsumer(consumerSupplier), pipelines);
    pipelines.get(0).outputDriver = true;

    ImmutableList.Builder<DriverFactory> factories = ImmutableList.builder();
    for (PendingPipeline pipeline : pipelines) {
      DriverFactory factory =
          new DriverFactory(
              pipeline.id,
              pipeline.nodes,
              pipeline.consumerSupplier,
              parallelismAnalyzer.maxDrivers(pipeline.nodes),
              pipeline.inputDriver,
              pipeline.outputDriver,
              operatorInstantiator);
      log.debug("Planned {}", factory);
      factories.add(factory);
    }
    return factories.build();
  }

  private void plan(
      PlanNode node,
      PendingPipeline current,
      OperatorSupplier consumerSupplier,
      List<PendingPipeline> pipelines) {
    if (current == null) {
      current = new PendingPipeline(pipelines.size(), consumerSupplier);
      pipelines.add(current);
    }
    List<PlanNode> sources = node.getSources();
    if (sources.isEmpty()) {
      current.inputDriver = true;
    } else {
      OperatorSupplier sinkSupplier = ConsumerSupplierFactory.fromPlanNode(node);
      for (int i = 0; i < sources.size(); i++) {
        plan(
            sources.get(i),
            PipelineBoundaryPolicy.mustStartNewPipeline(node, i) ? null : current,
            sinkSupplier,
            pipelines);
      }
    }
    current.nodes.add(node);
  }

  private void validate(PlanNode node, Set<String> seenIds) {
    if (!seenIds.add(node.getId())) {
      throw new MalformedPlanException(node.getId(), "duplicate plan node id");
    }
    if (node instanceof LocalMergeNode && node.getSources().size() != 1) {
      throw new MalformedPlanException(
          node.getId(),
          "local merge requires exactly one source, found " + node.getSources().size());
    }
    if (node instanceof LocalPartitionNode && node.getSources().isEmpty()) {
      throw new MalformedPlanException(node.getId(), "local partition requires a source");
    }
    for (PlanNode source : node.getSources()) {
      validate(source, seenIds);
    }
  }

  /** A pipeline while the tree is being walked. */
  private static class PendingPipeline {
    private final int id;
    private final OperatorSupplier consumerSupplier;
    private final List<PlanNode> nodes = new ArrayList<>();
    private boolean inputDriver;
    private boolean outputDriver;

    PendingPipeline(int id, OperatorSupplier consumerSupplier) {
      this.id = id;
      this.consumerSupplier = consumerSupplier;
    }
  }
}
