/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.Getter;
import org.opensearch.exec.common.setting.Settings;
import org.opensearch.exec.exchange.ExchangeClient;
import org.opensearch.exec.operator.Operator;
import org.opensearch.exec.operator.OperatorSupplier;
import org.opensearch.exec.plan.PlanNode;
import org.opensearch.exec.planner.OperatorInstantiator;

/**
 * Compiled form of one pipeline: the plan nodes it runs in source-to-sink order, the sink that
 * routes its output, and how many drivers may run it. Immutable; drivers are created from it at
 * run time.
 */
@Getter
public class DriverFactory {

  private final int pipelineId;
  private final List<PlanNode> planNodes;
  /** Supplier of the final sink, or null if the last operator's output is the task's result. */
  private final OperatorSupplier consumerSupplier;
  private final int maxDrivers;
  private final boolean inputDriver;
  private final boolean outputDriver;
  @Getter(AccessLevel.NONE)
  private final OperatorInstantiator instantiator;

  public DriverFactory(
      int pipelineId,
      List<PlanNode> planNodes,
      OperatorSupplier consumerSupplier,
      int maxDrivers,
      boolean inputDriver,
      boolean outputDriver,
      OperatorInstantiator instantiator) {
    this.pipelineId = pipelineId;
    this.planNodes = ImmutableList.copyOf(planNodes);
    this.consumerSupplier = consumerSupplier;
    this.maxDrivers = maxDrivers;
    this.inputDriver = inputDriver;
    this.outputDriver = outputDriver;
    this.instantiator = instantiator;
  }

  /**
   * Creates one driver of this pipeline.
   *
   * @param driverContext context of the new driver
   * @param exchangeClient client reading remote pages, or null if the task reads none
   * @param numDrivers number of drivers of each pipeline of the task, by pipeline id
   */
  public Driver createDriver(
      DriverContext driverContext, ExchangeClient exchangeClient, IntUnaryOperator numDrivers) {
    List<Operator> operators =
        instantiator.createOperators(this, driverContext, exchangeClient, numDrivers);
    int maxIterations =
        driverContext
            .getTask()
            .getSettings()
            .getSettingValue(Settings.Key.DRIVER_MAX_ITERATIONS);
    return new Driver(driverContext, operators, maxIterations);
  }

  /** Returns true if a sink ends this pipeline. */
  public boolean hasConsumer() {
    return consumerSupplier != null;
  }

  @Override
  public String toString() {
    return "Pipeline "
        + pipelineId
        + planNodes.stream().map(PlanNode::toString).collect(Collectors.joining(" -> ", " [", "]"))
        + (hasConsumer() ? " -> sink" : "")
        + " maxDrivers="
        + (maxDrivers == Integer.MAX_VALUE ? "unbounded" : String.valueOf(maxDrivers))
        + (inputDriver ? " input" : "")
        + (outputDriver ? " output" : "");
  }
}
