/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.exec.common.setting.Settings;
import org.opensearch.exec.exchange.ExchangeClient;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.pipeline.Driver;
import org.opensearch.exec.pipeline.DriverContext;
import org.opensearch.exec.pipeline.DriverFactory;
import org.opensearch.exec.plan.LocalPartitionNode;
import org.opensearch.exec.plan.PartitionedOutputNode;
import org.opensearch.exec.plan.PlanNode;

/**
 * Runs the pipelines of a compiled plan on an executor.
 *
 * <p>Pipeline {@code i} runs {@code min(maxDrivers, exec.task.max_drivers_per_pipeline)} drivers.
 * Every driver of every pipeline is created, in pipeline order, before any of them runs, so the
 * coordination state a consumer pipeline creates exists when the sinks of its producers look it
 * up, and every producer is registered before the first page moves. A driver occupies a thread
 * only while it can make progress; a blocked driver is rescheduled when its blocking future
 * completes.
 */
@Log4j2
public class LocalTask implements Task {

  @Getter private final String taskId;
  @Getter private final Settings settings;
  private final List<DriverFactory> driverFactories;
  private final Executor executor;
  private final ExchangeClient exchangeClient;
  private final int[] numDrivers;

  private final Map<String, List<PageQueue>> localMergeSources = new ConcurrentHashMap<>();
  private final Map<String, PageQueue> mergeJoinSources = new ConcurrentHashMap<>();
  private final Map<String, HashJoinBridge> hashJoinBridges = new ConcurrentHashMap<>();
  private final Map<String, CrossJoinBridge> crossJoinBridges = new ConcurrentHashMap<>();
  private final Map<String, LocalExchange> localExchanges = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> uniqueIdCounters = new ConcurrentHashMap<>();
  private final InMemoryOutputBuffer outputBuffer;

  // Published once start() has created every driver.
  private volatile List<Driver> drivers = ImmutableList.of();
  private final List<Page> results = new ArrayList<>();
  private final SettableFuture<Void> completion = SettableFuture.create();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicInteger remainingDrivers = new AtomicInteger();

  /**
   * Creates a task.
   *
   * @param taskId task id, used in logs
   * @param driverFactories the compiled plan
   * @param settings execution settings
   * @param executor runs the drivers
   * @param exchangeClient client reading remote pages, or null if the plan reads none
   */
  public LocalTask(
      String taskId,
      List<DriverFactory> driverFactories,
      Settings settings,
      Executor executor,
      ExchangeClient exchangeClient) {
    Preconditions.checkArgument(!driverFactories.isEmpty(), "Task %s has no pipelines", taskId);
    this.taskId = taskId;
    this.driverFactories = ImmutableList.copyOf(driverFactories);
    this.settings = settings;
    this.executor = executor;
    this.exchangeClient = exchangeClient;

    int maxDriversPerPipeline = settings.getSettingValue(Settings.Key.MAX_DRIVERS_PER_PIPELINE);
    this.numDrivers = new int[driverFactories.size()];
    for (DriverFactory factory : driverFactories) {
      numDrivers[factory.getPipelineId()] =
          Math.max(1, Math.min(factory.getMaxDrivers(), maxDriversPerPipeline));
    }
    long maxBufferedBytes = settings.getSettingValue(Settings.Key.OUTPUT_BUFFER_MAX_BYTES);
    this.outputBuffer = new InMemoryOutputBuffer(outputPartitions(), maxBufferedBytes);
  }

  /** Creates an executor with {@code exec.task.concurrency} threads. */
  public static ExecutorService newExecutor(Settings settings) {
    int threads = settings.getSettingValue(Settings.Key.TASK_CONCURRENCY);
    return Executors.newFixedThreadPool(
        threads,
        new ThreadFactoryBuilder().setNameFormat("exec-driver-%d").setDaemon(true).build());
  }

  private int outputPartitions() {
    List<PlanNode> rootPipeline = driverFactories.get(0).getPlanNodes();
    PlanNode root = rootPipeline.get(rootPipeline.size() - 1);
    return root instanceof PartitionedOutputNode output ? output.getNumPartitions() : 1;
  }

  /**
   * Creates every driver and starts running them.
   *
   * @return a future completing when every driver has finished, or failing with the first error
   */
  public ListenableFuture<Void> start() {
    Preconditions.checkState(started.compareAndSet(false, true), "Task %s already started", taskId);
    int queueSize = settings.getSettingValue(Settings.Key.LOCAL_EXCHANGE_QUEUE_SIZE);
    for (DriverFactory factory : driverFactories) {
      for (PlanNode node : factory.getPlanNodes()) {
        if (node instanceof LocalPartitionNode) {
          localExchanges.put(
              node.getId(),
              new LocalExchange(
                  node.getId(),
                  numDrivers[factory.getPipelineId()],
                  queueSize,
                  node.getOutputType()));
        }
      }
    }

    List<Driver> created = new ArrayList<>();
    try {
      for (DriverFactory factory : driverFactories) {
        for (int driverId = 0; driverId < numDrivers[factory.getPipelineId()]; driverId++) {
          DriverContext context = new DriverContext(this, factory.getPipelineId(), driverId);
          created.add(factory.createDriver(context, exchangeClient, this::numDrivers));
        }
      }
    } catch (RuntimeException e) {
      fail(e);
      created.forEach(Driver::close);
      return completion;
    }

    remainingDrivers.set(created.size());
    drivers = ImmutableList.copyOf(created);
    if (completion.isDone()) {
      // release() may have run before the list was published.
      drivers.forEach(driver -> driver.getContext().cancel());
    }
    log.info(
        "Task {} starting {} drivers in {} pipelines",
        taskId,
        drivers.size(),
        driverFactories.size());
    for (Driver driver : drivers) {
      schedule(driver);
    }
    return completion;
  }

  private void schedule(Driver driver) {
    executor.execute(() -> run(driver));
  }

  private void run(Driver driver) {
    ListenableFuture<Void> blocked;
    try {
      blocked = driver.process();
    } catch (RuntimeException e) {
      fail(e);
      driverDone(driver);
      return;
    }
    if (driver.isFinished() || driver.getContext().isCancelled()) {
      driverDone(driver);
    } else if (blocked.isDone()) {
      schedule(driver);
    } else {
      blocked.addListener(() -> schedule(driver), MoreExecutors.directExecutor());
    }
  }

  private void driverDone(Driver driver) {
    if (!driver.getOutputPages().isEmpty()) {
      synchronized (results) {
        results.addAll(driver.getOutputPages());
      }
    }
    driver.close();
    if (remainingDrivers.decrementAndGet() == 0) {
      outputBuffer.setNoMorePages();
      if (completion.set(null)) {
        log.info("Task {} finished", taskId);
      }
    }
  }

  private void fail(Throwable failure) {
    if (completion.setException(failure)) {
      log.error("Task {} failed", taskId, failure);
      release();
    }
  }

  /** Cancels the task. Blocked drivers are woken up and every driver stops at its next step. */
  public void cancel() {
    if (completion.cancel(false)) {
      log.info("Task {} cancelled", taskId);
      release();
    }
  }

  private void release() {
    drivers.forEach(driver -> driver.getContext().cancel());
    localMergeSources.values().forEach(sources -> sources.forEach(PageQueue::close));
    mergeJoinSources.values().forEach(PageQueue::close);
    hashJoinBridges.values().forEach(JoinBridge::cancel);
    crossJoinBridges.values().forEach(JoinBridge::cancel);
    localExchanges.values().forEach(LocalExchange::close);
    outputBuffer.abort();
  }

  /** Returns the pages produced by the first pipeline when it ends without a consumer. */
  public List<Page> getResults() {
    synchronized (results) {
      return ImmutableList.copyOf(results);
    }
  }

  public List<Driver> getDrivers() {
    return drivers;
  }

  @Override
  public void createLocalMergeSources(String planNodeId, int count, RelDataType rowType) {
    int queueSize = settings.getSettingValue(Settings.Key.MERGE_SOURCE_QUEUE_SIZE);
    ImmutableList.Builder<PageQueue> sources = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      sources.add(new PageQueue(planNodeId + "/" + i, queueSize, rowType));
    }
    Preconditions.checkState(
        localMergeSources.putIfAbsent(planNodeId, sources.build()) == null,
        "Local merge sources of %s already exist",
        planNodeId);
  }

  @Override
  public PageQueue getLocalMergeSource(String planNodeId, int sourceId) {
    List<PageQueue> sources = getLocalMergeSources(planNodeId);
    Preconditions.checkElementIndex(sourceId, sources.size(), "merge source of " + planNodeId);
    return sources.get(sourceId);
  }

  @Override
  public List<PageQueue> getLocalMergeSources(String planNodeId) {
    List<PageQueue> sources = localMergeSources.get(planNodeId);
    Preconditions.checkState(sources != null, "No local merge sources for %s", planNodeId);
    return sources;
  }

  @Override
  public PageQueue createMergeJoinSource(String planNodeId) {
    int queueSize = settings.getSettingValue(Settings.Key.MERGE_SOURCE_QUEUE_SIZE);
    PageQueue source = new PageQueue(planNodeId, queueSize, null);
    Preconditions.checkState(
        mergeJoinSources.putIfAbsent(planNodeId, source) == null,
        "Merge join source of %s already exists",
        planNodeId);
    return source;
  }

  @Override
  public PageQueue getMergeJoinSource(String planNodeId) {
    PageQueue source = mergeJoinSources.get(planNodeId);
    Preconditions.checkState(source != null, "No merge join source for %s", planNodeId);
    return source;
  }

  @Override
  public HashJoinBridge getHashJoinBridge(String planNodeId) {
    return hashJoinBridges.computeIfAbsent(planNodeId, HashJoinBridge::new);
  }

  @Override
  public CrossJoinBridge getCrossJoinBridge(String planNodeId) {
    return crossJoinBridges.computeIfAbsent(planNodeId, CrossJoinBridge::new);
  }

  @Override
  public LocalExchange getLocalExchange(String planNodeId) {
    LocalExchange exchange = localExchanges.get(planNodeId);
    Preconditions.checkState(exchange != null, "No local exchange for %s", planNodeId);
    return exchange;
  }

  @Override
  public AtomicLong getUniqueIdCounter(String planNodeId) {
    return uniqueIdCounters.computeIfAbsent(planNodeId, id -> new AtomicLong());
  }

  @Override
  public InMemoryOutputBuffer getOutputBuffer() {
    return outputBuffer;
  }

  @Override
  public int numDrivers(int pipelineId) {
    Preconditions.checkElementIndex(pipelineId, numDrivers.length, "pipeline");
    return numDrivers[pipelineId];
  }

  @Override
  public String toString() {
    return "LocalTask{" + taskId + '}';
  }
}
