/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.testing;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import org.opensearch.exec.connector.ConnectorTableHandle;
import org.opensearch.exec.connector.PageSource;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.pipeline.DriverContext;

/** A table held in memory. Driver {@code d} of {@code n} reads every n-th page starting at d. */
public class InMemoryTable implements ConnectorTableHandle {

  private final String name;
  private final List<Page> pages;
  private final OptionalInt maxParallelism;

  public InMemoryTable(String name, Page... pages) {
    this(name, OptionalInt.empty(), pages);
  }

  public InMemoryTable(String name, OptionalInt maxParallelism, Page... pages) {
    this.name = name;
    this.pages = ImmutableList.copyOf(pages);
    this.maxParallelism = maxParallelism;
  }

  @Override
  public String getTableName() {
    return name;
  }

  @Override
  public OptionalInt getMaxParallelism() {
    return maxParallelism;
  }

  @Override
  public PageSource createPageSource(DriverContext driverContext) {
    int drivers = Math.max(1, driverContext.getTask().numDrivers(driverContext.getPipelineId()));
    Deque<Page> split = new ArrayDeque<>();
    for (int i = driverContext.getDriverId(); i < pages.size(); i += drivers) {
      split.add(pages.get(i));
    }
    return new PageSource() {
      @Override
      public Page getNextPage() {
        return split.poll();
      }

      @Override
      public boolean isFinished() {
        return split.isEmpty();
      }

      @Override
      public void close() {}
    };
  }
}
