/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.plan.SortKey;
import org.opensearch.exec.task.PageQueue;

/** Merges the sorted outputs of the drivers of another pipeline of the same task. */
public class LocalMergeOperator extends MergeOperator {

  private final List<PageQueue> sources;

  public LocalMergeOperator(
      OperatorContext context,
      List<PageQueue> sources,
      List<SortKey> sortKeys,
      int channelCount,
      int outputPageRows) {
    super(context, sources, sortKeys, channelCount, outputPageRows);
    this.sources = ImmutableList.copyOf(sources);
  }

  /** Closes the merge sources, waking producers still blocked on them. */
  @Override
  public void close() {
    sources.forEach(PageQueue::close);
  }
}
