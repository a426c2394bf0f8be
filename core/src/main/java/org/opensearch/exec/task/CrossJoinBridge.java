/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.task;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.opensearch.exec.page.Page;

/** Build side of a cross join: every build page. */
public class CrossJoinBridge extends JoinBridge<List<Page>> {

  private final List<Page> pages = new ArrayList<>();

  public CrossJoinBridge(String planNodeId) {
    super(planNodeId);
  }

  @Override
  protected void merge(List<Page> partial) {
    pages.addAll(partial);
  }

  @Override
  protected List<Page> publish() {
    return ImmutableList.copyOf(pages);
  }
}
