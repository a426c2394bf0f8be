/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import org.opensearch.exec.page.Page;

/** First operator of a driver; reads from a connector, an exchange or another pipeline. */
public interface SourceOperator extends Operator {

  @Override
  default boolean needsInput() {
    return false;
  }

  @Override
  default void addInput(Page page) {
    throw new UnsupportedOperationException(getContext() + " reads no upstream operator");
  }
}
