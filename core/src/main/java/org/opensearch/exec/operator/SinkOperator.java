/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import org.opensearch.exec.page.Page;

/**
 * Last operator of a pipeline that feeds something other than the driver's output: the task
 * result, a join build side, a merge source or a local exchange.
 */
public interface SinkOperator extends Operator {

  @Override
  default Page getOutput() {
    return null;
  }
}
