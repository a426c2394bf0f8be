/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator.exchange;

import java.util.List;
import org.opensearch.exec.exchange.ExchangeClient;
import org.opensearch.exec.operator.OperatorContext;
import org.opensearch.exec.plan.SortKey;

/**
 * Merges the sorted streams of the remote producers of an exchange. The exchange client is owned
 * by the task and is not closed here.
 */
public class MergeExchangeOperator extends MergeOperator {

  public MergeExchangeOperator(
      OperatorContext context,
      ExchangeClient exchangeClient,
      List<SortKey> sortKeys,
      int channelCount,
      int outputPageRows) {
    super(context, exchangeClient.getRemoteStreams(), sortKeys, channelCount, outputPageRows);
  }

  @Override
  public void close() {}
}
