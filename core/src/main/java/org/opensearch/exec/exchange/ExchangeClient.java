/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.exchange;

import java.util.List;

/**
 * Reads pages produced by other tasks, possibly on other nodes. As a {@link PageStream} it yields
 * the pages of all remote producers in arrival order; {@link #getRemoteStreams()} exposes each
 * producer separately for exchanges that merge sorted streams.
 */
public interface ExchangeClient extends PageStream, AutoCloseable {

  /** Returns one stream per remote producer. */
  List<PageStream> getRemoteStreams();

  @Override
  void close();
}
