/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

/** Supplies one {@link PageConsumer} per driver of the task's output pipeline. */
@FunctionalInterface
public interface PageConsumerSupplier {

  PageConsumer get();
}
