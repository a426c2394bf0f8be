/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.plan;

/** Join semantics supported by the join operators. */
public enum JoinType {
  /** Emits matching row pairs only. */
  INNER,

  /** Emits every probe row, padded with nulls when nothing on the build side matches. */
  LEFT
}
