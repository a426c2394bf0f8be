/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.expression;

import org.opensearch.exec.page.Page;

/**
 * A scalar expression evaluated against one row of a {@link Page}. Filter predicates are
 * expressions returning {@link Boolean}; a null or false result rejects the row.
 */
@FunctionalInterface
public interface Expression {

  /**
   * Evaluates this expression for one row.
   *
   * @param page the input page
   * @param position the row index (0-based)
   * @return the value, possibly null
   */
  Object evaluate(Page page, int position);

  /** Returns an expression reading the given input channel. */
  static Expression field(int channel) {
    return new FieldReference(channel);
  }

  /** Returns an expression producing a constant. */
  static Expression literal(Object value) {
    return new Literal(value);
  }
}
