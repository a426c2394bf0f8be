/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.exec.page.Page;

/** A constant value. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Literal implements Expression {

  public static final Literal TRUE = new Literal(Boolean.TRUE);

  private final Object value;

  @Override
  public Object evaluate(Page page, int position) {
    return value;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
