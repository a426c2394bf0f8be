/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.exec.page.Page;

/** Reads the value of one input channel. */
@Getter
@EqualsAndHashCode
public class FieldReference implements Expression {

  private final int channel;

  public FieldReference(int channel) {
    if (channel < 0) {
      throw new IllegalArgumentException("channel must be non-negative: " + channel);
    }
    this.channel = channel;
  }

  @Override
  public Object evaluate(Page page, int position) {
    return page.getValue(position, channel);
  }

  @Override
  public String toString() {
    return "#" + channel;
  }
}
