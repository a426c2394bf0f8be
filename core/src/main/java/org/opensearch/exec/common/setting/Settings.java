/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.common.setting;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Execution settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {
    /** Upper bound on the drivers of one pipeline, applied on top of the planned maximum. */
    MAX_DRIVERS_PER_PIPELINE("exec.task.max_drivers_per_pipeline", 4, Integer::valueOf),
    /** Threads running the drivers of a local task. */
    TASK_CONCURRENCY("exec.task.concurrency", 4, Integer::valueOf),
    MERGE_SOURCE_QUEUE_SIZE("exec.merge_source.queue_size", 2, Integer::valueOf),
    LOCAL_EXCHANGE_QUEUE_SIZE("exec.local_exchange.queue_size", 4, Integer::valueOf),
    OUTPUT_BUFFER_MAX_BYTES("exec.output_buffer.max_bytes", 32L * 1024 * 1024, Long::valueOf),
    /** Target row count of pages built by operators. */
    OUTPUT_PAGE_ROWS("exec.operator.output_page_rows", 1024, Integer::valueOf),
    /** Operator loop iterations a driver runs before giving its thread back. */
    DRIVER_MAX_ITERATIONS("exec.driver.max_iterations_per_quantum", 1000, Integer::valueOf);

    @Getter private final String keyValue;
    @Getter private final Object defaultValue;
    private final Function<String, Object> parser;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    /** Parses a raw setting value into the type of this key's default. */
    public Object parse(String value) {
      if (Strings.isNullOrEmpty(value)) {
        throw new IllegalArgumentException("Empty value for setting " + keyValue);
      }
      try {
        return parser.apply(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("Invalid value [%s] for setting %s", value, keyValue), e);
      }
    }

    /**
     * Converts an override to the type of this key's default. Numbers and strings are parsed, so
     * an {@code Integer} given for a {@code Long} key is widened.
     *
     * @throws IllegalArgumentException if the value cannot be read as this key's type
     */
    public Object convert(Object value) {
      Preconditions.checkArgument(value != null, "Null value for setting %s", keyValue);
      if (defaultValue.getClass().isInstance(value)) {
        return value;
      }
      if (value instanceof Number || value instanceof String) {
        return parse(value.toString());
      }
      throw new IllegalArgumentException(
          String.format("Invalid value [%s] for setting %s", value, keyValue));
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);
}
