/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.luisppb16.oltpseed.model.Column;
import java.util.Objects;
import java.util.Random;
import java.util.function.IntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes a column value unique within its (table, column) in two phases.
 *
 * <p>First the value is regenerated with {@code ordinal + attempt} while it is already taken,
 * up to {@link #ATTEMPT_BUDGET} times. After that the last candidate is derived: strings get an
 * {@code _} plus six hex characters (kept within the column's maximum length), integers get
 * {@code value + ordinal * 1000 + attempt}, anything else becomes a suffixed string. Nulls are
 * never registered, a unique column may hold any number of them.
 */
@Slf4j
public final class UniquenessStrategy {

  static final int ATTEMPT_BUDGET = 50;
  static final int DERIVE_BUDGET = 100_000;
  private static final int SUFFIX_LENGTH = 7;

  private final UniqueValueRegistry registry;
  private final Random random;

  public UniquenessStrategy(final UniqueValueRegistry registry, final Random random) {
    this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    this.random = Objects.requireNonNull(random, "Random cannot be null");
  }

  public Object ensureUnique(
      final Column column, final int ordinal, final IntFunction<Object> regenerate) {
    Object value = regenerate.apply(ordinal);
    for (int attempt = 1; attempt <= ATTEMPT_BUDGET; attempt++) {
      if (Objects.isNull(value)) {
        return null;
      }
      if (registry.register(column, value)) {
        return value;
      }
      value = regenerate.apply(ordinal + attempt);
    }
    if (Objects.isNull(value)) {
      return null;
    }

    log.debug(
        "{}.{}: regeneration exhausted at row {}, deriving",
        column.table(),
        column.name(),
        ordinal);
    for (int attempt = 1; attempt <= DERIVE_BUDGET; attempt++) {
      final Object derived = derive(column, value, ordinal, attempt);
      if (registry.register(column, derived)) {
        return derived;
      }
    }
    throw new IllegalStateException(
        "Could not derive a unique value for %s.%s".formatted(column.table(), column.name()));
  }

  Object derive(final Column column, final Object value, final int ordinal, final int attempt) {
    if (value instanceof Long || value instanceof Integer) {
      final long candidate = ((Number) value).longValue() + ordinal * 1000L + attempt;
      final long max = ValueGenerator.maxInteger(column);
      return candidate <= max ? candidate : 1 + Math.floorMod(candidate, max);
    }
    return suffixed(String.valueOf(value), column.effectiveMaxLength());
  }

  String suffixed(final String base, final int maxLength) {
    final String suffix = "_%06x".formatted(random.nextInt(0x1000000));
    if (maxLength <= SUFFIX_LENGTH) {
      return suffix.substring(1, Math.min(SUFFIX_LENGTH, maxLength + 1));
    }
    final String head = base.length() + SUFFIX_LENGTH > maxLength
        ? base.substring(0, maxLength - SUFFIX_LENGTH)
        : base;
    return head + suffix;
  }
}
