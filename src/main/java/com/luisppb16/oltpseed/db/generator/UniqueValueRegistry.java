/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.luisppb16.oltpseed.model.Column;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Values already emitted per (table, column) for the whole run. Keys are case-insensitive.
 */
public final class UniqueValueRegistry {

  private final Map<String, Set<Object>> seen = new HashMap<>();

  /** Records {@code value}; returns {@code false} when it was already taken. */
  public boolean register(final String table, final String column, final Object value) {
    return seen.computeIfAbsent(key(table, column), k -> new HashSet<>()).add(value);
  }

  public boolean register(final Column column, final Object value) {
    return register(column.tableKey(), column.name(), value);
  }

  public boolean contains(final String table, final String column, final Object value) {
    final Set<Object> values = seen.get(key(table, column));
    return values != null && values.contains(value);
  }

  public int size(final String table, final String column) {
    final Set<Object> values = seen.get(key(table, column));
    return values == null ? 0 : values.size();
  }

  private static String key(final String table, final String column) {
    return (table + "." + column).toLowerCase(Locale.ROOT);
  }
}
