/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.model;

import java.util.Locale;
import java.util.Objects;
import lombok.Builder;

/**
 * One column as introspected. {@code precision} is the declared precision of numeric columns and
 * the bit width of integer columns (16 for {@code smallint}); 0 when unknown.
 */
@Builder(toBuilder = true)
public record Column(
    String table,
    String name,
    TypeFamily type,
    boolean nullable,
    int maxLength,
    int precision,
    int scale,
    String enumType) {

  public Column {
    Objects.requireNonNull(name, "Column name cannot be null.");
    type = Objects.requireNonNullElse(type, TypeFamily.OTHER);
    if (enumType != null) {
      enumType = enumType.toLowerCase(Locale.ROOT);
    }
  }

  /** Lower-cased column name, the key every name-based heuristic matches against. */
  public String key() {
    return name.toLowerCase(Locale.ROOT);
  }

  public String tableKey() {
    return table == null ? "" : table.toLowerCase(Locale.ROOT);
  }

  public boolean isEnum() {
    return type == TypeFamily.ENUM && enumType != null;
  }

  /** Maximum text length, 255 when the column is unbounded. */
  public int effectiveMaxLength() {
    return maxLength > 0 ? maxLength : 255;
  }
}
