/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.model;

import java.util.Locale;
import java.util.Objects;
import lombok.Builder;

/** A single-column many-to-one edge: {@code table.column -> pkTable.pkColumn}. */
@Builder(toBuilder = true)
public record ForeignKey(
    String name, String table, String column, String pkTable, String pkColumn) {

  public ForeignKey {
    Objects.requireNonNull(table, "The child table name cannot be null.");
    Objects.requireNonNull(column, "The child column name cannot be null.");
    Objects.requireNonNull(pkTable, "The primary table name (pkTable) cannot be null.");

    // If the name was not provided, one is generated based on the PK table and child column.
    if (name == null || name.isBlank()) {
      name = "fk_%s_%s".formatted(pkTable, column);
    }
  }

  public String pkTableKey() {
    return pkTable.toLowerCase(Locale.ROOT);
  }

  public boolean selfReferencing() {
    return table.equalsIgnoreCase(pkTable);
  }
}
