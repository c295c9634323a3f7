/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything introspected from one schema for the duration of a run. Table lookups are
 * case-insensitive; the table list keeps catalog order.
 */
public record SchemaSnapshot(String schema, List<Table> tables, EnumCatalog enums) {

  public SchemaSnapshot {
    Objects.requireNonNull(tables, "Table list cannot be null.");
    tables = List.copyOf(tables);
    enums = Objects.requireNonNullElse(enums, EnumCatalog.empty());
  }

  public Optional<Table> table(String name) {
    return tables.stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
  }
}
