/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;

@Builder(toBuilder = true)
public record Table(
    String name,
    List<Column> columns,
    List<String> primaryKey,
    List<ForeignKey> foreignKeys,
    Set<String> uniqueColumns) {

  public Table {
    Objects.requireNonNull(name, "Table name cannot be null.");
    Objects.requireNonNull(columns, "Column list cannot be null.");
    Objects.requireNonNull(primaryKey, "The list of PK columns cannot be null.");
    Objects.requireNonNull(foreignKeys, "The list of foreign keys cannot be null.");

    columns = List.copyOf(columns);
    primaryKey = List.copyOf(primaryKey);
    foreignKeys = List.copyOf(foreignKeys);

    // Unique column lookups are case-insensitive.
    final Set<String> uniques = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    if (uniqueColumns != null) {
      uniques.addAll(uniqueColumns);
    }
    uniqueColumns = Collections.unmodifiableSet(uniques);
  }

  public String key() {
    return name.toLowerCase(Locale.ROOT);
  }

  public Column column(String columnName) {
    return columns.stream()
        .filter(c -> c.name().equalsIgnoreCase(columnName))
        .findFirst()
        .orElse(null);
  }

  /** First column present among {@code candidates}, in candidate order. */
  public Optional<Column> firstColumn(String... candidates) {
    for (final String candidate : candidates) {
      final Column c = column(candidate);
      if (c != null) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  /** The primary-key column name when the key has exactly one column. */
  public Optional<String> singlePrimaryKey() {
    return primaryKey.size() == 1 ? Optional.of(primaryKey.get(0)) : Optional.empty();
  }

  public Optional<ForeignKey> foreignKeyFor(String columnName) {
    return foreignKeys.stream().filter(fk -> fk.column().equalsIgnoreCase(columnName)).findFirst();
  }

  public boolean isUnique(String columnName) {
    return uniqueColumns.contains(columnName);
  }

  public List<String> columnNames() {
    return columns.stream().map(Column::name).toList();
  }
}
