/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.dialect;

import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.util.BulkLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared dialect behaviour driven by a {@code /dialects/<name>.properties} resource: quoting,
 * the per-table truncate statement, and the primary-key read-back query.
 */
@Slf4j
public abstract sealed class AbstractDialect implements DatabaseDialect
    permits PostgreSqlDialect, StandardDialect {

  protected final Properties props = new Properties();

  protected AbstractDialect(final String resourceName) {
    if (Objects.nonNull(resourceName)) {
      try (final InputStream is = getClass().getResourceAsStream("/dialects/" + resourceName)) {
        if (Objects.nonNull(is)) {
          props.load(is);
        } else {
          log.warn("Dialect resource {} not found, using defaults", resourceName);
        }
      } catch (final IOException e) {
        log.warn("Could not read dialect resource {}, using defaults", resourceName, e);
      }
    }
  }

  public String getProperty(final String key, final String defaultValue) {
    return props.getProperty(key, defaultValue);
  }

  @Override
  public String quote(final String identifier) {
    final String quoteChar = props.getProperty("quoteChar", "\"");
    final String quoteEscape = props.getProperty("quoteEscape", "\"\"");
    return quoteChar + identifier.replace(quoteChar, quoteEscape) + quoteChar;
  }

  @Override
  public String qualify(final String schema, final String table) {
    return Objects.isNull(schema) || schema.isBlank()
        ? quote(table)
        : quote(schema) + "." + quote(table);
  }

  protected String columnList(final Table table) {
    return table.columnNames().stream().map(this::quote).collect(Collectors.joining(", "));
  }

  @Override
  public void truncate(final Connection conn, final String schema, final List<Table> loadOrder) {
    final String template = props.getProperty("truncateStatement", "DELETE FROM ${table}");
    final List<Table> reversed = new ArrayList<>(loadOrder);
    Collections.reverse(reversed);
    try (final Statement st = conn.createStatement()) {
      for (final Table table : reversed) {
        final String sql = template.replace("${table}", qualify(schema, table.name()));
        log.debug("Executing {}", sql);
        st.execute(sql);
      }
    } catch (final SQLException e) {
      throw new BulkLoadException("Could not empty tables before loading", e);
    }
    log.info("Emptied {} tables", reversed.size());
  }

  @Override
  public List<Object> readPrimaryKeys(
      final Connection conn, final String schema, final Table table) {
    final Optional<String> pk = table.singlePrimaryKey();
    if (pk.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT %s FROM %s ORDER BY %s"
            .formatted(quote(pk.get()), qualify(schema, table.name()), quote(pk.get()));
    final List<Object> keys = new ArrayList<>();
    try (final Statement st = conn.createStatement();
        final ResultSet rs = st.executeQuery(sql)) {
      while (rs.next()) {
        keys.add(rs.getObject(1));
      }
    } catch (final SQLException e) {
      throw new BulkLoadException("Could not read primary keys of " + table.name(), e);
    }
    return keys;
  }
}
