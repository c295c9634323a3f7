/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.dialect;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.util.BulkLoadException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Any other JDBC database: {@code DELETE FROM} to empty tables and batched prepared {@code
 * INSERT}s to load them. The CSV file is not read.
 */
@Slf4j
public final class StandardDialect extends AbstractDialect {

  public StandardDialect() {
    super("standard.properties");
  }

  @Override
  public long bulkLoad(
      final Connection conn,
      final String schema,
      final Table table,
      final List<Row> rows,
      final Path csv) {
    final List<String> columns = table.columnNames();
    final String sql =
        props
            .getProperty(
                "insertStatement", "INSERT INTO ${table} (${columns}) VALUES (${placeholders})")
            .replace("${table}", qualify(schema, table.name()))
            .replace("${columns}", columnList(table))
            .replace(
                "${placeholders}", String.join(", ", Collections.nCopies(columns.size(), "?")));
    final int maxBatch = Integer.parseInt(props.getProperty("maxBatchSize", "1000"));

    long loaded = 0;
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      int pending = 0;
      for (final Row row : rows) {
        for (int i = 0; i < columns.size(); i++) {
          ps.setObject(i + 1, row.get(columns.get(i)));
        }
        ps.addBatch();
        if (++pending == maxBatch) {
          loaded += sum(ps.executeBatch());
          pending = 0;
        }
      }
      if (pending > 0) {
        loaded += sum(ps.executeBatch());
      }
    } catch (final SQLException e) {
      throw new BulkLoadException("INSERT into %s failed".formatted(table.name()), e);
    }
    return loaded;
  }

  private static long sum(final int[] counts) {
    long total = 0;
    for (final int c : counts) {
      // SUCCESS_NO_INFO means one row went in without a count.
      total += c >= 0 ? c : 1;
    }
    return total;
  }
}
