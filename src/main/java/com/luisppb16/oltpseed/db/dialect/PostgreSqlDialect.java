/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.dialect;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.util.BulkLoadException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;

/**
 * PostgreSQL: {@code TRUNCATE ... RESTART IDENTITY CASCADE} and CSV streamed through {@code
 * COPY ... FROM STDIN}.
 */
@Slf4j
public final class PostgreSqlDialect extends AbstractDialect {

  public PostgreSqlDialect() {
    super("postgresql.properties");
  }

  @Override
  public long bulkLoad(
      final Connection conn,
      final String schema,
      final Table table,
      final List<Row> rows,
      final Path csv) {
    final String sql =
        props
            .getProperty(
                "copyStatement",
                "COPY ${table} (${columns}) FROM STDIN WITH (FORMAT CSV, HEADER true)")
            .replace("${table}", qualify(schema, table.name()))
            .replace("${columns}", columnList(table));
    try (final Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
      final long copied = copyManager(conn).copyIn(sql, reader);
      log.debug("{}: COPY reported {} rows", table.name(), copied);
      return copied;
    } catch (final SQLException | IOException e) {
      throw new BulkLoadException("COPY into %s failed".formatted(table.name()), e);
    }
  }

  private static CopyManager copyManager(final Connection conn) throws SQLException {
    if (conn.isWrapperFor(PGConnection.class)) {
      return conn.unwrap(PGConnection.class).getCopyAPI();
    }
    return new CopyManager((BaseConnection) conn);
  }
}
