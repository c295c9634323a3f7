/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.dialect;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.model.Table;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

/**
 * Database-specific parts of loading: identifier quoting, emptying tables, bulk loading and
 * reading back generated keys. Failures surface as {@link
 * com.luisppb16.oltpseed.util.BulkLoadException}.
 */
public sealed interface DatabaseDialect permits AbstractDialect {

  /** Quotes an identifier (table or column name). */
  String quote(String identifier);

  /** Schema-qualified, quoted table name; unqualified when {@code schema} is null. */
  String qualify(String schema, String table);

  /** Empties every table of {@code loadOrder}, in reverse order. */
  void truncate(Connection conn, String schema, List<Table> loadOrder);

  /**
   * Loads {@code rows} into {@code table}. {@code csv} holds the same rows as written by {@link
   * com.luisppb16.oltpseed.db.CsvTableWriter}; a dialect uses whichever source suits it.
   *
   * @return number of rows loaded
   */
  long bulkLoad(Connection conn, String schema, Table table, List<Row> rows, Path csv);

  /** Primary-key values of a single-column key table, ascending; empty for other tables. */
  List<Object> readPrimaryKeys(Connection conn, String schema, Table table);
}
