/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db;

import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.EnumCatalog;
import com.luisppb16.oltpseed.model.ForeignKey;
import com.luisppb16.oltpseed.model.SchemaSnapshot;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.SchemaIntrospectionException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads tables, columns, primary keys, foreign keys, enumerated types and single-column
 * uniqueness constraints of one schema.
 *
 * <p>PostgreSQL is read through {@code information_schema} and {@code pg_enum}; any other JDBC
 * database falls back to {@link DatabaseMetaData} and has no enum catalog. Failures are wrapped
 * in {@link SchemaIntrospectionException} and never retried.
 */
@Slf4j
@UtilityClass
public class SchemaIntrospector {

  private static final String COLUMN_NAME = "COLUMN_NAME";

  private static final String PG_TABLES =
      "SELECT table_name FROM information_schema.tables "
          + "WHERE table_schema = ? AND table_type = 'BASE TABLE' ORDER BY table_name";

  private static final String PG_COLUMNS =
      "SELECT table_name, column_name, data_type, udt_name, is_nullable, "
          + "character_maximum_length, numeric_precision, numeric_scale "
          + "FROM information_schema.columns WHERE table_schema = ? "
          + "ORDER BY table_name, ordinal_position";

  private static final String PG_PRIMARY_KEYS =
      "SELECT tc.table_name, kcu.column_name "
          + "FROM information_schema.table_constraints tc "
          + "JOIN information_schema.key_column_usage kcu "
          + "  ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema "
          + "WHERE tc.table_schema = ? AND tc.constraint_type = 'PRIMARY KEY' "
          + "ORDER BY tc.table_name, kcu.ordinal_position";

  private static final String PG_FOREIGN_KEYS =
      "SELECT tc.constraint_name, tc.table_name, kcu.column_name, "
          + "ccu.table_name AS ref_table_name, ccu.column_name AS ref_column_name "
          + "FROM information_schema.table_constraints tc "
          + "JOIN information_schema.key_column_usage kcu "
          + "  ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema "
          + "JOIN information_schema.constraint_column_usage ccu "
          + "  ON ccu.constraint_name = tc.constraint_name AND ccu.table_schema = tc.table_schema "
          + "WHERE tc.table_schema = ? AND tc.constraint_type = 'FOREIGN KEY' "
          + "ORDER BY tc.table_name, kcu.column_name";

  private static final String PG_ENUMS =
      "SELECT t.typname AS enum_name, e.enumlabel AS enum_value "
          + "FROM pg_type t JOIN pg_enum e ON t.oid = e.enumtypid "
          + "ORDER BY t.typname, e.enumsortorder";

  // Constraints with exactly one column only.
  private static final String PG_UNIQUE_COLUMNS =
      "WITH uniq AS ("
          + "  SELECT tc.table_schema, tc.table_name, tc.constraint_name, "
          + "         COUNT(kcu.column_name) AS col_count "
          + "  FROM information_schema.table_constraints tc "
          + "  JOIN information_schema.key_column_usage kcu "
          + "    ON tc.constraint_name = kcu.constraint_name "
          + "   AND tc.table_schema = kcu.table_schema "
          + "  WHERE tc.table_schema = ? AND tc.constraint_type = 'UNIQUE' "
          + "  GROUP BY 1, 2, 3) "
          + "SELECT kcu.table_name, kcu.column_name FROM uniq "
          + "JOIN information_schema.key_column_usage kcu "
          + "  ON uniq.constraint_name = kcu.constraint_name "
          + " AND uniq.table_schema = kcu.table_schema "
          + "WHERE uniq.col_count = 1";

  // H2 2.x reports plain tables as BASE TABLE.
  private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

  public static SchemaSnapshot introspect(final Connection conn, final String schema) {
    Objects.requireNonNull(conn, "Connection cannot be null");
    try {
      final DatabaseMetaData meta = conn.getMetaData();
      final String product = safe(meta.getDatabaseProductName()).toLowerCase(Locale.ROOT);
      final SchemaSnapshot snapshot =
          product.contains("postgres")
              ? introspectPostgres(conn, schema)
              : introspectGeneric(meta, schema);
      log.info(
          "Introspected schema {}: {} tables, {} enum types",
          schema,
          snapshot.tables().size(),
          snapshot.enums().size());
      return snapshot;
    } catch (final SQLException e) {
      throw new SchemaIntrospectionException("Unable to introspect schema " + schema, e);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // PostgreSQL catalogs
  // ---------------------------------------------------------------------------------------------

  private static SchemaSnapshot introspectPostgres(final Connection conn, final String schema)
      throws SQLException {
    final List<String> tableNames = new ArrayList<>();
    try (final PreparedStatement ps = conn.prepareStatement(PG_TABLES)) {
      ps.setString(1, schema);
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          tableNames.add(rs.getString(1));
        }
      }
    }

    final EnumCatalog enums = loadPostgresEnums(conn);
    final Map<String, List<Column>> columns = loadPostgresColumns(conn, schema, enums);
    final Map<String, List<String>> pks = groupByTable(conn, PG_PRIMARY_KEYS, schema);
    final Map<String, List<String>> uniques = groupByTable(conn, PG_UNIQUE_COLUMNS, schema);
    final Map<String, List<ForeignKey>> fks = loadPostgresForeignKeys(conn, schema);

    final List<Table> tables = new ArrayList<>();
    for (final String name : tableNames) {
      final String key = name.toLowerCase(Locale.ROOT);
      tables.add(
          new Table(
              name,
              columns.getOrDefault(key, List.of()),
              pks.getOrDefault(key, List.of()),
              fks.getOrDefault(key, List.of()),
              new HashSet<>(uniques.getOrDefault(key, List.of()))));
    }
    return new SchemaSnapshot(schema, tables, enums);
  }

  private static EnumCatalog loadPostgresEnums(final Connection conn) throws SQLException {
    final Map<String, List<String>> labels = new LinkedHashMap<>();
    try (final PreparedStatement ps = conn.prepareStatement(PG_ENUMS);
        final ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        final String type = rs.getString("enum_name").toLowerCase(Locale.ROOT);
        labels.computeIfAbsent(type, k -> new ArrayList<>()).add(rs.getString("enum_value"));
      }
    }
    return new EnumCatalog(labels);
  }

  private static Map<String, List<Column>> loadPostgresColumns(
      final Connection conn, final String schema, final EnumCatalog enums) throws SQLException {
    final Map<String, List<Column>> out = new HashMap<>();
    try (final PreparedStatement ps = conn.prepareStatement(PG_COLUMNS)) {
      ps.setString(1, schema);
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          final String table = rs.getString("table_name");
          final String udt = rs.getString("udt_name");
          final boolean isEnum = enums.contains(udt);
          out.computeIfAbsent(table.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
              .add(
                  Column.builder()
                      .table(table)
                      .name(rs.getString("column_name"))
                      .type(
                          isEnum
                              ? TypeFamily.ENUM
                              : TypeFamily.fromPostgres(rs.getString("data_type"), udt))
                      .nullable("YES".equalsIgnoreCase(rs.getString("is_nullable")))
                      .maxLength(rs.getInt("character_maximum_length"))
                      .precision(rs.getInt("numeric_precision"))
                      .scale(rs.getInt("numeric_scale"))
                      .enumType(isEnum ? udt : null)
                      .build());
        }
      }
    }
    return out;
  }

  private static Map<String, List<ForeignKey>> loadPostgresForeignKeys(
      final Connection conn, final String schema) throws SQLException {
    final Map<String, List<ForeignKey>> out = new HashMap<>();
    try (final PreparedStatement ps = conn.prepareStatement(PG_FOREIGN_KEYS)) {
      ps.setString(1, schema);
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          final String table = rs.getString("table_name");
          out.computeIfAbsent(table.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
              .add(
                  new ForeignKey(
                      rs.getString("constraint_name"),
                      table,
                      rs.getString("column_name"),
                      rs.getString("ref_table_name"),
                      rs.getString("ref_column_name")));
        }
      }
    }
    return out;
  }

  private static Map<String, List<String>> groupByTable(
      final Connection conn, final String sql, final String schema) throws SQLException {
    final Map<String, List<String>> out = new HashMap<>();
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, schema);
      try (final ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.computeIfAbsent(rs.getString(1).toLowerCase(Locale.ROOT), k -> new ArrayList<>())
              .add(rs.getString(2));
        }
      }
    }
    return out;
  }

  // ---------------------------------------------------------------------------------------------
  // Generic JDBC metadata
  // ---------------------------------------------------------------------------------------------

  private static SchemaSnapshot introspectGeneric(final DatabaseMetaData meta, final String name)
      throws SQLException {
    final List<Table> tables = new ArrayList<>();
    // Unquoted identifiers are stored upper-cased by H2 and friends.
    final String schema =
        name != null && meta.storesUpperCaseIdentifiers() ? name.toUpperCase(Locale.ROOT) : name;

    try (final ResultSet rs = meta.getTables(null, schema, "%", TABLE_TYPES)) {
      while (rs.next()) {
        final String tableName = rs.getString("TABLE_NAME");
        final String tableSchema = rs.getString("TABLE_SCHEM");
        final String effectiveSchema = tableSchema != null ? tableSchema : schema;

        final List<Column> columns = loadColumns(meta, effectiveSchema, tableName);
        final List<String> pkCols = loadPrimaryKeys(meta, effectiveSchema, tableName);
        final List<ForeignKey> fks = loadForeignKeys(meta, effectiveSchema, tableName);
        final Set<String> uniques = loadSingleColumnUniques(meta, effectiveSchema, tableName);
        log.debug(
            "Table {}: {} columns, pk {}, {} foreign keys, unique {}",
            tableName,
            columns.size(),
            pkCols,
            fks.size(),
            uniques);

        tables.add(new Table(tableName, columns, pkCols, fks, uniques));
      }
    }
    return new SchemaSnapshot(schema, tables, EnumCatalog.empty());
  }

  private static List<Column> loadColumns(
      final DatabaseMetaData meta, final String schema, final String table) throws SQLException {
    final List<Column> columns = new ArrayList<>();
    try (final ResultSet rs = meta.getColumns(null, schema, table, "%")) {
      while (rs.next()) {
        final int dataType = rs.getInt("DATA_TYPE");
        final TypeFamily family = TypeFamily.fromJdbc(dataType, rs.getString("TYPE_NAME"));
        final int size = rs.getInt("COLUMN_SIZE");
        final int precision =
            switch (family) {
              case NUMERIC -> size;
              case INTEGER -> TypeFamily.integerBits(dataType);
              default -> 0;
            };
        columns.add(
            Column.builder()
                .table(table)
                .name(rs.getString(COLUMN_NAME))
                .type(family)
                .nullable("YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                .maxLength(family == TypeFamily.TEXT ? size : 0)
                .precision(precision)
                .scale(rs.getInt("DECIMAL_DIGITS"))
                .build());
      }
    }
    return columns;
  }

  private static List<String> loadPrimaryKeys(
      final DatabaseMetaData meta, final String schema, final String table) throws SQLException {
    // KEY_SEQ gives the ordinal inside a composite key; the result set is ordered by column name.
    final Map<Integer, String> bySeq = new TreeMap<>();
    try (final ResultSet rs = meta.getPrimaryKeys(null, schema, table)) {
      while (rs.next()) {
        bySeq.put(rs.getInt("KEY_SEQ"), rs.getString(COLUMN_NAME));
      }
    }
    return new ArrayList<>(bySeq.values());
  }

  private static List<ForeignKey> loadForeignKeys(
      final DatabaseMetaData meta, final String schema, final String table) throws SQLException {
    final List<ForeignKey> fks = new ArrayList<>();
    try (final ResultSet rs = meta.getImportedKeys(null, schema, table)) {
      while (rs.next()) {
        fks.add(
            new ForeignKey(
                rs.getString("FK_NAME"),
                table,
                rs.getString("FKCOLUMN_NAME"),
                rs.getString("PKTABLE_NAME"),
                rs.getString("PKCOLUMN_NAME")));
      }
    }
    return fks;
  }

  private static Set<String> loadSingleColumnUniques(
      final DatabaseMetaData meta, final String schema, final String table) throws SQLException {
    final Map<String, List<String>> idxCols = new LinkedHashMap<>();
    try (final ResultSet rs = meta.getIndexInfo(null, schema, table, true, false)) {
      while (rs.next()) {
        final String idxName = rs.getString("INDEX_NAME");
        final String colName = rs.getString(COLUMN_NAME);
        if (idxName == null || colName == null) continue;
        idxCols.computeIfAbsent(idxName, k -> new ArrayList<>()).add(colName);
      }
    }
    final Set<String> out = new HashSet<>();
    idxCols.values().stream()
        .filter(cols -> cols.size() == 1)
        .forEach(cols -> out.add(cols.get(0)));
    return out;
  }

  private static String safe(final String s) {
    return s == null ? "" : s;
  }
}
