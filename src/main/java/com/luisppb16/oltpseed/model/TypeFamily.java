/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.model;

import java.sql.Types;
import java.util.Locale;
import java.util.Objects;

/**
 * Declared type families the generator knows how to synthesize. Everything it cannot produce
 * collapses into {@link #OTHER}.
 */
public enum TypeFamily {
  INTEGER,
  NUMERIC,
  TEXT,
  BOOLEAN,
  DATE,
  TIMESTAMP,
  UUID,
  ENUM,
  OTHER;

  public static TypeFamily fromJdbc(final int jdbcType, final String typeName) {
    final String tn = Objects.requireNonNullElse(typeName, "").toLowerCase(Locale.ROOT);
    if (tn.contains("uuid")) {
      return UUID;
    }
    return switch (jdbcType) {
      case Types.INTEGER, Types.SMALLINT, Types.TINYINT, Types.BIGINT -> INTEGER;
      case Types.DECIMAL, Types.NUMERIC, Types.FLOAT, Types.DOUBLE, Types.REAL -> NUMERIC;
      case Types.CHAR, Types.VARCHAR, Types.NCHAR, Types.NVARCHAR,
          Types.LONGVARCHAR, Types.LONGNVARCHAR, Types.CLOB -> TEXT;
      case Types.BOOLEAN, Types.BIT -> BOOLEAN;
      case Types.DATE -> DATE;
      case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
      default -> OTHER;
    };
  }

  /** Bit width of a JDBC integer type, 0 for anything else. */
  public static int integerBits(final int jdbcType) {
    return switch (jdbcType) {
      case Types.TINYINT -> 8;
      case Types.SMALLINT -> 16;
      case Types.INTEGER -> 32;
      case Types.BIGINT -> 64;
      default -> 0;
    };
  }

  /**
   * Maps a PostgreSQL {@code information_schema.columns} pair ({@code data_type}, {@code
   * udt_name}) to a family. Enum membership is decided by the caller against the enum catalog.
   */
  public static TypeFamily fromPostgres(final String dataType, final String udtName) {
    final String dt = Objects.requireNonNullElse(dataType, "").toLowerCase(Locale.ROOT);
    final String udt = Objects.requireNonNullElse(udtName, "").toLowerCase(Locale.ROOT);
    if ("uuid".equals(dt) || "uuid".equals(udt)) {
      return UUID;
    }
    return switch (dt) {
      case "integer", "bigint", "smallint" -> INTEGER;
      case "numeric", "decimal", "double precision", "real" -> NUMERIC;
      case "character varying", "character", "text" -> TEXT;
      case "boolean" -> BOOLEAN;
      case "date" -> DATE;
      case "timestamp without time zone", "timestamp with time zone" -> TIMESTAMP;
      default ->
          switch (udt) {
            case "int2", "int4", "int8" -> INTEGER;
            case "numeric" -> NUMERIC;
            case "timestamp", "timestamptz" -> TIMESTAMP;
            default -> OTHER;
          };
    };
  }
}
