/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.oltpseed;

import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.EnumCatalog;
import com.luisppb16.oltpseed.model.ForeignKey;
import com.luisppb16.oltpseed.model.SchemaSnapshot;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.LongStream;

/** Builders for in-memory schemas used across tests. */
public final class Fixtures {

  public static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
  public static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

  private Fixtures() {}

  public static Column col(final String table, final String name, final TypeFamily type) {
    return Column.builder().table(table).name(name).type(type).nullable(false).build();
  }

  public static Column nullable(final String table, final String name, final TypeFamily type) {
    return Column.builder().table(table).name(name).type(type).nullable(true).build();
  }

  public static Column text(final String table, final String name, final int maxLength) {
    return Column.builder()
        .table(table)
        .name(name)
        .type(TypeFamily.TEXT)
        .nullable(false)
        .maxLength(maxLength)
        .build();
  }

  public static Column enumCol(
      final String table, final String name, final String enumType, final boolean nullable) {
    return Column.builder()
        .table(table)
        .name(name)
        .type(TypeFamily.ENUM)
        .enumType(enumType)
        .nullable(nullable)
        .build();
  }

  public static ForeignKey fk(
      final String table, final String column, final String pkTable, final String pkColumn) {
    return new ForeignKey(null, table, column, pkTable, pkColumn);
  }

  /** A table with a single integer primary key called {@code <name>_id}. */
  public static Table keyed(final String name, final ForeignKey... fks) {
    return new Table(
        name,
        List.of(col(name, name + "_id", TypeFamily.INTEGER)),
        List.of(name + "_id"),
        List.of(fks),
        Set.of());
  }

  public static GenerationContext context(final List<Table> tables, final ReferenceKeyPool keys) {
    return context(tables, EnumCatalog.empty(), keys);
  }

  public static GenerationContext context(
      final List<Table> tables, final EnumCatalog enums, final ReferenceKeyPool keys) {
    return new GenerationContext(new SchemaSnapshot("public", tables, enums), keys, 42L, CLOCK);
  }

  public static EnumCatalog enums(final String type, final String... labels) {
    return new EnumCatalog(Map.of(type, List.of(labels)));
  }

  public static List<Object> ids(final long from, final long to) {
    return LongStream.rangeClosed(from, to).boxed().map(l -> (Object) l).toList();
  }
}
