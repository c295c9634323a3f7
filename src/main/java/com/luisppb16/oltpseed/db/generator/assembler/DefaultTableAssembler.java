/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.db.generator.ValueGenerator;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.ForeignKey;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.SchemaMismatchException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Generic row assembly for any table without a bespoke assembler.
 *
 * <p>Per row: recognised date pairs and an enum status column are drawn first, then every other
 * column in declaration order (single-column primary key, foreign keys, unique columns, plain
 * values), then sentinels for non-nullable columns that are still null. A final pass repairs
 * date pairs whose end falls before their start.
 */
@Slf4j
public class DefaultTableAssembler implements TableAssembler {

  static final String[] RANGE_STARTS = {
    "start_date", "from_date", "valid_from", "effective_start_date", "block_start_date"
  };
  static final String[] RANGE_ENDS = {
    "end_date", "to_date", "valid_to", "effective_end_date", "block_end_date", "expires_on"
  };
  static final String[] STATUS_COLUMNS = {"booking_status", "status"};

  @Override
  public List<Row> assemble(
      final Table table, final int rowCount, final GenerationContext context) {
    final ValueGenerator values = context.getValues();
    final Optional<Column> checkin = table.firstColumn("checkin_date");
    final Optional<Column> checkout = table.firstColumn("checkout_date");
    final Optional<Column> rangeStart = table.firstColumn(RANGE_STARTS);
    final Optional<Column> rangeEnd = table.firstColumn(RANGE_ENDS);
    final Optional<Column> status = table.firstColumn(STATUS_COLUMNS).filter(Column::isEnum);

    final List<Row> rows = new ArrayList<>(rowCount);
    for (int ordinal = 1; ordinal <= rowCount; ordinal++) {
      final Map<String, Object> row = new LinkedHashMap<>();

      if (checkin.isPresent() && checkout.isPresent()) {
        final LocalDate in =
            values.dateBetween(values.today().minusDays(180), values.today().plusDays(365));
        row.put(checkin.get().name(), temporal(checkin.get(), in));
        row.put(
            checkout.get().name(),
            temporal(checkout.get(), in.plusDays(1 + context.getRandom().nextInt(14))));
      }
      if (rangeStart.isPresent() && rangeEnd.isPresent()) {
        final LocalDate start =
            values.dateBetween(values.today().minusDays(365), values.today().plusDays(365));
        row.put(rangeStart.get().name(), temporal(rangeStart.get(), start));
        row.put(
            rangeEnd.get().name(),
            temporal(rangeEnd.get(), start.plusDays(1 + context.getRandom().nextInt(60))));
      }
      status.ifPresent(c -> row.put(c.name(), values.enumLabel(c)));

      completeRow(table, row, ordinal, rowCount, context);
      rows.add(new Row(row));
    }

    if (checkin.isPresent() && checkout.isPresent()) {
      repairRange(rows, checkin.get().name(), checkout.get().name());
    }
    if (rangeStart.isPresent() && rangeEnd.isPresent()) {
      repairRange(rows, rangeStart.get().name(), rangeEnd.get().name());
    }
    return rows;
  }

  /**
   * Fills every column of {@code table} missing from {@code row}, then applies sentinels. Columns
   * already present, even with a {@code null} value, are left alone. A generated {@code
   * updated_at} never precedes the row's {@code created_at}.
   */
  public void completeRow(
      final Table table,
      final Map<String, Object> row,
      final int ordinal,
      final int rowCount,
      final GenerationContext context) {
    final Optional<Column> created = table.firstColumn("created_at");
    final Optional<Column> updated =
        table.firstColumn("updated_at").filter(c -> !row.containsKey(c.name()));
    for (final Column column : table.columns()) {
      if (!row.containsKey(column.name())) {
        row.put(column.name(), columnValue(table, column, ordinal, rowCount, context));
      }
    }
    if (created.isPresent()
        && updated.isPresent()
        && row.get(created.get().name()) instanceof OffsetDateTime createdAt
        && row.get(updated.get().name()) instanceof OffsetDateTime) {
      row.put(updated.get().name(), context.getValues().updatedAfter(createdAt));
    }
    for (final Column column : table.columns()) {
      if (!column.nullable() && row.get(column.name()) == null) {
        row.put(column.name(), sentinel(column, ordinal, context));
      }
    }
  }

  Object columnValue(
      final Table table,
      final Column column,
      final int ordinal,
      final int rowCount,
      final GenerationContext context) {
    final ValueGenerator values = context.getValues();

    final Optional<ForeignKey> fk = table.foreignKeyFor(column.name());
    if (fk.isPresent()) {
      return context.getForeignKeys().resolve(table, fk.get(), column, rowCount);
    }

    final boolean primaryKey =
        table.singlePrimaryKey().filter(pk -> pk.equalsIgnoreCase(column.name())).isPresent();
    if (primaryKey || table.isUnique(column.name())) {
      if (values.producesUniqueTokens(column)) {
        return values.generate(column, ordinal);
      }
      return context
          .getUniqueness()
          .ensureUnique(
              column,
              ordinal,
              o -> {
                if (primaryKey && column.type() == TypeFamily.INTEGER) {
                  return Long.valueOf(o);
                }
                // Location-bound values stay on this row's location across retries.
                return values.generate(column, values.anchoredToRow(column) ? ordinal : o);
              });
    }
    return values.generate(column, ordinal);
  }

  static Object sentinel(final Column column, final int ordinal, final GenerationContext context) {
    final ValueGenerator values = context.getValues();
    return switch (column.type()) {
      case INTEGER -> 1L;
      case BOOLEAN -> Boolean.FALSE;
      case DATE -> values.today();
      case TIMESTAMP -> values.now();
      case UUID -> values.randomUuid();
      case ENUM -> values.enumLabels(column).get(0);
      case NUMERIC -> BigDecimal.ZERO;
      case TEXT -> values.sentinelToken(column, ordinal);
      case OTHER ->
          throw new SchemaMismatchException(
              "Column %s.%s is NOT NULL but its type is not supported"
                  .formatted(column.table(), column.name()));
    };
  }

  /** A date in the column's own representation: midnight UTC for timestamp columns. */
  static Object temporal(final Column column, final LocalDate date) {
    return column.type() == TypeFamily.TIMESTAMP
        ? date.atStartOfDay().atOffset(ZoneOffset.UTC)
        : date;
  }

  /** Forces {@code end = start + 1 day} on every row where end is before start. */
  static int repairRange(final List<Row> rows, final String startColumn, final String endColumn) {
    int repaired = 0;
    for (final Row row : rows) {
      final Object start = row.get(startColumn);
      final Object end = row.get(endColumn);
      if (isBefore(end, start)) {
        row.values().put(endColumn, plusOneDay(start));
        repaired++;
      }
    }
    if (repaired > 0) {
      log.debug("Repaired {} rows with {} before {}", repaired, endColumn, startColumn);
    }
    return repaired;
  }

  static boolean isBefore(final Object value, final Object reference) {
    if (value instanceof LocalDate d && reference instanceof LocalDate r) {
      return d.isBefore(r);
    }
    if (value instanceof OffsetDateTime d && reference instanceof OffsetDateTime r) {
      return d.isBefore(r);
    }
    return false;
  }

  static Object plusOneDay(final Object value) {
    if (value instanceof LocalDate d) {
      return d.plusDays(1);
    }
    if (value instanceof OffsetDateTime d) {
      return d.plusDays(1);
    }
    return value;
  }
}
