/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.ForeignKey;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.util.SchemaMismatchException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * One row per (parent, date) for calendar-style tables such as {@code room_night}.
 *
 * <p>Parents are visited in shuffled order; each gets {@code max(1, rowCount / parents)} distinct
 * day offsets inside a window of {@code [today - daysBack, today + daysAhead)}, so (parent, date)
 * never repeats.
 */
public final class DateRangeExpansionAssembler implements TableAssembler {

  private final String parentColumn;
  private final String parentTable;
  private final String dateColumn;
  private final int daysBack;
  private final int daysAhead;
  private final DefaultTableAssembler defaults = new DefaultTableAssembler();

  public DateRangeExpansionAssembler(
      final String parentColumn,
      final String parentTable,
      final String dateColumn,
      final int daysBack,
      final int daysAhead) {
    this.parentColumn = Objects.requireNonNull(parentColumn, "Parent column cannot be null");
    this.parentTable = Objects.requireNonNull(parentTable, "Parent table cannot be null");
    this.dateColumn = Objects.requireNonNull(dateColumn, "Date column cannot be null");
    this.daysBack = daysBack;
    this.daysAhead = daysAhead;
  }

  @Override
  public List<Row> assemble(
      final Table table, final int rowCount, final GenerationContext context) {
    final Column parent = table.firstColumn(parentColumn).orElse(null);
    final Column date = table.firstColumn(dateColumn).orElse(null);
    if (parent == null || date == null) {
      throw new SchemaMismatchException(
          "Table %s needs columns %s and %s".formatted(table.name(), parentColumn, dateColumn));
    }
    final String parentName =
        table.foreignKeyFor(parent.name()).map(ForeignKey::pkTable).orElse(parentTable);

    final Random random = context.getRandom();
    final List<Object> parents =
        new ArrayList<>(context.getForeignKeys().requireParents(table, parentName));
    Collections.shuffle(parents, random);

    final LocalDate windowStart = context.getValues().today().minusDays(daysBack);
    final int windowDays =
        (int) ChronoUnit.DAYS.between(windowStart, context.getValues().today().plusDays(daysAhead));
    final int perParent = Math.min(Math.max(1, rowCount / parents.size()), windowDays);

    final List<Row> rows = new ArrayList<>(rowCount);
    for (final Object key : parents) {
      if (rows.size() >= rowCount) {
        break;
      }
      for (final int offset : sampleOffsets(random, windowDays, perParent)) {
        if (rows.size() >= rowCount) {
          break;
        }
        final Map<String, Object> values = new LinkedHashMap<>();
        values.put(parent.name(), key);
        values.put(
            date.name(), DefaultTableAssembler.temporal(date, windowStart.plusDays(offset)));
        defaults.completeRow(table, values, rows.size() + 1, rowCount, context);
        rows.add(new Row(values));
      }
    }
    return rows;
  }

  /** {@code count} distinct offsets in {@code [0, bound)}, in draw order. */
  static Set<Integer> sampleOffsets(final Random random, final int bound, final int count) {
    final Set<Integer> offsets = new LinkedHashSet<>();
    if (count * 2 > bound) {
      // Dense request: shuffle the whole range.
      final List<Integer> all = new ArrayList<>(bound);
      for (int i = 0; i < bound; i++) {
        all.add(i);
      }
      Collections.shuffle(all, random);
      offsets.addAll(all.subList(0, count));
      return offsets;
    }
    while (offsets.size() < count) {
      offsets.add(random.nextInt(bound));
    }
    return offsets;
  }
}
