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
import com.luisppb16.oltpseed.util.CapacityExceededException;
import com.luisppb16.oltpseed.util.SchemaMismatchException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Junction tables whose two foreign keys must be unique as a pair.
 *
 * <p>Each sweep picks a random left key and pairs it with {@code minFanOut..maxFanOut} distinct
 * right keys; already seen pairs are skipped. After {@link #SWEEP_FACTOR} sweeps per requested
 * row the remaining rows are filled deterministically from the cartesian product, so the
 * assembler always terminates. Requests larger than the product fail up front.
 */
@Slf4j
public final class JunctionTableAssembler implements TableAssembler {

  static final int SWEEP_FACTOR = 20;

  private final Side left;
  private final Side right;
  private final int minFanOut;
  private final int maxFanOut;
  private final DefaultTableAssembler defaults = new DefaultTableAssembler();

  /**
   * One foreign-key side of the pair.
   *
   * @param columns candidate column names, first present wins
   * @param parentTable parent used when the column carries no declared foreign key
   */
  public record Side(List<String> columns, String parentTable) {

    public Side {
      columns = List.copyOf(columns);
      Objects.requireNonNull(parentTable, "Parent table cannot be null");
    }

    public static Side of(final String parentTable, final String... columns) {
      return new Side(Arrays.asList(columns), parentTable);
    }
  }

  public JunctionTableAssembler(
      final Side left, final Side right, final int minFanOut, final int maxFanOut) {
    if (minFanOut < 0 || maxFanOut < Math.max(1, minFanOut)) {
      throw new IllegalArgumentException(
          "Invalid fan-out range %d..%d".formatted(minFanOut, maxFanOut));
    }
    this.left = Objects.requireNonNull(left, "Left side cannot be null");
    this.right = Objects.requireNonNull(right, "Right side cannot be null");
    this.minFanOut = minFanOut;
    this.maxFanOut = maxFanOut;
  }

  @Override
  public List<Row> assemble(
      final Table table, final int rowCount, final GenerationContext context) {
    final Column leftColumn = column(table, left);
    final Column rightColumn = column(table, right);
    final List<Object> leftKeys =
        context.getForeignKeys().requireParents(table, parentOf(table, leftColumn, left));
    final List<Object> rightKeys =
        context.getForeignKeys().requireParents(table, parentOf(table, rightColumn, right));

    final long capacity = (long) leftKeys.size() * rightKeys.size();
    if (rowCount > capacity) {
      throw new CapacityExceededException(
          "distinct (%s, %s) pairs in %s"
              .formatted(leftColumn.name(), rightColumn.name(), table.name()),
          rowCount,
          capacity);
    }

    final Random random = context.getRandom();
    final Set<List<Object>> seen = new HashSet<>();
    final List<Row> rows = new ArrayList<>(rowCount);

    final long maxSweeps = (long) rowCount * SWEEP_FACTOR;
    for (long sweep = 0; sweep < maxSweeps && rows.size() < rowCount; sweep++) {
      final Object l = leftKeys.get(random.nextInt(leftKeys.size()));
      final int fanOut =
          Math.min(minFanOut + random.nextInt(maxFanOut - minFanOut + 1), rightKeys.size());
      final Set<Integer> picked = new LinkedHashSet<>();
      while (picked.size() < fanOut) {
        picked.add(random.nextInt(rightKeys.size()));
      }
      for (final int index : picked) {
        if (rows.size() >= rowCount) {
          break;
        }
        final Object r = rightKeys.get(index);
        if (seen.add(List.of(l, r))) {
          rows.add(row(table, leftColumn, l, rightColumn, r, rows.size() + 1, rowCount, context));
        }
      }
    }

    if (rows.size() < rowCount) {
      log.debug(
          "{}: random sweeps produced {} of {} pairs, filling from the cartesian product",
          table.name(),
          rows.size(),
          rowCount);
      fill:
      for (final Object l : leftKeys) {
        for (final Object r : rightKeys) {
          if (rows.size() >= rowCount) {
            break fill;
          }
          if (seen.add(List.of(l, r))) {
            rows.add(row(table, leftColumn, l, rightColumn, r, rows.size() + 1, rowCount, context));
          }
        }
      }
    }
    return rows;
  }

  private Row row(
      final Table table,
      final Column leftColumn,
      final Object leftKey,
      final Column rightColumn,
      final Object rightKey,
      final int ordinal,
      final int rowCount,
      final GenerationContext context) {
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put(leftColumn.name(), leftKey);
    values.put(rightColumn.name(), rightKey);
    defaults.completeRow(table, values, ordinal, rowCount, context);
    return new Row(values);
  }

  private static Column column(final Table table, final Side side) {
    return table
        .firstColumn(side.columns().toArray(String[]::new))
        .orElseThrow(
            () ->
                new SchemaMismatchException(
                    "Table %s has none of the columns %s"
                        .formatted(table.name(), side.columns())));
  }

  private static String parentOf(final Table table, final Column column, final Side side) {
    return table.foreignKeyFor(column.name()).map(ForeignKey::pkTable).orElse(side.parentTable());
  }
}
