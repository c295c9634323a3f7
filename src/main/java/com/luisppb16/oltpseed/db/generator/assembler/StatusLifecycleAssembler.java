/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.db.generator.ValueGenerator;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.Table;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Tables whose lifecycle timestamps depend on a status label, such as {@code stay}.
 *
 * <p>The status is drawn first and selects the scenario: a cancelled row has neither timestamp,
 * a checked-out row has both with checkout after checkin, a checked-in row has only the checkin,
 * any other label has neither. The booking reference goes through the shared foreign-key
 * resolver, so a unique {@code booking_id} is assigned 1:1.
 */
public final class StatusLifecycleAssembler implements TableAssembler {

  private final String checkinColumn;
  private final String checkoutColumn;
  private final String[] statusColumns;
  private final DefaultTableAssembler defaults = new DefaultTableAssembler();

  public StatusLifecycleAssembler(
      final String checkinColumn, final String checkoutColumn, final String... statusColumns) {
    this.checkinColumn = checkinColumn;
    this.checkoutColumn = checkoutColumn;
    this.statusColumns = statusColumns.clone();
  }

  enum Scenario {
    CANCELLED,
    CHECKED_OUT,
    CHECKED_IN,
    NONE;

    static Scenario of(final String label) {
      final String s = label == null ? "" : label.toUpperCase(Locale.ROOT);
      if (s.contains("CANCEL")) {
        return CANCELLED;
      }
      if (s.contains("OUT")) {
        return CHECKED_OUT;
      }
      if (s.contains("IN")) {
        return CHECKED_IN;
      }
      return NONE;
    }
  }

  @Override
  public List<Row> assemble(
      final Table table, final int rowCount, final GenerationContext context) {
    final ValueGenerator values = context.getValues();
    final Random random = context.getRandom();
    final Optional<Column> status = table.firstColumn(statusColumns).filter(Column::isEnum);
    final Optional<Column> checkin = table.firstColumn(checkinColumn);
    final Optional<Column> checkout = table.firstColumn(checkoutColumn);

    final List<Row> rows = new ArrayList<>(rowCount);
    for (int ordinal = 1; ordinal <= rowCount; ordinal++) {
      final Map<String, Object> row = new LinkedHashMap<>();

      Scenario scenario = Scenario.NONE;
      if (status.isPresent()) {
        final String label = values.enumLabel(status.get());
        row.put(status.get().name(), label);
        scenario = Scenario.of(label);
      }

      OffsetDateTime in = null;
      OffsetDateTime out = null;
      if (scenario == Scenario.CHECKED_OUT || scenario == Scenario.CHECKED_IN) {
        in = values.now().minusSeconds((long) (random.nextDouble() * 180L * 24 * 3600));
      }
      if (scenario == Scenario.CHECKED_OUT) {
        out =
            in.plusDays(1 + random.nextInt(10))
                .plusHours(random.nextInt(7))
                .plusMinutes(random.nextInt(60));
      }
      final OffsetDateTime checkinAt = in;
      final OffsetDateTime checkoutAt = out;
      checkin.ifPresent(c -> row.put(c.name(), asColumnValue(c, checkinAt)));
      checkout.ifPresent(c -> row.put(c.name(), asColumnValue(c, checkoutAt)));

      defaults.completeRow(table, row, ordinal, rowCount, context);
      rows.add(new Row(row));
    }

    if (checkin.isPresent() && checkout.isPresent()) {
      DefaultTableAssembler.repairRange(rows, checkin.get().name(), checkout.get().name());
    }
    return rows;
  }

  private static Object asColumnValue(final Column column, final OffsetDateTime value) {
    if (value == null) {
      return null;
    }
    return switch (column.type()) {
      case DATE -> value.toLocalDate();
      default -> value;
    };
  }
}
