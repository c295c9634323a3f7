/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import com.luisppb16.oltpseed.db.generator.assembler.JunctionTableAssembler.Side;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Bespoke assemblers by table name, falling back to {@link DefaultTableAssembler}. */
public final class TableAssemblerRegistry {

  private final Map<String, TableAssembler> assemblers = new LinkedHashMap<>();
  private final TableAssembler fallback;

  public TableAssemblerRegistry(final TableAssembler fallback) {
    this.fallback = Objects.requireNonNull(fallback, "Fallback assembler cannot be null");
  }

  /** The hotel schema's bespoke tables on top of the default assembler. */
  public static TableAssemblerRegistry defaults() {
    return new TableAssemblerRegistry(new DefaultTableAssembler())
        .register(
            "booking_room",
            new JunctionTableAssembler(
                Side.of("booking", "booking_id"), Side.of("room", "room_id"), 1, 3))
        .register(
            "booking_discount",
            new JunctionTableAssembler(
                Side.of("booking", "booking_id"),
                Side.of("promotion", "promotion_id", "promo_id"),
                0,
                2))
        .register(
            "review_score",
            new JunctionTableAssembler(
                Side.of("review", "review_id"),
                Side.of("review_category", "review_category_id", "category_id"),
                1,
                5))
        .register(
            "room_night",
            new DateRangeExpansionAssembler("room_id", "room", "night_date", 730, 365))
        .register(
            "stay",
            new StatusLifecycleAssembler(
                "actual_checkin_at", "actual_checkout_at", "stay_status", "status"));
  }

  public TableAssemblerRegistry register(final String table, final TableAssembler assembler) {
    assemblers.put(
        table.toLowerCase(Locale.ROOT),
        Objects.requireNonNull(assembler, "Assembler cannot be null"));
    return this;
  }

  public TableAssembler forTable(final String table) {
    return assemblers.getOrDefault(table.toLowerCase(Locale.ROOT), fallback);
  }

  public Map<String, TableAssembler> registered() {
    return Collections.unmodifiableMap(assemblers);
  }
}
