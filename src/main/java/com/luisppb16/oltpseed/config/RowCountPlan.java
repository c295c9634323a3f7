/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rows to generate per table: a default derived from the table name, replaced by an override
 * when one names the table (case-insensitively). Overrides for tables that do not exist are
 * ignored.
 */
public final class RowCountPlan {

  private static final List<String> LOOKUP_HINTS =
      List.of(
          "lookup", "type", "status", "code", "catalog", "policy", "rate_plan", "rate_calendar");
  private static final List<String> LEDGER_HINTS =
      List.of("payment", "invoice", "transaction", "charge");
  private static final List<String> REVERSAL_HINTS = List.of("refund", "cancellation");

  private final Map<String, Integer> counts;

  private RowCountPlan(final Map<String, Integer> counts) {
    this.counts = Collections.unmodifiableMap(counts);
  }

  public static RowCountPlan of(final List<String> tables, final Map<String, Integer> overrides) {
    final Map<String, Integer> lowered = new LinkedHashMap<>();
    overrides.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));

    final Map<String, Integer> counts = new LinkedHashMap<>();
    for (final String table : tables) {
      final String key = table.toLowerCase(Locale.ROOT);
      counts.put(key, lowered.getOrDefault(key, defaultCount(table)));
    }
    return new RowCountPlan(counts);
  }

  public static int defaultCount(final String table) {
    final String t = table.toLowerCase(Locale.ROOT);
    if (LOOKUP_HINTS.stream().anyMatch(t::contains)) {
      return 50;
    }
    if ("hotel".equals(t)) {
      return 12;
    }
    if ("room".equals(t)) {
      return 1000;
    }
    if (t.contains("customer")) {
      return 30_000;
    }
    if (t.contains("booking")) {
      return 70_000;
    }
    if (LEDGER_HINTS.stream().anyMatch(t::contains)) {
      return 60_000;
    }
    if (REVERSAL_HINTS.stream().anyMatch(t::contains)) {
      return 8_000;
    }
    return 2_000;
  }

  /** Planned rows for {@code table}; 0 for tables outside the plan. */
  public int countFor(final String table) {
    return counts.getOrDefault(table.toLowerCase(Locale.ROOT), 0);
  }

  public Map<String, Integer> counts() {
    return counts;
  }
}
