/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a run: rows loaded per table in load order, the foreign-key cycles that were
 * detected, and the elapsed time.
 */
public record SeedReport(Map<String, Long> loaded, List<Set<String>> cycles, Duration elapsed) {

  public SeedReport {
    loaded = Collections.unmodifiableMap(new LinkedHashMap<>(loaded));
    cycles = List.copyOf(cycles);
  }

  public long totalRows() {
    return loaded.values().stream().mapToLong(Long::longValue).sum();
  }

  public long loadedFor(final String table) {
    return loaded.entrySet().stream()
        .filter(e -> e.getKey().equalsIgnoreCase(table))
        .mapToLong(Map.Entry::getValue)
        .findFirst()
        .orElse(0L);
  }
}
