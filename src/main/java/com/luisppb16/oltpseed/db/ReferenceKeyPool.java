/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Primary-key values known to exist per table. Foreign keys are only ever resolved from here,
 * and an entry is only ever written from keys read back from the database after a load.
 */
@Slf4j
public final class ReferenceKeyPool {

  private final Map<String, List<Object>> keys = new HashMap<>();

  public List<Object> keysOf(String table) {
    return keys.getOrDefault(table.toLowerCase(Locale.ROOT), List.of());
  }

  /** Replaces the table's entry; the previous keys are discarded. */
  public void replace(String table, List<?> values) {
    keys.put(table.toLowerCase(Locale.ROOT), List.copyOf(values));
    log.debug("Cached {} keys for {}", values.size(), table);
  }
}
