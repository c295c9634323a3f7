/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db;

import java.util.Map;

public record Row(Map<String, Object> values) {

  public Object get(String column) {
    return values.get(column);
  }
}
