/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Enumerated type name (lower-cased) to its ordered label set. */
public record EnumCatalog(Map<String, List<String>> labels) {

  public EnumCatalog {
    final Map<String, List<String>> copy = new LinkedHashMap<>();
    if (labels != null) {
      labels.forEach((k, v) -> copy.put(k.toLowerCase(Locale.ROOT), List.copyOf(v)));
    }
    labels = Collections.unmodifiableMap(copy);
  }

  public static EnumCatalog empty() {
    return new EnumCatalog(Map.of());
  }

  public boolean contains(String enumType) {
    return enumType != null && labels.containsKey(enumType.toLowerCase(Locale.ROOT));
  }

  public List<String> labelsOf(String enumType) {
    if (enumType == null) {
      return List.of();
    }
    return labels.getOrDefault(enumType.toLowerCase(Locale.ROOT), List.of());
  }

  public int size() {
    return labels.size();
  }
}
