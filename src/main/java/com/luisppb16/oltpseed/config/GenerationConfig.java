/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

@Builder(toBuilder = true)
public record GenerationConfig(
    String url,
    String user,
    String password,
    String schema,
    Path outputDir,
    Boolean truncateFirst,
    Long seed,
    Map<String, Integer> rowCountOverrides) {

  public static final String DEFAULT_SCHEMA = "public";
  public static final Path DEFAULT_OUTPUT_DIR = Path.of("data", "seed");
  public static final long DEFAULT_SEED = 42L;

  public GenerationConfig {
    Objects.requireNonNull(url, "JDBC url cannot be null.");
    schema = schema == null || schema.isBlank() ? DEFAULT_SCHEMA : schema;
    outputDir = Objects.requireNonNullElse(outputDir, DEFAULT_OUTPUT_DIR);
    truncateFirst = Objects.requireNonNullElse(truncateFirst, Boolean.TRUE);
    seed = Objects.requireNonNullElse(seed, DEFAULT_SEED);
    rowCountOverrides = rowCountOverrides == null ? Map.of() : Map.copyOf(rowCountOverrides);
  }
}
