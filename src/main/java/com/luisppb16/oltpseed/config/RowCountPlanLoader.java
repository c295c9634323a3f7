/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luisppb16.oltpseed.util.SeedException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Reads row-count overrides, a JSON object of table name to row count. */
@Slf4j
@UtilityClass
public class RowCountPlanLoader {

  public static final String BUNDLED_RESOURCE = "/row-counts.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Integer>> COUNTS = new TypeReference<>() {};

  /** The overrides bundled with the tool. */
  public static Map<String, Integer> bundled() {
    try (final InputStream is = RowCountPlanLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
      if (Objects.isNull(is)) {
        log.warn("Resource {} not found, no row-count overrides applied", BUNDLED_RESOURCE);
        return Map.of();
      }
      return parse(MAPPER.readValue(is, COUNTS), BUNDLED_RESOURCE);
    } catch (final IOException e) {
      throw new SeedException("Could not read " + BUNDLED_RESOURCE, e);
    }
  }

  public static Map<String, Integer> fromFile(final Path file) {
    try (final InputStream is = Files.newInputStream(file)) {
      return parse(MAPPER.readValue(is, COUNTS), file.toString());
    } catch (final IOException e) {
      throw new SeedException("Could not read row counts from " + file, e);
    }
  }

  private static Map<String, Integer> parse(final Map<String, Integer> raw, final String source) {
    raw.forEach(
        (table, count) -> {
          if (count == null || count < 0) {
            throw new SeedException(
                "Row count for %s in %s must be a non-negative number".formatted(table, source));
          }
        });
    log.debug("Loaded {} row-count overrides from {}", raw.size(), source);
    return Map.copyOf(raw);
  }
}
