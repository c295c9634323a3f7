/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Curated value pools bundled as classpath resources, plus the per-run state for drawing from a
 * pool without repetition.
 *
 * <p>Resource contents are loaded lazily once per JVM and cached; draw state belongs to the
 * instance, so each run starts with full pools.
 */
public final class CuratedPools {

  public static final List<String> HOTEL_SUFFIXES = List.of("Hotel", "Resort", "Suites", "Inn");

  private static final String LOCATIONS_PATH = "/pools/locations.json";
  private static final String HOTEL_BRANDS_PATH = "/pools/hotel-brands.txt";
  private static final String ROOM_TYPE_NAMES_PATH = "/pools/room-type-names.txt";

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final AtomicReference<List<Location>> locationCache = new AtomicReference<>();
  private static final AtomicReference<List<String>> brandCache = new AtomicReference<>();
  private static final AtomicReference<List<String>> roomTypeCache = new AtomicReference<>();
  private static final Object POOL_LOCK = new Object();

  private final Random random;
  private final Map<String, Deque<String>> decks = new HashMap<>();

  public CuratedPools(final Random random) {
    this.random = Objects.requireNonNull(random, "Random cannot be null");
  }

  /** A city with its state, country, postal prefix and time zone. */
  public record Location(
      String city, String state, String country, String postalPrefix, String timezone) {}

  public static List<Location> locations() {
    if (Objects.isNull(locationCache.get())) {
      synchronized (POOL_LOCK) {
        if (Objects.isNull(locationCache.get())) {
          locationCache.set(readLocations());
        }
      }
    }
    return locationCache.get();
  }

  public static List<String> hotelBrands() {
    return lines(brandCache, HOTEL_BRANDS_PATH);
  }

  public static List<String> roomTypeNames() {
    return lines(roomTypeCache, ROOM_TYPE_NAMES_PATH);
  }

  public <T> T pick(final List<T> values) {
    return values.get(random.nextInt(values.size()));
  }

  /**
   * Next value of {@code values} not yet drawn under {@code key}. Once every value has been
   * drawn, a random value with a six-hex suffix is returned instead.
   */
  public String drawDistinct(final String key, final List<String> values) {
    final Deque<String> deck =
        decks.computeIfAbsent(
            key.toLowerCase(Locale.ROOT),
            k -> {
              final List<String> shuffled = new ArrayList<>(values);
              Collections.shuffle(shuffled, random);
              return new ArrayDeque<>(shuffled);
            });
    if (!deck.isEmpty()) {
      return deck.pop();
    }
    return "%s_%06x".formatted(pick(values), random.nextInt(0x1000000));
  }

  private static List<String> lines(final AtomicReference<List<String>> cache, final String path) {
    if (Objects.isNull(cache.get())) {
      synchronized (POOL_LOCK) {
        if (Objects.isNull(cache.get())) {
          cache.set(readLines(path));
        }
      }
    }
    return cache.get();
  }

  private static List<String> readLines(final String path) {
    try (final InputStream is = CuratedPools.class.getResourceAsStream(path)) {
      if (Objects.isNull(is)) {
        throw new IllegalStateException("Missing pool resource " + path);
      }
      return Arrays.stream(new String(is.readAllBytes(), StandardCharsets.UTF_8).split("\\R"))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .toList();
    } catch (final IOException e) {
      throw new UncheckedIOException("Could not read pool resource " + path, e);
    }
  }

  private static List<Location> readLocations() {
    try (final InputStream is = CuratedPools.class.getResourceAsStream(LOCATIONS_PATH)) {
      if (Objects.isNull(is)) {
        throw new IllegalStateException("Missing pool resource " + LOCATIONS_PATH);
      }
      return List.copyOf(MAPPER.readValue(is, new TypeReference<List<Location>>() {}));
    } catch (final IOException e) {
      throw new UncheckedIOException("Could not read pool resource " + LOCATIONS_PATH, e);
    }
  }
}
