/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.luisppb16.oltpseed.db.generator.CuratedPools.Location;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import net.datafaker.Faker;

/**
 * Keeps the geographic fields of one row consistent: the first lookup for a (table, row
 * ordinal) draws a location and an address, later lookups for the same row reuse them.
 */
public final class LocationCache {

  private final Map<String, RowLocation> rows = new HashMap<>();
  private final CuratedPools pools;
  private final Random random;
  private final Faker faker;

  public LocationCache(final CuratedPools pools, final Random random, final Faker faker) {
    this.pools = Objects.requireNonNull(pools, "Pools cannot be null");
    this.random = Objects.requireNonNull(random, "Random cannot be null");
    this.faker = Objects.requireNonNull(faker, "Faker cannot be null");
  }

  /** @param street2 {@code null} when the address has no second line */
  public record RowLocation(Location location, String postalCode, String street1, String street2) {}

  public RowLocation forRow(final String table, final int ordinal) {
    return rows.computeIfAbsent(table.toLowerCase(Locale.ROOT) + "#" + ordinal, k -> draw());
  }

  public int size() {
    return rows.size();
  }

  private RowLocation draw() {
    final Location location = pools.pick(CuratedPools.locations());
    final String postalCode = location.postalPrefix() + "%03d".formatted(random.nextInt(1000));
    final String street1 = (10 + random.nextInt(9990)) + " " + faker.address().streetName();
    final String street2 =
        switch (random.nextInt(3)) {
          case 0 -> null;
          case 1 -> "Apt " + (1 + random.nextInt(999));
          default -> "Suite " + (100 + random.nextInt(1900));
        };
    return new RowLocation(location, postalCode, street1, street2);
  }
}
