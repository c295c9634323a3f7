/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.model.EnumCatalog;
import com.luisppb16.oltpseed.model.SchemaSnapshot;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;
import lombok.Getter;
import net.datafaker.Faker;

/**
 * Run-scoped state shared by every table assembler. All randomness flows from one seeded
 * {@link Random}, which also backs the {@link Faker}.
 */
@Getter
public final class GenerationContext {

  private final SchemaSnapshot snapshot;
  private final ReferenceKeyPool keys;
  private final Random random;
  private final Faker faker;
  private final UniqueValueRegistry registry;
  private final UniquenessStrategy uniqueness;
  private final CuratedPools pools;
  private final LocationCache locations;
  private final ValueGenerator values;
  private final ForeignKeyResolver foreignKeys;

  public GenerationContext(
      final SchemaSnapshot snapshot,
      final ReferenceKeyPool keys,
      final long seed,
      final Clock clock) {
    this.snapshot = Objects.requireNonNull(snapshot, "Snapshot cannot be null");
    this.keys = Objects.requireNonNull(keys, "Key pool cannot be null");
    this.random = new Random(seed);
    this.faker = new Faker(random);
    this.registry = new UniqueValueRegistry();
    this.uniqueness = new UniquenessStrategy(registry, random);
    this.pools = new CuratedPools(random);
    this.locations = new LocationCache(pools, random, faker);
    this.values =
        new ValueGenerator(snapshot.enums(), random, faker, uniqueness, locations, pools, clock);
    this.foreignKeys = new ForeignKeyResolver(keys, random);
  }

  public GenerationContext(
      final SchemaSnapshot snapshot, final ReferenceKeyPool keys, final long seed) {
    this(snapshot, keys, seed, Clock.systemUTC());
  }

  public EnumCatalog enums() {
    return snapshot.enums();
  }
}
