/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.luisppb16.oltpseed.db.generator.LocationCache.RowLocation;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.EnumCatalog;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.SchemaMismatchException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import net.datafaker.Faker;

/**
 * Synthesizes one column value from the column's type family and name.
 *
 * <p>The first matching rule wins: enum labels, audit timestamps, dates and timestamps, integers,
 * UUIDs, booleans, numerics, then text. Text columns are matched by name against geographic
 * fields (consistent per row through {@link LocationCache}), a few hotel-domain fields, and
 * unique tokens; everything else becomes lorem text sized to the column. Integers are always
 * {@link Long}, numerics {@link BigDecimal}, timestamps UTC {@link OffsetDateTime}.
 */
public final class ValueGenerator {

  static final double ENUM_NULL_PROBABILITY = 0.03;
  static final double FLAG_TRUE_PROBABILITY = 0.85;
  static final int UPDATE_DRIFT_DAYS = 180;
  private static final int DEFAULT_SCALE = 2;
  private static final long TWO_YEARS_SECONDS = 2L * 365 * 24 * 3600;

  private static final Set<String> AUDIT_TIMESTAMPS =
      Set.of("created_at", "updated_at", "loaded_at", "ingested_at");
  private static final Set<String> GEO_FIELDS =
      Set.of(
          "city", "state", "country", "postal_code", "zipcode", "zip",
          "address_line1", "address_line2", "street", "street1", "street2");
  private static final Set<String> PROMOTION_DISCOUNTS =
      Set.of("value", "discount_value", "discount_amount", "discount");
  private static final List<String> RATING_HINTS = List.of("rating", "stars", "score");
  private static final List<String> SMALL_COUNT_HINTS =
      List.of("count", "qty", "quantity", "nights", "floor", "occupancy");
  private static final List<String> MONEY_HINTS =
      List.of("amount", "price", "rate", "cost", "fee", "total", "tax");
  private static final Set<String> STATE_CODES = Set.of("state_code", "state_abbr");
  private static final List<String> CURRENCIES = List.of("USD", "INR");

  private final EnumCatalog enums;
  private final Random random;
  private final Faker faker;
  private final UniquenessStrategy uniqueness;
  private final LocationCache locations;
  private final CuratedPools pools;
  private final Clock clock;

  public ValueGenerator(
      final EnumCatalog enums,
      final Random random,
      final Faker faker,
      final UniquenessStrategy uniqueness,
      final LocationCache locations,
      final CuratedPools pools,
      final Clock clock) {
    this.enums = Objects.requireNonNull(enums, "Enum catalog cannot be null");
    this.random = Objects.requireNonNull(random, "Random cannot be null");
    this.faker = Objects.requireNonNull(faker, "Faker cannot be null");
    this.uniqueness = Objects.requireNonNull(uniqueness, "Uniqueness strategy cannot be null");
    this.locations = Objects.requireNonNull(locations, "Location cache cannot be null");
    this.pools = Objects.requireNonNull(pools, "Pools cannot be null");
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  public Object generate(final Column column, final int ordinal) {
    final String name = column.key();

    if (column.type() == TypeFamily.ENUM) {
      if (column.nullable() && random.nextDouble() < ENUM_NULL_PROBABILITY) {
        return null;
      }
      return enumLabel(column);
    }

    if (column.type() == TypeFamily.TIMESTAMP && AUDIT_TIMESTAMPS.contains(name)) {
      final OffsetDateTime base = timestampWithinTwoYears();
      return "updated_at".equals(name) ? updatedAfter(base) : base;
    }

    return switch (column.type()) {
      case DATE -> dateBetween(today().minusYears(2), today().plusYears(1));
      case TIMESTAMP -> timestampWithinTwoYears();
      case INTEGER -> integer(column, ordinal);
      case UUID -> randomUuid();
      case BOOLEAN -> random.nextDouble() < (isFlag(name) ? FLAG_TRUE_PROBABILITY : 0.5);
      case NUMERIC -> numeric(column);
      case TEXT -> text(column, ordinal);
      default -> null;
    };
  }

  /**
   * Whether {@link #generate} already registers this column's values as unique tokens, so
   * callers must not pass them through the uniqueness strategy a second time.
   */
  public boolean producesUniqueTokens(final Column column) {
    if (column.type() != TypeFamily.TEXT) {
      return false;
    }
    final String name = column.key();
    if (isGeographic(name) || isHotelName(column) || isRoomTypeName(column)) {
      return false;
    }
    if (Set.of("phone", "phone_number", "currency", "currency_code", "state_code", "state_abbr")
        .contains(name)) {
      return false;
    }
    return "email".equals(name) || isTokenName(name);
  }

  /**
   * Whether the value is tied to the row's location, so regenerating it must keep the row's
   * ordinal instead of drawing another row's location.
   */
  public boolean anchoredToRow(final Column column) {
    if (column.type() != TypeFamily.TEXT) {
      return false;
    }
    final String name = column.key();
    return isGeographic(name) || isHotelName(column) || STATE_CODES.contains(name);
  }

  public String enumLabel(final Column column) {
    final List<String> labels = enumLabels(column);
    return labels.get(random.nextInt(labels.size()));
  }

  public List<String> enumLabels(final Column column) {
    if (!enums.contains(column.enumType()) || enums.labelsOf(column.enumType()).isEmpty()) {
      throw new SchemaMismatchException(
          "Column %s.%s uses enum type %s, which has no labels in the catalog"
              .formatted(column.table(), column.name(), column.enumType()));
    }
    return enums.labelsOf(column.enumType());
  }

  public LocalDate today() {
    return LocalDate.now(clock.withZone(ZoneOffset.UTC));
  }

  public OffsetDateTime now() {
    return OffsetDateTime.now(clock.withZone(ZoneOffset.UTC)).truncatedTo(ChronoUnit.SECONDS);
  }

  public LocalDate dateBetween(final LocalDate from, final LocalDate to) {
    final long span = ChronoUnit.DAYS.between(from, to);
    return from.plusDays(span <= 0 ? 0 : (long) (random.nextDouble() * (span + 1)));
  }

  public OffsetDateTime timestampWithinTwoYears() {
    return now().minusSeconds((long) (random.nextDouble() * TWO_YEARS_SECONDS));
  }

  /** {@code created} plus up to {@value #UPDATE_DRIFT_DAYS} days, never later than now. */
  public OffsetDateTime updatedAfter(final OffsetDateTime created) {
    final OffsetDateTime drifted = created.plusDays(random.nextInt(UPDATE_DRIFT_DAYS + 1));
    final OffsetDateTime now = now();
    if (!drifted.isAfter(now)) {
      return drifted;
    }
    return created.isAfter(now) ? created : now;
  }

  /** A version 4 UUID drawn from the run's seeded random source. */
  public UUID randomUuid() {
    final long most = (random.nextLong() & ~0xF000L) | 0x4000L;
    final long least = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    return new UUID(most, least);
  }

  /** A registry-unique {@code VAL_xxxxxx} token, used as the last resort for text. */
  public String sentinelToken(final Column column, final int ordinal) {
    return (String)
        uniqueness.ensureUnique(
            column,
            ordinal,
            o -> truncate("VAL_%06x".formatted(random.nextInt(0x1000000)), column));
  }

  private Long integer(final Column column, final int ordinal) {
    final String name = column.key();
    if (name.endsWith("_id")) {
      return (long) ordinal;
    }
    final int bound;
    if (RATING_HINTS.stream().anyMatch(name::contains)) {
      bound = 5;
    } else if (SMALL_COUNT_HINTS.stream().anyMatch(name::contains)) {
      bound = 10;
    } else {
      bound = 100_000;
    }
    return 1L + random.nextInt((int) Math.min(bound, maxInteger(column)));
  }

  /** Largest signed value the column's bit width holds; unbounded when the width is unknown. */
  static long maxInteger(final Column column) {
    final int bits = column.precision();
    return bits > 1 && bits < 64 ? (1L << (bits - 1)) - 1 : Long.MAX_VALUE;
  }

  private BigDecimal numeric(final Column column) {
    final String name = column.key();
    final int scale = column.scale() > 0 ? column.scale() : DEFAULT_SCALE;

    final double low;
    final double high;
    if (name.contains("percent") || name.endsWith("pct")) {
      low = 0;
      high = 100;
    } else if (name.contains("ratio") || name.contains("fraction")) {
      low = 0;
      high = 1;
    } else if ("promotion".equals(column.tableKey()) && PROMOTION_DISCOUNTS.contains(name)) {
      low = 5;
      high = 50;
    } else if (MONEY_HINTS.stream().anyMatch(name::contains)) {
      low = 20;
      high = 2000;
    } else {
      low = 0;
      high = 1000;
    }

    BigDecimal value =
        BigDecimal.valueOf(low + random.nextDouble() * (high - low))
            .setScale(scale, RoundingMode.HALF_UP);
    // Stay inside numeric(p, s) when a precision is declared.
    if (column.precision() > scale) {
      final BigDecimal max =
          BigDecimal.TEN
              .pow(column.precision() - scale)
              .subtract(BigDecimal.ONE.movePointLeft(scale));
      value = value.min(max);
    }
    return value;
  }

  private String text(final Column column, final int ordinal) {
    final String name = column.key();

    if (isGeographic(name)) {
      final RowLocation row = locations.forRow(column.tableKey(), ordinal);
      final String value;
      if (name.contains("timezone")) {
        value = row.location().timezone();
      } else {
        value =
            switch (name) {
              case "city" -> row.location().city();
              case "state" -> row.location().state();
              case "country" -> row.location().country();
              case "postal_code", "zipcode", "zip" -> row.postalCode();
              case "address_line1", "street", "street1" -> row.street1();
              default -> Objects.requireNonNullElse(row.street2(), "");
            };
      }
      return truncate(value, column);
    }

    if (isHotelName(column)) {
      final RowLocation row = locations.forRow(column.tableKey(), ordinal);
      return truncate(
          "%s %s %s"
              .formatted(
                  pools.pick(CuratedPools.hotelBrands()),
                  row.location().city(),
                  pools.pick(CuratedPools.HOTEL_SUFFIXES)),
          column);
    }
    if (isRoomTypeName(column)) {
      return truncate(
          pools.drawDistinct(column.tableKey() + "." + name, CuratedPools.roomTypeNames()), column);
    }

    switch (name) {
      case "phone", "phone_number" -> {
        return truncate(faker.phoneNumber().phoneNumber(), column);
      }
      case "currency", "currency_code" -> {
        return truncate(pools.pick(CURRENCIES), column);
      }
      case "state_code", "state_abbr" -> {
        return truncate(locations.forRow(column.tableKey(), ordinal).location().state(), column);
      }
      case "email" -> {
        return (String)
            uniqueness.ensureUnique(
                column, ordinal, o -> truncate(faker.internet().emailAddress(), column));
      }
      default -> {
        // fall through to the generic text rules
      }
    }

    if (isTokenName(name)) {
      return (String)
          uniqueness.ensureUnique(
              column,
              ordinal,
              o ->
                  truncate(
                      "%s_%06x"
                          .formatted(capitalize(faker.lorem().word()), random.nextInt(0x1000000)),
                      column));
    }

    final int maxLength = column.effectiveMaxLength();
    if (maxLength <= 20) {
      return truncate(faker.lorem().word(), column);
    }
    if (maxLength <= 80) {
      return truncate(faker.lorem().sentence(6), column);
    }
    return truncate(faker.lorem().sentence(10), column);
  }

  private static boolean isGeographic(final String name) {
    return GEO_FIELDS.contains(name) || name.contains("timezone");
  }

  private static boolean isHotelName(final Column column) {
    return "hotel".equals(column.tableKey())
        && Set.of("name", "hotel_name").contains(column.key());
  }

  private static boolean isRoomTypeName(final Column column) {
    return "room_type".equals(column.tableKey())
        && Set.of("name", "room_type_name").contains(column.key());
  }

  private static boolean isTokenName(final String name) {
    return name.endsWith("_name") || "name".equals(name) || "code".equals(name);
  }

  private static boolean isFlag(final String name) {
    return name.contains("is_") || name.endsWith("_flag");
  }

  private static String capitalize(final String word) {
    if (word == null || word.isEmpty()) {
      return "Item";
    }
    return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1);
  }

  static String truncate(final String value, final Column column) {
    final int max = column.effectiveMaxLength();
    return value.length() > max ? value.substring(0, max) : value;
  }
}
