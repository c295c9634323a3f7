/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import static com.luisppb16.oltpseed.Fixtures.col;
import static com.luisppb16.oltpseed.Fixtures.fk;
import static com.luisppb16.oltpseed.Fixtures.ids;
import static com.luisppb16.oltpseed.Fixtures.nullable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.ForeignKey;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.CapacityExceededException;
import com.luisppb16.oltpseed.util.MissingParentKeysException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ForeignKeyResolverTest {

  private final ReferenceKeyPool keys = new ReferenceKeyPool();
  private ForeignKeyResolver resolver;

  private final ForeignKey bookingFk = fk("invoice", "booking_id", "booking", "booking_id");

  @BeforeEach
  void setUp() {
    resolver = new ForeignKeyResolver(keys, new Random(1));
  }

  @Test
  @DisplayName("Plain foreign keys sample from the parent pool")
  void shouldSampleFromParentPool() {
    keys.replace("booking", ids(1, 5));
    Column column = col("invoice", "booking_id", TypeFamily.INTEGER);
    Table invoice = invoice(column, Set.of());

    for (int i = 0; i < 100; i++) {
      assertThat(resolver.resolve(invoice, bookingFk, column, 100)).isIn(ids(1, 5).toArray());
    }
  }

  @Test
  @DisplayName("Unique foreign keys use every parent at most once")
  void shouldAssignUniqueForeignKeysOneToOne() {
    keys.replace("BOOKING", ids(1, 10));
    Column column = col("invoice", "booking_id", TypeFamily.INTEGER);
    Table invoice = invoice(column, Set.of("booking_id"));

    List<Object> assigned = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      assigned.add(resolver.resolve(invoice, bookingFk, column, 10));
    }

    assertThat(assigned).doesNotHaveDuplicates().containsExactlyInAnyOrderElementsOf(ids(1, 10));
  }

  @Test
  @DisplayName("A non-nullable unique foreign key with too few parents is a capacity error")
  void shouldRejectShortOneToOnePool() {
    keys.replace("booking", ids(1, 3));
    Column column = col("invoice", "booking_id", TypeFamily.INTEGER);
    Table invoice = invoice(column, Set.of("booking_id"));

    assertThatThrownBy(() -> resolver.resolve(invoice, bookingFk, column, 4))
        .isInstanceOfSatisfying(
            CapacityExceededException.class,
            e -> {
              assertThat(e.getRequested()).isEqualTo(4);
              assertThat(e.getAvailable()).isEqualTo(3);
            });
  }

  @Test
  @DisplayName("A nullable unique foreign key runs out into nulls")
  void shouldFallBackToNullWhenNullableOneToOneRunsOut() {
    keys.replace("booking", ids(1, 2));
    Column column = nullable("invoice", "booking_id", TypeFamily.INTEGER);
    Table invoice = invoice(column, Set.of("booking_id"));

    resolver.resolve(invoice, bookingFk, column, 3);
    resolver.resolve(invoice, bookingFk, column, 3);
    assertNull(resolver.resolve(invoice, bookingFk, column, 3));
  }

  @Test
  @DisplayName("An empty parent pool fails for required columns and yields null otherwise")
  void shouldHandleMissingParents() {
    Column required = col("invoice", "booking_id", TypeFamily.INTEGER);
    Column optional = nullable("invoice", "booking_id", TypeFamily.INTEGER);

    assertThatThrownBy(() -> resolver.resolve(invoice(required, Set.of()), bookingFk, required, 1))
        .isInstanceOf(MissingParentKeysException.class)
        .hasMessageContaining("booking");
    assertNull(resolver.resolve(invoice(optional, Set.of()), bookingFk, optional, 1));
  }

  @Test
  @DisplayName("A foreign key that is the whole primary key is treated as one-to-one")
  void shouldTreatSharedPrimaryKeyAsOneToOne() {
    Column column = col("guest_profile", "guest_id", TypeFamily.INTEGER);
    Table profile =
        new Table("guest_profile", List.of(column), List.of("guest_id"), List.of(), Set.of());

    assertThat(ForeignKeyResolver.isOneToOne(profile, column)).isTrue();
  }

  private Table invoice(Column bookingColumn, Set<String> uniques) {
    return new Table(
        "invoice",
        List.of(col("invoice", "invoice_id", TypeFamily.INTEGER), bookingColumn),
        List.of("invoice_id"),
        List.of(bookingFk),
        uniques);
  }
}
