/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import static com.luisppb16.oltpseed.Fixtures.col;
import static com.luisppb16.oltpseed.Fixtures.fk;
import static com.luisppb16.oltpseed.Fixtures.ids;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.oltpseed.Fixtures;
import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.generator.assembler.JunctionTableAssembler.Side;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.CapacityExceededException;
import com.luisppb16.oltpseed.util.MissingParentKeysException;
import com.luisppb16.oltpseed.util.SchemaMismatchException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JunctionTableAssemblerTest {

  private final ReferenceKeyPool keys = new ReferenceKeyPool();

  private final Table bookingRoom =
      new Table(
          "booking_room",
          List.of(
              col("booking_room", "booking_id", TypeFamily.INTEGER),
              col("booking_room", "room_id", TypeFamily.INTEGER)),
          List.of("booking_id", "room_id"),
          List.of(
              fk("booking_room", "booking_id", "booking", "booking_id"),
              fk("booking_room", "room_id", "room", "room_id")),
          Set.of());

  private final JunctionTableAssembler assembler =
      new JunctionTableAssembler(
          Side.of("booking", "booking_id"), Side.of("room", "room_id"), 1, 3);

  @Test
  @DisplayName("Pairs are unique and reference loaded parents")
  void shouldProduceDistinctPairs() {
    keys.replace("booking", ids(1, 100));
    keys.replace("room", ids(1, 20));

    List<Row> rows = assembler.assemble(bookingRoom, 250, Fixtures.context(List.of(), keys));

    assertThat(rows).hasSize(250);
    assertThat(rows.stream().map(r -> List.of(r.get("booking_id"), r.get("room_id"))))
        .doesNotHaveDuplicates();
    assertThat(rows).allSatisfy(r -> assertThat(r.get("room_id")).isIn(ids(1, 20).toArray()));
  }

  @Test
  @DisplayName("Requesting the whole cartesian product fills it exactly")
  void shouldFillTheWholeProduct() {
    keys.replace("booking", ids(1, 3));
    keys.replace("room", ids(1, 3));

    List<Row> rows = assembler.assemble(bookingRoom, 9, Fixtures.context(List.of(), keys));

    assertThat(rows).hasSize(9);
    assertThat(rows.stream().map(r -> List.of(r.get("booking_id"), r.get("room_id"))))
        .doesNotHaveDuplicates();
  }

  @Test
  @DisplayName("Ten rows over three by three parents exceed the available pairs")
  void shouldRejectRequestsBeyondCapacity() {
    keys.replace("booking", ids(1, 3));
    keys.replace("room", ids(1, 3));

    assertThatThrownBy(
            () -> assembler.assemble(bookingRoom, 10, Fixtures.context(List.of(), keys)))
        .isInstanceOfSatisfying(
            CapacityExceededException.class,
            e -> {
              assertThat(e.getRequested()).isEqualTo(10);
              assertThat(e.getAvailable()).isEqualTo(9);
            });
  }

  @Test
  @DisplayName("Alternative column names are accepted, missing ones are a schema error")
  void shouldResolveColumnCandidates() {
    Table bookingDiscount =
        new Table(
            "booking_discount",
            List.of(
                col("booking_discount", "booking_id", TypeFamily.INTEGER),
                col("booking_discount", "promo_id", TypeFamily.INTEGER)),
            List.of("booking_id", "promo_id"),
            List.of(),
            Set.of());
    JunctionTableAssembler discounts =
        new JunctionTableAssembler(
            Side.of("booking", "booking_id"),
            Side.of("promotion", "promotion_id", "promo_id"),
            0,
            2);
    keys.replace("booking", ids(1, 50));
    keys.replace("promotion", ids(1, 5));

    assertThat(discounts.assemble(bookingDiscount, 40, Fixtures.context(List.of(), keys)))
        .hasSize(40);

    JunctionTableAssembler reviews =
        new JunctionTableAssembler(
            Side.of("review", "review_id"), Side.of("review_category", "category_id"), 1, 5);
    assertThatThrownBy(
            () -> reviews.assemble(bookingDiscount, 1, Fixtures.context(List.of(), keys)))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("review_id");
  }

  @Test
  @DisplayName("Missing parent keys fail the table")
  void shouldFailWithoutParents() {
    keys.replace("booking", ids(1, 5));

    assertThatThrownBy(
            () -> assembler.assemble(bookingRoom, 1, Fixtures.context(List.of(), keys)))
        .isInstanceOf(MissingParentKeysException.class)
        .hasMessageContaining("room");
  }

  @Test
  @DisplayName("An empty fan-out range is rejected")
  void shouldRejectInvalidFanOut() {
    assertThatThrownBy(
            () -> new JunctionTableAssembler(Side.of("a", "a_id"), Side.of("b", "b_id"), 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
