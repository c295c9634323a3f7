/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import static com.luisppb16.oltpseed.Fixtures.CLOCK;
import static com.luisppb16.oltpseed.Fixtures.col;
import static com.luisppb16.oltpseed.Fixtures.enumCol;
import static com.luisppb16.oltpseed.Fixtures.fk;
import static com.luisppb16.oltpseed.Fixtures.ids;
import static com.luisppb16.oltpseed.Fixtures.nullable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.luisppb16.oltpseed.Fixtures;
import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.db.generator.assembler.StatusLifecycleAssembler.Scenario;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.CapacityExceededException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StatusLifecycleAssemblerTest {

  private final ReferenceKeyPool keys = new ReferenceKeyPool();
  private final StatusLifecycleAssembler assembler =
      new StatusLifecycleAssembler(
          "actual_checkin_at", "actual_checkout_at", "stay_status", "status");

  private final Table stay =
      new Table(
          "stay",
          List.of(
              col("stay", "stay_id", TypeFamily.INTEGER),
              col("stay", "booking_id", TypeFamily.INTEGER),
              enumCol("stay", "stay_status", "stay_status", false),
              nullable("stay", "actual_checkin_at", TypeFamily.TIMESTAMP),
              nullable("stay", "actual_checkout_at", TypeFamily.TIMESTAMP)),
          List.of("stay_id"),
          List.of(fk("stay", "booking_id", "booking", "booking_id")),
          Set.of("booking_id"));

  private GenerationContext context() {
    return Fixtures.context(
        List.of(stay),
        Fixtures.enums("stay_status", "CANCELLED", "CHECKED_OUT", "CHECKED_IN"),
        keys);
  }

  @Test
  @DisplayName("Timestamps follow the status and checkout never precedes checkin")
  void shouldFollowStatusScenarios() {
    keys.replace("booking", ids(1, 1000));
    OffsetDateTime now = OffsetDateTime.now(CLOCK);

    List<Row> rows = assembler.assemble(stay, 1000, context());

    assertThat(rows).hasSize(1000);
    for (Row row : rows) {
      OffsetDateTime in = (OffsetDateTime) row.get("actual_checkin_at");
      OffsetDateTime out = (OffsetDateTime) row.get("actual_checkout_at");
      switch ((String) row.get("stay_status")) {
        case "CANCELLED" -> {
          assertThat(in).isNull();
          assertThat(out).isNull();
        }
        case "CHECKED_IN" -> {
          assertThat(in).isNotNull().isBetween(now.minusDays(181), now);
          assertThat(out).isNull();
        }
        default -> {
          assertThat(in).isNotNull();
          assertThat(out).isAfter(in).isBefore(in.plusDays(11));
        }
      }
    }
    assertThat(rows.stream().map(r -> r.get("stay_status")))
        .contains("CANCELLED", "CHECKED_OUT", "CHECKED_IN");
  }

  @Test
  @DisplayName("A unique booking reference is assigned one to one")
  void shouldAssignBookingsOneToOne() {
    keys.replace("booking", ids(1, 300));

    List<Row> rows = assembler.assemble(stay, 300, context());

    assertThat(rows.stream().map(r -> r.get("booking_id")))
        .doesNotHaveDuplicates()
        .containsExactlyInAnyOrderElementsOf(ids(1, 300));
  }

  @Test
  @DisplayName("More stays than bookings is a capacity error")
  void shouldRejectMoreStaysThanBookings() {
    keys.replace("booking", ids(1, 5));

    assertThatThrownBy(() -> assembler.assemble(stay, 6, context()))
        .isInstanceOf(CapacityExceededException.class);
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "CANCELLED, CANCELLED",
    "cancel_requested, CANCELLED",
    "CHECKED_OUT, CHECKED_OUT",
    "CHECKED_IN, CHECKED_IN",
    "NO_SHOW, NONE",
    "CONFIRMED, NONE"
  })
  @DisplayName("Scenarios are chosen by label content")
  void shouldClassifyLabels(String label, Scenario expected) {
    assertEquals(expected, Scenario.of(label));
  }
}
