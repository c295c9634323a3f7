/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import static com.luisppb16.oltpseed.Fixtures.TODAY;
import static com.luisppb16.oltpseed.Fixtures.col;
import static com.luisppb16.oltpseed.Fixtures.fk;
import static com.luisppb16.oltpseed.Fixtures.ids;
import static com.luisppb16.oltpseed.Fixtures.nullable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.oltpseed.Fixtures;
import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.model.TypeFamily;
import com.luisppb16.oltpseed.util.SchemaMismatchException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DateRangeExpansionAssemblerTest {

  private final ReferenceKeyPool keys = new ReferenceKeyPool();
  private final DateRangeExpansionAssembler assembler =
      new DateRangeExpansionAssembler("room_id", "room", "night_date", 730, 365);

  private final Table roomNight =
      new Table(
          "room_night",
          List.of(
              col("room_night", "room_id", TypeFamily.INTEGER),
              col("room_night", "night_date", TypeFamily.DATE),
              nullable("room_night", "rate_amount", TypeFamily.NUMERIC)),
          List.of("room_id", "night_date"),
          List.of(fk("room_night", "room_id", "room", "room_id")),
          Set.of());

  @Test
  @DisplayName("Each room gets rowCount / rooms distinct nights inside the window")
  void shouldExpandNightsPerRoom() {
    keys.replace("room", ids(1, 10));

    List<Row> rows = assembler.assemble(roomNight, 95, Fixtures.context(List.of(), keys));

    assertThat(rows).hasSize(90);
    Map<Object, List<Object>> nightsByRoom =
        rows.stream()
            .collect(
                Collectors.groupingBy(
                    r -> r.get("room_id"),
                    Collectors.mapping(r -> r.get("night_date"), Collectors.toList())));
    assertThat(nightsByRoom).hasSize(10);
    nightsByRoom.values().forEach(nights -> assertThat(nights).hasSize(9).doesNotHaveDuplicates());
    assertThat(rows)
        .allSatisfy(
            r ->
                assertThat((LocalDate) r.get("night_date"))
                    .isAfterOrEqualTo(TODAY.minusDays(730))
                    .isBefore(TODAY.plusDays(365)));
  }

  @Test
  @DisplayName("Fewer rows than rooms still yields exactly the requested rows")
  void shouldStopAtRequestedCount() {
    keys.replace("room", ids(1, 10));

    List<Row> rows = assembler.assemble(roomNight, 4, Fixtures.context(List.of(), keys));

    assertThat(rows).hasSize(4);
    assertThat(rows.stream().map(r -> r.get("room_id"))).doesNotHaveDuplicates();
  }

  @Test
  @DisplayName("Missing columns are a schema error")
  void shouldRejectTablesWithoutDateColumn() {
    keys.replace("room", ids(1, 2));
    Table wrong =
        new Table(
            "room_night",
            List.of(col("room_night", "room_id", TypeFamily.INTEGER)),
            List.of("room_id"),
            List.of(),
            Set.of());

    assertThatThrownBy(() -> assembler.assemble(wrong, 1, Fixtures.context(List.of(), keys)))
        .isInstanceOf(SchemaMismatchException.class);
  }

  @Test
  @DisplayName("Offsets are sampled without replacement for sparse and dense requests")
  void shouldSampleDistinctOffsets() {
    Random random = new Random(5);

    assertThat(DateRangeExpansionAssembler.sampleOffsets(random, 1095, 30)).hasSize(30);
    assertThat(DateRangeExpansionAssembler.sampleOffsets(random, 10, 10))
        .containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
  }
}
