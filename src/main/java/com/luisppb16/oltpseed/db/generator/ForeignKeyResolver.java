/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator;

import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.model.Column;
import com.luisppb16.oltpseed.model.ForeignKey;
import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.util.CapacityExceededException;
import com.luisppb16.oltpseed.util.MissingParentKeysException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks parent keys for foreign-key columns from the {@link ReferenceKeyPool}.
 *
 * <p>A foreign key whose column is also unique models a 1:1 relationship: the first request
 * shuffles the parent keys once and later requests consume that queue in order, so no parent is
 * used twice. Every other foreign key samples uniformly.
 */
@Slf4j
public final class ForeignKeyResolver {

  private final ReferenceKeyPool keys;
  private final Random random;
  private final Map<String, Deque<Object>> uniqueFkParentQueues = new HashMap<>();

  public ForeignKeyResolver(final ReferenceKeyPool keys, final Random random) {
    this.keys = Objects.requireNonNull(keys, "Key pool cannot be null");
    this.random = Objects.requireNonNull(random, "Random cannot be null");
  }

  /**
   * Parent key for {@code column} of {@code table}, or {@code null} when the column is nullable
   * and no parent is available.
   *
   * @param rowCount rows planned for {@code table}, used to size 1:1 queues
   */
  public Object resolve(
      final Table table, final ForeignKey fk, final Column column, final int rowCount) {
    final List<Object> parents = keys.keysOf(fk.pkTable());
    if (parents.isEmpty()) {
      if (column.nullable()) {
        return null;
      }
      throw new MissingParentKeysException(
          table.name(), fk.pkTable(), "column %s is not nullable".formatted(column.name()));
    }

    if (isOneToOne(table, column)) {
      final Deque<Object> queue =
          uniqueFkParentQueues.computeIfAbsent(
              queueKey(table, column), k -> shuffledQueue(table, fk, column, parents, rowCount));
      return queue.poll();
    }
    return parents.get(random.nextInt(parents.size()));
  }

  /** A foreign-key column that is unique on its own, or is the whole primary key. */
  public static boolean isOneToOne(final Table table, final Column column) {
    return table.isUnique(column.name())
        || table.singlePrimaryKey().filter(pk -> pk.equalsIgnoreCase(column.name())).isPresent();
  }

  /** Parent keys of {@code parentTable}, failing when none have been loaded. */
  public List<Object> requireParents(final Table table, final String parentTable) {
    final List<Object> parents = keys.keysOf(parentTable);
    if (parents.isEmpty()) {
      throw new MissingParentKeysException(table.name(), parentTable, "no keys loaded");
    }
    return parents;
  }

  private Deque<Object> shuffledQueue(
      final Table table,
      final ForeignKey fk,
      final Column column,
      final List<Object> parents,
      final int rowCount) {
    if (parents.size() < rowCount && !column.nullable()) {
      throw new CapacityExceededException(
          "one-to-one %s.%s values".formatted(table.name(), column.name()),
          rowCount,
          parents.size());
    }
    final List<Object> shuffled = new ArrayList<>(parents);
    Collections.shuffle(shuffled, random);
    log.debug(
        "{}.{}: 1:1 pool of {} {} keys",
        table.name(),
        column.name(),
        shuffled.size(),
        fk.pkTable());
    return new ArrayDeque<>(shuffled.subList(0, Math.min(rowCount, shuffled.size())));
  }

  private static String queueKey(final Table table, final Column column) {
    return (table.name() + "." + column.name()).toLowerCase(Locale.ROOT);
  }
}
