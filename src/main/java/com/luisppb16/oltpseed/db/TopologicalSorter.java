/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db;

import com.luisppb16.oltpseed.model.Table;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Orders tables so that every referenced table comes before the tables referencing it.
 *
 * <p>Kahn's algorithm with a lexicographic tie-break, so the same schema always yields the same
 * order. Tables that never reach in-degree zero (members of a foreign-key cycle and everything
 * depending on one) are appended in lexicographic order; no cycle is broken. Cycles are reported
 * through {@link SortResult#cycles()} using Tarjan's strongly connected components. Self
 * references are ignored for ordering but reported as cycles.
 */
@UtilityClass
public class TopologicalSorter {

  private static final Comparator<String> LEXICOGRAPHIC =
      Comparator.comparing((String s) -> s.toLowerCase(Locale.ROOT))
          .thenComparing(Comparator.naturalOrder());

  public static SortResult sort(List<Table> tables) {

    // Table key -> original name, in input order.
    Map<String, String> names = new LinkedHashMap<>();
    tables.forEach(t -> names.put(t.key(), t.name()));

    // Build a directed graph: parent -> tables that depend on it.
    Map<String, Set<String>> dependents = new LinkedHashMap<>();
    Map<String, Set<String>> parents = new HashMap<>();
    names.keySet().forEach(k -> {
      dependents.put(k, new LinkedHashSet<>());
      parents.put(k, new HashSet<>());
    });

    Set<String> selfLoops = new HashSet<>();
    tables.forEach(
        t ->
            t.foreignKeys()
                .forEach(
                    fk -> {
                      String parent = fk.pkTableKey();
                      if (!names.containsKey(parent)) {
                        return;
                      }
                      if (parent.equals(t.key())) {
                        selfLoops.add(parent);
                        return;
                      }
                      dependents.get(parent).add(t.key());
                      parents.get(t.key()).add(parent);
                    }));

    // Kahn's algorithm, smallest name first.
    Map<String, Integer> inDegree = new HashMap<>();
    parents.forEach((k, v) -> inDegree.put(k, v.size()));

    PriorityQueue<String> queue =
        new PriorityQueue<>(Comparator.<String, String>comparing(names::get, LEXICOGRAPHIC));
    inDegree.forEach((k, deg) -> {
      if (deg == 0) queue.add(k);
    });

    List<String> ordered = new ArrayList<>();
    Set<String> emitted = new HashSet<>();
    while (!queue.isEmpty()) {
      String next = queue.poll();
      ordered.add(names.get(next));
      emitted.add(next);
      dependents
          .get(next)
          .forEach(
              child -> {
                int deg = inDegree.merge(child, -1, Integer::sum);
                if (deg == 0) queue.add(child);
              });
    }

    // Fallback: whatever is left sits on or behind a cycle.
    names.keySet().stream()
        .filter(k -> !emitted.contains(k))
        .map(names::get)
        .sorted(LEXICOGRAPHIC)
        .forEach(ordered::add);

    List<Set<String>> cycles = new ArrayList<>();
    new Tarjan(dependents)
        .run()
        .forEach(
            scc -> {
              if (scc.size() > 1 || selfLoops.contains(scc.iterator().next())) {
                Set<String> named = new LinkedHashSet<>();
                scc.stream().map(names::get).sorted(LEXICOGRAPHIC).forEach(named::add);
                cycles.add(Collections.unmodifiableSet(named));
              }
            });

    return new SortResult(List.copyOf(ordered), List.copyOf(cycles));
  }

  public record SortResult(List<String> ordered, List<Set<String>> cycles) {

    public boolean hasCycles() {
      return !cycles.isEmpty();
    }
  }

  private static final class Tarjan {
    private final Map<String, Set<String>> graph;
    private final Map<String, Integer> indexMap = new HashMap<>();
    private final Map<String, Integer> lowMap = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<Set<String>> result = new ArrayList<>();
    private int index = 0;

    Tarjan(Map<String, Set<String>> graph) {
      this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
    }

    List<Set<String>> run() {
      graph
          .keySet()
          .forEach(
              v -> {
                if (!indexMap.containsKey(v)) strongConnect(v);
              });
      return result;
    }

    private void strongConnect(String v) {
      indexMap.put(v, index);
      lowMap.put(v, index);
      index++;
      stack.push(v);
      onStack.add(v);

      graph
          .getOrDefault(v, Collections.emptySet())
          .forEach(
              w -> {
                if (!indexMap.containsKey(w)) {
                  strongConnect(w);
                  lowMap.put(v, Math.min(lowMap.get(v), lowMap.get(w)));
                } else if (onStack.contains(w)) {
                  lowMap.put(v, Math.min(lowMap.get(v), indexMap.get(w)));
                }
              });

      if (Objects.equals(lowMap.get(v), indexMap.get(v))) {
        Set<String> scc = new LinkedHashSet<>();
        String w;
        do {
          w = stack.pop();
          onStack.remove(w);
          scc.add(w);
        } while (!w.equals(v));
        result.add(Collections.unmodifiableSet(scc));
      }
    }
  }
}
