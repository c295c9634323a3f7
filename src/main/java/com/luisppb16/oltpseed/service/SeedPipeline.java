/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.service;

import com.luisppb16.oltpseed.config.GenerationConfig;
import com.luisppb16.oltpseed.config.RowCountPlan;
import com.luisppb16.oltpseed.db.CsvTableWriter;
import com.luisppb16.oltpseed.db.ReferenceKeyPool;
import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.SchemaIntrospector;
import com.luisppb16.oltpseed.db.TopologicalSorter;
import com.luisppb16.oltpseed.db.TopologicalSorter.SortResult;
import com.luisppb16.oltpseed.db.dialect.DatabaseDialect;
import com.luisppb16.oltpseed.db.dialect.DialectFactory;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.db.generator.assembler.TableAssemblerRegistry;
import com.luisppb16.oltpseed.model.SchemaSnapshot;
import com.luisppb16.oltpseed.model.Table;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one seeding pass over a schema on a single connection.
 *
 * <p>Introspect, order tables parents-first, plan row counts, optionally empty the tables, then
 * for each table in order: assemble rows, write the CSV, bulk load it and re-read the generated
 * primary keys so child tables reference real values. Any failure aborts the run; tables
 * loaded before it stay loaded.
 */
@Slf4j
public final class SeedPipeline {

  private final Connection conn;
  private final GenerationConfig config;
  private final TableAssemblerRegistry assemblers;
  private final Clock clock;

  public SeedPipeline(
      final Connection conn,
      final GenerationConfig config,
      final TableAssemblerRegistry assemblers,
      final Clock clock) {
    this.conn = Objects.requireNonNull(conn, "Connection cannot be null");
    this.config = Objects.requireNonNull(config, "Config cannot be null");
    this.assemblers = Objects.requireNonNull(assemblers, "Assembler registry cannot be null");
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  public SeedPipeline(final Connection conn, final GenerationConfig config) {
    this(conn, config, TableAssemblerRegistry.defaults(), Clock.systemUTC());
  }

  public SeedReport run() {
    final long started = System.nanoTime();

    final SchemaSnapshot snapshot = SchemaIntrospector.introspect(conn, config.schema());
    final SortResult sort = TopologicalSorter.sort(snapshot.tables());
    sort.cycles()
        .forEach(
            cycle ->
                log.warn(
                    "Foreign-key cycle among {}; these tables are loaded in name order", cycle));

    final List<Table> loadOrder =
        sort.ordered().stream().map(name -> snapshot.table(name).orElseThrow()).toList();
    final RowCountPlan plan = RowCountPlan.of(sort.ordered(), config.rowCountOverrides());
    final DatabaseDialect dialect = DialectFactory.resolve(conn);
    final String schema = snapshot.schema();
    final Path outDir = config.outputDir();

    log.info(
        "Schema {}: {} tables, {} enum types, CSV output in {}",
        schema,
        snapshot.tables().size(),
        snapshot.enums().size(),
        outDir.toAbsolutePath());

    if (Boolean.TRUE.equals(config.truncateFirst())) {
      dialect.truncate(conn, schema, loadOrder);
    }

    final ReferenceKeyPool keys = new ReferenceKeyPool();
    final GenerationContext context = new GenerationContext(snapshot, keys, config.seed(), clock);
    final Map<String, Long> loaded = new LinkedHashMap<>();

    for (final Table table : loadOrder) {
      if (table.columns().isEmpty()) {
        log.warn("{}: no columns, skipped", table.name());
        continue;
      }
      final int planned = plan.countFor(table.name());
      if (planned <= 0) {
        log.warn("{}: planned row count is {}, skipped", table.name(), planned);
        continue;
      }

      log.info("{}: generating {} rows", table.name(), planned);
      final List<Row> rows = assemblers.forTable(table.name()).assemble(table, planned, context);
      log.info("{}: synthesized {} rows", table.name(), rows.size());

      final Path csv = CsvTableWriter.write(table, rows, outDir);
      final long count = dialect.bulkLoad(conn, schema, table, rows, csv);
      log.info("{}: loaded {} rows", table.name(), count);
      loaded.put(table.name(), count);

      if (table.singlePrimaryKey().isPresent()) {
        keys.replace(table.name(), dialect.readPrimaryKeys(conn, schema, table));
      }
    }

    final Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    final SeedReport report = new SeedReport(loaded, sort.cycles(), elapsed);
    log.info(
        "Loaded {} rows into {} tables in {} s",
        report.totalRows(),
        loaded.size(),
        elapsed.toMillis() / 1000.0);
    return report;
  }
}
