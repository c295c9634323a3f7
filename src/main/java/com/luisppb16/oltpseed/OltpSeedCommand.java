/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed;

import com.luisppb16.oltpseed.config.GenerationConfig;
import com.luisppb16.oltpseed.config.RowCountPlanLoader;
import com.luisppb16.oltpseed.service.SeedPipeline;
import com.luisppb16.oltpseed.service.SeedReport;
import com.luisppb16.oltpseed.util.SeedException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Command-line entry point: seeds one schema and exits 0 on success, 1 on failure. */
@Slf4j
@Command(
    name = "oltp-seed",
    mixinStandardHelpOptions = true,
    version = "oltp-seed 1.0.0",
    description = "Fills a relational schema with synthetic rows that satisfy its constraints.")
public class OltpSeedCommand implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  @Option(names = "--url", required = true, description = "JDBC url of the target database.")
  String url;

  @Option(names = "--user", description = "Database user.")
  String user;

  @Option(
      names = "--password",
      arity = "0..1",
      interactive = true,
      description = "Database password; prompted for when given without a value.")
  String password;

  @Option(
      names = "--schema",
      defaultValue = GenerationConfig.DEFAULT_SCHEMA,
      description = "Schema to seed (default: ${DEFAULT-VALUE}).")
  String schema;

  @Option(
      names = "--out-dir",
      defaultValue = "data/seed",
      description = "Directory for the per-table CSV files (default: ${DEFAULT-VALUE}).")
  Path outDir;

  @Option(
      names = "--row-counts",
      description = "JSON file of table name to row count, replacing the bundled overrides.")
  Path rowCounts;

  @Option(
      names = "--seed",
      defaultValue = "42",
      description = "Random seed (default: ${DEFAULT-VALUE}).")
  long seed;

  @Option(names = "--no-truncate", description = "Keep existing rows instead of emptying tables.")
  boolean noTruncate;

  public static void main(final String[] args) {
    System.exit(new CommandLine(new OltpSeedCommand()).execute(args));
  }

  @Override
  public Integer call() {
    try {
      final GenerationConfig config = toConfig();
      try (final Connection conn =
          DriverManager.getConnection(config.url(), config.user(), config.password())) {
        conn.setAutoCommit(true);
        final SeedReport report = new SeedPipeline(conn, config).run();
        log.info("Done: {} rows in {} tables", report.totalRows(), report.loaded().size());
      }
      return EXIT_OK;
    } catch (final SeedException | SQLException e) {
      log.error("Seeding failed: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  GenerationConfig toConfig() {
    final Map<String, Integer> overrides =
        rowCounts != null ? RowCountPlanLoader.fromFile(rowCounts) : RowCountPlanLoader.bundled();
    return GenerationConfig.builder()
        .url(url)
        .user(user)
        .password(password)
        .schema(schema)
        .outputDir(outDir)
        .truncateFirst(!noTruncate)
        .seed(seed)
        .rowCountOverrides(overrides)
        .build();
  }
}
