/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db;

import com.luisppb16.oltpseed.model.Table;
import com.luisppb16.oltpseed.util.BulkLoadException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes one table's rows as {@code <table>.csv}: a header of column names, then one line per
 * row in column order. Fields are quoted per RFC 4180 when needed; {@code null} is an empty
 * unquoted field and the empty string is {@code ""}, which is how PostgreSQL's CSV format tells
 * them apart.
 */
@Slf4j
@UtilityClass
public class CsvTableWriter {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

  public static Path write(final Table table, final List<Row> rows, final Path outDir) {
    final Path file = outDir.resolve(table.name() + ".csv");
    try {
      Files.createDirectories(outDir);
      try (final BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
        writeLine(out, table.columnNames().stream().map(n -> (Object) n).toList());
        for (final Row row : rows) {
          writeLine(out, table.columnNames().stream().map(row::get).toList());
        }
      }
    } catch (final IOException e) {
      throw new BulkLoadException("Could not write " + file, e);
    }
    log.debug("{}: wrote {} rows to {}", table.name(), rows.size(), file);
    return file;
  }

  private static void writeLine(final Writer out, final List<Object> fields) throws IOException {
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        out.write(',');
      }
      out.write(field(fields.get(i)));
    }
    out.write("\r\n");
  }

  static String field(final Object value) {
    if (Objects.isNull(value)) {
      return "";
    }
    final String text = format(value);
    if (text.isEmpty()
        || text.indexOf(',') >= 0
        || text.indexOf('"') >= 0
        || text.indexOf('\n') >= 0
        || text.indexOf('\r') >= 0) {
      return '"' + text.replace("\"", "\"\"") + '"';
    }
    return text;
  }

  static String format(final Object value) {
    if (value instanceof OffsetDateTime t) {
      return TIMESTAMP.format(t);
    }
    if (value instanceof BigDecimal d) {
      return d.toPlainString();
    }
    return value.toString();
  }
}
