/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.dialect;

import com.luisppb16.oltpseed.util.BulkLoadException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import lombok.experimental.UtilityClass;

/** Picks the dialect from the connected database's product name. */
@UtilityClass
public class DialectFactory {

  public static DatabaseDialect resolve(final String productName) {
    if (Objects.nonNull(productName)
        && productName.toLowerCase(Locale.ROOT).contains("postgres")) {
      return new PostgreSqlDialect();
    }
    return new StandardDialect();
  }

  public static DatabaseDialect resolve(final Connection conn) {
    try {
      return resolve(conn.getMetaData().getDatabaseProductName());
    } catch (final SQLException e) {
      throw new BulkLoadException("Could not read the database product name", e);
    }
  }
}
