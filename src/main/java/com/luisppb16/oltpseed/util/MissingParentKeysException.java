/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.util;

/** Thrown when a table needs keys from a parent table that has none loaded. */
public class MissingParentKeysException extends SeedException {

  private final String table;
  private final String parentTable;

  public MissingParentKeysException(String table, String parentTable, String detail) {
    super("Table %s needs %s keys loaded first: %s".formatted(table, parentTable, detail));
    this.table = table;
    this.parentTable = parentTable;
  }

  public String getTable() {
    return table;
  }

  public String getParentTable() {
    return parentTable;
  }
}
