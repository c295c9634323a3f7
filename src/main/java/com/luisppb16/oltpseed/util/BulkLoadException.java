/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.util;

/** Thrown when truncating, writing the CSV artifact for, or bulk loading a table fails. */
public class BulkLoadException extends SeedException {

  public BulkLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
