/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.util;

/**
 * Thrown when a table lacks the columns its assembler depends on, or when a column refers to an
 * enumerated type that is not in the catalog.
 */
public class SchemaMismatchException extends SeedException {

  public SchemaMismatchException(String message) {
    super(message);
  }
}
