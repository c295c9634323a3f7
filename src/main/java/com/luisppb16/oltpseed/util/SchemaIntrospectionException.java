/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.util;

/**
 * Thrown when the target schema cannot be read from the database catalogs. Introspection is
 * never retried.
 */
public class SchemaIntrospectionException extends SeedException {

  public SchemaIntrospectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
