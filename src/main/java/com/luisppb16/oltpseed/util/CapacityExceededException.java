/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.util;

/**
 * Thrown before any row of a table is emitted when the requested row count exceeds the number
 * of distinct values or pairs its constraints allow.
 */
public class CapacityExceededException extends SeedException {

  private final long requested;
  private final long available;

  public CapacityExceededException(String subject, long requested, long available) {
    super("Requested %d %s but only %d distinct values are available."
        .formatted(requested, subject, available));
    this.requested = requested;
    this.available = available;
  }

  public long getRequested() {
    return requested;
  }

  public long getAvailable() {
    return available;
  }
}
