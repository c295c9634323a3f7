/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.oltpseed.db.generator.assembler;

import com.luisppb16.oltpseed.db.Row;
import com.luisppb16.oltpseed.db.generator.GenerationContext;
import com.luisppb16.oltpseed.model.Table;
import java.util.List;

/** Builds the rows of one table, honouring its keys and constraints. */
@FunctionalInterface
public interface TableAssembler {

  /**
   * @param rowCount rows requested; an assembler may return fewer only when the data cannot
   *     support more, and never more
   */
  List<Row> assemble(Table table, int rowCount, GenerationContext context);
}
