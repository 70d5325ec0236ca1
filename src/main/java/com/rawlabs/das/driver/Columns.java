/*
 * Copyright 2024 RAW Labs S.A.
 *
 * Use of this software is governed by the Business Source License
 * included in the file licenses/BSL.txt.
 *
 * As of the Change Date specified in that file, in accordance with
 * the Business Source License, use of this software will be governed
 * by the Apache License, Version 2.0, included in the file
 * licenses/APL.txt.
 */

package com.rawlabs.das.driver;

import java.nio.ByteBuffer;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/** Helpers for drivers that only learn about their columns from the first record they read. */
public final class Columns {

  private Columns() {}

  /**
   * Derive column info from a plain record, in the record's key order. All columns are
   * non-nullable unless the value itself is null, in which case the type name is "unknown".
   *
   * @param record a sample record
   * @return one column per key
   */
  public static List<ColumnInfo> infer(Map<String, ?> record) {
    List<ColumnInfo> cols = new ArrayList<>(record.size());
    for (Map.Entry<String, ?> entry : record.entrySet()) {
      Object v = entry.getValue();
      cols.add(new ColumnInfo(entry.getKey(), typeName(v), v == null));
    }
    return cols;
  }

  static String typeName(Object v) {
    if (v == null) {
      return "unknown";
    }
    if (v instanceof CharSequence || v instanceof Character) {
      return "string";
    }
    if (v instanceof Number) {
      return "number";
    }
    if (v instanceof Boolean) {
      return "boolean";
    }
    if (v instanceof Date || v instanceof Temporal) {
      return "datetime";
    }
    if (v instanceof byte[] || v instanceof ByteBuffer) {
      return "binary";
    }
    return "object";
  }
}
