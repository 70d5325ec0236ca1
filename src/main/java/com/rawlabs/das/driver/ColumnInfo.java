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

import java.util.Objects;

/** Describes one column of a result: its name, the driver's type name, and nullability. */
public final class ColumnInfo {
  private final String name;
  private final String typeName;
  private final boolean nullable;

  public ColumnInfo(String name, String typeName, boolean nullable) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
    this.nullable = nullable;
  }

  public String getName() {
    return name;
  }

  public String getTypeName() {
    return typeName;
  }

  public boolean isNullable() {
    return nullable;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnInfo)) {
      return false;
    }
    ColumnInfo other = (ColumnInfo) o;
    return nullable == other.nullable && name.equals(other.name) && typeName.equals(other.typeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeName, nullable);
  }

  @Override
  public String toString() {
    return name + " " + typeName + (nullable ? " NULL" : " NOT NULL");
  }
}
