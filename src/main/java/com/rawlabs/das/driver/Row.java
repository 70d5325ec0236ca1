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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable result row: an ordered list of values together with the names of the fields they
 * belong to. Values may be null.
 */
public final class Row {
  private final List<Object> values;
  private final List<String> fieldNames;

  private Row(List<Object> values, List<String> fieldNames) {
    this.values = values;
    this.fieldNames = fieldNames;
  }

  /**
   * Build a row from positional values.
   *
   * @param values the values, in field order
   * @param fieldNames the field names
   * @return the row
   * @throws IllegalArgumentException if the number of values does not match the number of fields
   */
  public static Row fromArray(List<?> values, List<String> fieldNames) {
    Objects.requireNonNull(values, "values must not be null");
    List<String> names = copyNames(fieldNames);
    if (values.size() != names.size()) {
      throw new IllegalArgumentException(
          "Row has " + values.size() + " values but " + names.size() + " fields");
    }
    return new Row(Collections.unmodifiableList(new ArrayList<>(values)), names);
  }

  /**
   * Build a row from a keyed record. Keys that are not field names are ignored; fields missing
   * from the record are null.
   *
   * @param record the record
   * @param fieldNames the field names
   * @return the row
   */
  public static Row fromObject(Map<String, ?> record, List<String> fieldNames) {
    Objects.requireNonNull(record, "record must not be null");
    List<String> names = copyNames(fieldNames);
    List<Object> values = new ArrayList<>(names.size());
    for (String name : names) {
      values.add(record.get(name));
    }
    return new Row(Collections.unmodifiableList(values), names);
  }

  private static List<String> copyNames(List<String> fieldNames) {
    Objects.requireNonNull(fieldNames, "fieldNames must not be null");
    return List.copyOf(fieldNames);
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  /**
   * @param fieldName name of the field
   * @return the value of the field
   * @throws IllegalArgumentException if the row has no such field
   */
  public Object get(String fieldName) {
    int index = fieldNames.indexOf(fieldName);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown field: " + fieldName);
    }
    return values.get(index);
  }

  public List<String> getFieldNames() {
    return fieldNames;
  }

  /** @return the values in field order */
  public List<Object> toList() {
    return values;
  }

  /** @return a new map from field name to value, in field order */
  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < fieldNames.size(); i++) {
      out.put(fieldNames.get(i), values.get(i));
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    Row other = (Row) o;
    return values.equals(other.values) && fieldNames.equals(other.fieldNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, fieldNames);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}
