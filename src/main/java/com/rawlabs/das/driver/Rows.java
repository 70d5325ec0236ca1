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

import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A forward-only cursor over the rows of a query result.
 *
 * <p>Only one {@link #next()} may be outstanding at a time. Rows must be closed, either
 * explicitly or by reading them to the end.
 */
public interface Rows {

  /**
   * Advance to the next row.
   *
   * @return a future that completes with true if {@link #row()} now holds the next row, or false
   *     when there are no more rows; it completes exceptionally if the query failed or was
   *     canceled
   * @throws DASStateException if a previous next() has not completed yet
   */
  CompletableFuture<Boolean> next();

  /**
   * @return the current row
   * @throws DASStateException if next() has not returned a row yet
   */
  Row row();

  /**
   * @return the column names
   * @throws DASStateException if the column info is not known yet
   */
  List<String> columns();

  /**
   * @return the column info
   * @throws DASStateException if the column info is not known yet
   */
  List<ColumnInfo> columnTypes();

  /**
   * Close the rows. Never completes exceptionally; check {@link #err()} afterwards to find out
   * whether the query failed.
   *
   * @return a future that completes once the rows are closed
   */
  CompletableFuture<Void> close();

  /** @return the error that terminated the rows, or null */
  Throwable err();

  /**
   * @return a blocking iterator over the remaining rows, which closes the rows when it is closed
   *     or exhausted
   */
  default RowIterator iterator() {
    return new RowIterator(this);
  }

  /**
   * Run the action for each remaining row, then close the rows, also if the action throws.
   *
   * @param action the action to run
   */
  default void forEachRow(Consumer<? super Row> action) {
    try (RowIterator it = iterator()) {
      while (it.hasNext()) {
        action.accept(it.next());
      }
    }
  }

  /** @return a sequential stream of the remaining rows; closing the stream closes the rows */
  default Stream<Row> stream() {
    RowIterator it = iterator();
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(it::close);
  }
}
