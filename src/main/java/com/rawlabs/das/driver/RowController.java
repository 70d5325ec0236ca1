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
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Producer side of a {@link RowStream}. A driver uses it to set the column info, push rows, and
 * signal the end of the result or an error. Drivers that can pause, resume or cancel their query
 * listen for the {@link RowStreamEvent#PAUSE}, {@link RowStreamEvent#RESUME} and {@link
 * RowStreamEvent#CANCEL} events.
 */
public interface RowController {

  /**
   * Completes when {@link #setColumns(List)} or {@link #end()} is called, the stream is closed, or
   * the stream fails. Useful to implement a query method that returns only once the result is
   * described.
   *
   * @return a future with the error that terminated the stream, or null
   */
  CompletableFuture<Throwable> ready();

  /**
   * Set the column info. Must be called once, before pushing rows.
   *
   * @throws DASStateException if the column info is already set
   */
  void setColumns(List<ColumnInfo> columns);

  /**
   * Push a row.
   *
   * @throws DASStateException if the column info is not set yet, or the stream already ended
   */
  void pushRow(Row row);

  /**
   * Push a row given as values in column order.
   *
   * @throws DASStateException if the column info is not set yet, or the stream already ended
   */
  void pushArray(List<?> values);

  /**
   * Push a row given as a record keyed by column name.
   *
   * @throws DASStateException if the column info is not set yet, or the stream already ended
   */
  void pushObject(Map<String, ?> record);

  /**
   * Report that the query failed. Cancels the stream and calls {@link #end()}.
   *
   * @param err a {@link Throwable}, a map with a "message" entry, or any other value, which is
   *     turned into a message
   */
  void error(Object err);

  /** Report that all rows have been pushed. */
  void end();

  /**
   * Listen for {@link RowStreamEvent#PAUSE}, {@link RowStreamEvent#RESUME} or {@link
   * RowStreamEvent#CANCEL}.
   *
   * <p>A PAUSE listener may block its producer thread until RESUME: RESUME is delivered by the
   * consumer thread that drained the buffer.
   *
   * @throws IllegalArgumentException for {@link RowStreamEvent#COMPLETE}, which is reserved to
   *     the owner of the stream
   */
  void on(RowStreamEvent event, Runnable listener);

  /** Remove a listener registered with {@link #on(RowStreamEvent, Runnable)}. */
  void off(RowStreamEvent event, Runnable listener);

  /**
   * @return whether the buffer is above the pause count and has not drained to the resume count
   *     since. This is the current state, even while PAUSE or RESUME listeners are still running.
   */
  boolean isPaused();
}
