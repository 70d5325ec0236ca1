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

import java.io.Closeable;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A blocking {@link Iterator} over {@link Rows} that must be closed. Closing it, or reading it to
 * the end, closes the underlying rows. Use it with try-with-resources so the rows are closed when
 * the loop exits early or throws.
 */
public final class RowIterator implements Iterator<Row>, Closeable {
  private final Rows rows;
  private Boolean hasRow;
  private boolean closed;

  RowIterator(Rows rows) {
    this.rows = rows;
  }

  @Override
  public boolean hasNext() {
    if (hasRow == null) {
      hasRow = closed ? Boolean.FALSE : await(rows.next());
    }
    return hasRow;
  }

  @Override
  public Row next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more rows");
    }
    hasRow = null;
    return rows.row();
  }

  /** Close the rows and wait until the producer has stopped. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    hasRow = Boolean.FALSE;
    await(rows.close());
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DASException("Interrupted while waiting for rows", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new DASException(cause.getMessage(), cause);
    }
  }
}
