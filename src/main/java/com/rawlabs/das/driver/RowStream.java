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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A buffered implementation of {@link Rows}, for drivers whose platform API does not support
 * cursors but pushes rows through callbacks or events.
 *
 * <p>The driver uses the {@link #controller()} to set the column info, push rows, and signal the
 * end of the result or an error. A driver that can pause, resume or cancel a running query
 * listens for the {@link RowStreamEvent#PAUSE}, {@link RowStreamEvent#RESUME} and {@link
 * RowStreamEvent#CANCEL} events on the controller.
 *
 * <p>The stream emits {@link RowStreamEvent#COMPLETE} as soon as the controller signals end, even
 * if the client has not read all buffered rows yet. This allows the underlying connection to be
 * released while the client keeps reading.
 *
 * <p>State changes happen under the stream's lock. The futures they complete, the events they
 * emit and the canceler they release are queued, then run without holding the lock by the thread
 * that made the change, or by another thread draining the queue at the same moment. Effects start
 * in the order they were queued, but a thread does not wait for listeners that are still running
 * on another thread, so a PAUSE listener that blocks until RESUME is released by the consumer's
 * {@link #next()}. Listeners called back on the thread that
 * is running them queue their own effects behind the current one.
 */
public class RowStream implements DriverRows {

  private static final Logger logger = LoggerFactory.getLogger(RowStream.class);

  private final Object lock = new Object();
  private final RowController controller = new Controller();
  private final RowStreamEvents events = new RowStreamEvents();
  private final Deque<Row> buffer = new ArrayDeque<>();
  private final Deque<Runnable> effects = new ArrayDeque<>();
  private final RowStreamOptions.Watermarks watermarks;
  private final Canceler canceler;

  private final ThreadLocal<Boolean> runningEffects = new ThreadLocal<>();

  private CancelRegistration cancelRegistration;

  // The stream no longer listens to the canceler. Callbacks already in flight are ignored.
  private boolean cancelerReleased;

  private Row row;
  private List<ColumnInfo> columns;
  private List<String> fieldNames;
  private Throwable err;
  private boolean ready;

  // The controller has signaled that all rows were pushed.
  private boolean done;

  // The client asked to close, but the controller has not ended yet.
  private boolean closing;

  // The client asked to close and all pending operations were flushed.
  private boolean closed;

  // Canceled by the canceler, by a controller error, or by an early close.
  private boolean canceling;

  private boolean paused;

  private CompletableFuture<Throwable> waitReady;
  private CompletableFuture<Boolean> waitNext;
  private CompletableFuture<Void> waitClose;

  /** Create a row stream that cannot be canceled externally and never pauses. */
  public RowStream() {
    this(RowStreamOptions.none());
  }

  /**
   * Create a row stream.
   *
   * @param options the canceler and watermarks
   * @throws DASValidationException if the watermarks are invalid
   */
  public RowStream(RowStreamOptions options) {
    this.watermarks = options.validate();
    this.canceler = options.getCanceler().orElse(null);
    if (canceler != null) {
      CancelRegistration registration = canceler.onCancel(this::onCanceled);
      synchronized (lock) {
        // A canceler that already fired has dropped the registration
        if (!canceling) {
          cancelRegistration = registration;
        }
      }
    }
  }

  /** The controller for this row stream. */
  public RowController controller() {
    return controller;
  }

  /** Listen for any event, including {@link RowStreamEvent#COMPLETE}. */
  public void on(RowStreamEvent event, Runnable listener) {
    events.on(event, listener);
  }

  /** Remove a listener registered with {@link #on(RowStreamEvent, Runnable)}. */
  public void off(RowStreamEvent event, Runnable listener) {
    events.off(event, listener);
  }

  @Override
  public void onComplete(Runnable listener) {
    events.on(RowStreamEvent.COMPLETE, listener);
  }

  @Override
  public void offComplete(Runnable listener) {
    events.off(RowStreamEvent.COMPLETE, listener);
  }

  /** @return whether the rows are closed */
  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /** @return the number of buffered rows */
  public int size() {
    synchronized (lock) {
      return buffer.size();
    }
  }

  /** @return a snapshot of the buffer and backpressure state */
  public Stats stats() {
    synchronized (lock) {
      return new Stats(ready, buffer.size(), paused, watermarks);
    }
  }

  @Override
  public CompletableFuture<Boolean> next() {
    CompletableFuture<Boolean> result;
    synchronized (lock) {
      if (closed) {
        // Client has terminated iteration
        return CompletableFuture.completedFuture(false);
      }
      if (closing) {
        // Closing is waiting for the controller to end
        return waitClose.thenApply(ignored -> false);
      }
      if (waitNext != null) {
        throw new DASStateException("Existing next() call has not yet resolved");
      }

      if (!buffer.isEmpty()) {
        row = buffer.removeFirst();
        if (watermarks.enabled && paused && buffer.size() <= watermarks.resumeCount) {
          paused = false;
          emit(RowStreamEvent.RESUME);
        }
        result = CompletableFuture.completedFuture(true);
      } else if (done) {
        // All rows were read and there will be no more
        closeLocked();
        result = CompletableFuture.completedFuture(false);
      } else {
        waitNext = new CompletableFuture<>();
        result = waitNext;
      }
    }
    runEffects();
    return result;
  }

  @Override
  public CompletableFuture<Void> close() {
    CompletableFuture<Void> result;
    synchronized (lock) {
      result = closeLocked();
    }
    runEffects();
    return result;
  }

  @Override
  public Row row() {
    synchronized (lock) {
      if (row == null) {
        throw new DASStateException("No row loaded. Call next()");
      }
      return row;
    }
  }

  @Override
  public List<String> columns() {
    synchronized (lock) {
      if (fieldNames == null) {
        throw new DASStateException("Column information not yet available");
      }
      return fieldNames;
    }
  }

  @Override
  public List<ColumnInfo> columnTypes() {
    synchronized (lock) {
      if (columns == null) {
        throw new DASStateException("Column information not yet available");
      }
      return columns;
    }
  }

  @Override
  public Throwable err() {
    synchronized (lock) {
      return err;
    }
  }

  /**
   * Turn whatever a driver reported as an error into a {@link Throwable}.
   *
   * @param err the reported error
   * @return the error itself if it is a Throwable, otherwise a {@link DASUnderlyingException}
   */
  static Throwable asError(Object err) {
    if (err == null) {
      return new DASUnderlyingException("Underlying stream encountered an error");
    }
    if (err instanceof Throwable) {
      return (Throwable) err;
    }
    if (err instanceof Map && ((Map<?, ?>) err).containsKey("message")) {
      return new DASUnderlyingException(String.valueOf(((Map<?, ?>) err).get("message")));
    }
    return new DASUnderlyingException(String.valueOf(err));
  }

  private void onCanceled(Throwable reason) {
    synchronized (lock) {
      if (closed || cancelerReleased) {
        logger.debug("Ignoring cancel: row stream no longer listens to its canceler");
        return;
      }
      cancel(reason == null ? new DASCanceledException() : reason);
      endLocked();
    }
    runEffects();
  }

  private void cancel(Throwable error) {
    if (canceling) {
      return;
    }
    canceling = true;
    err = error;
    logger.debug("Row stream canceled: {}", error.toString());

    releaseCanceler();
    emit(RowStreamEvent.CANCEL);

    if (!ready) {
      resolveReady(error);
    }

    CompletableFuture<Boolean> next = waitNext;
    if (next != null) {
      waitNext = null;
      effects.addLast(() -> next.completeExceptionally(error));
    }
  }

  private void setColumns(List<ColumnInfo> cols) {
    columns = List.copyOf(cols);
    List<String> names = new ArrayList<>(columns.size());
    for (ColumnInfo c : columns) {
      names.add(c.getName());
    }
    fieldNames = Collections.unmodifiableList(names);
    if (!ready) {
      resolveReady(null);
    }
  }

  private void resolveReady(Throwable error) {
    ready = true;
    CompletableFuture<Throwable> w = waitReady;
    if (w != null) {
      waitReady = null;
      effects.addLast(() -> w.complete(error));
    }
  }

  private void push(String op, Function<List<String>, Row> toRow) {
    synchronized (lock) {
      if (fieldNames == null) {
        throw new DASStateException("Cannot " + op + ": Column info not yet set");
      }
      if (canceling) {
        logger.trace("Ignoring {}: row stream is canceling", op);
        return;
      }
      if (done) {
        throw new DASStateException("Cannot " + op + ": row stream already ended");
      }
      enqueue(toRow.apply(fieldNames));
    }
    runEffects();
  }

  private void enqueue(Row r) {
    CompletableFuture<Boolean> next = waitNext;
    if (buffer.isEmpty() && next != null) {
      // A next() is already waiting on an empty buffer. Hand the row over directly
      waitNext = null;
      row = r;
      effects.addLast(() -> next.complete(true));
      return;
    }

    buffer.addLast(r);
    if (watermarks.enabled && !paused && buffer.size() >= watermarks.pauseCount) {
      paused = true;
      emit(RowStreamEvent.PAUSE);
    }
  }

  private void endLocked() {
    if (closed) {
      logger.debug("Ignoring end(): row stream already closed");
      return;
    }
    boolean first = !done;
    done = true;

    if (!ready) {
      // End with no data. Set empty columns to resolve ready
      setColumns(Collections.emptyList());
    }

    if (first) {
      logger.debug("Row stream ended with {} buffered row(s)", buffer.size());
      // Release the underlying connection
      emit(RowStreamEvent.COMPLETE);
    }

    CompletableFuture<Void> close = waitClose;
    if (close != null) {
      // The client was waiting for the controller to end
      closed = true;
      closing = false;
      waitClose = null;
      effects.addLast(() -> close.complete(null));
    } else if (err != null) {
      // Ending because of an error. There is nothing left for the client to read
      closed = true;
      closing = false;
    }

    if (waitNext != null && buffer.isEmpty()) {
      // No more rows for a pending next(). Close to resolve it
      closeLocked();
    }
  }

  private CompletableFuture<Void> closeLocked() {
    if (closed) {
      return CompletableFuture.completedFuture(null);
    }
    if (closing) {
      return waitClose;
    }
    closing = true;

    if (!ready) {
      resolveReady(null);
    }
    releaseCanceler();

    CompletableFuture<Boolean> next = waitNext;
    waitNext = null;

    if (done) {
      // The controller is done. Close right away
      closed = true;
      closing = false;
      if (next != null) {
        effects.addLast(() -> next.complete(false));
      }
      logger.debug("Row stream closed");
      return CompletableFuture.completedFuture(null);
    }

    // The controller is not done yet. Tell it to cancel and wait for it to end
    if (!canceling) {
      canceling = true;
      emit(RowStreamEvent.CANCEL);
    }
    CompletableFuture<Void> close = new CompletableFuture<>();
    waitClose = close;
    if (next != null) {
      close.thenRun(() -> next.complete(false));
    }
    logger.debug("Row stream closing, waiting for the controller to end");
    return close;
  }

  private void releaseCanceler() {
    cancelerReleased = true;
    CancelRegistration registration = cancelRegistration;
    if (registration != null) {
      cancelRegistration = null;
      effects.addLast(() -> canceler.off(registration));
    }
  }

  private void emit(RowStreamEvent event) {
    effects.addLast(() -> events.emit(event));
  }

  /**
   * Run the queued effects outside the lock, in queue order. Each thread drains the queue after its
   * own change. A thread that is already running effects further up its stack leaves the new ones
   * to that outer loop.
   */
  private void runEffects() {
    if (runningEffects.get() != null) {
      return;
    }
    runningEffects.set(Boolean.TRUE);
    try {
      while (true) {
        Runnable effect;
        synchronized (lock) {
          effect = effects.pollFirst();
        }
        if (effect == null) {
          return;
        }
        effect.run();
      }
    } finally {
      runningEffects.remove();
    }
  }

  /** Point-in-time view of a row stream's buffer. */
  public static final class Stats {
    private final boolean ready;
    private final int size;
    private final boolean paused;
    private final boolean canPause;
    private final OptionalInt pauseCount;
    private final OptionalInt resumeCount;

    private Stats(boolean ready, int size, boolean paused, RowStreamOptions.Watermarks watermarks) {
      this.ready = ready;
      this.size = size;
      this.paused = paused;
      this.canPause = watermarks.enabled;
      this.pauseCount = canPause ? OptionalInt.of(watermarks.pauseCount) : OptionalInt.empty();
      this.resumeCount = canPause ? OptionalInt.of(watermarks.resumeCount) : OptionalInt.empty();
    }

    public boolean isReady() {
      return ready;
    }

    public int getSize() {
      return size;
    }

    public boolean isPaused() {
      return paused;
    }

    public boolean canPause() {
      return canPause;
    }

    public OptionalInt getPauseCount() {
      return pauseCount;
    }

    public OptionalInt getResumeCount() {
      return resumeCount;
    }

    @Override
    public String toString() {
      return "Stats{ready="
          + ready
          + ", size="
          + size
          + ", paused="
          + paused
          + ", canPause="
          + canPause
          + ", pauseCount="
          + pauseCount
          + ", resumeCount="
          + resumeCount
          + "}";
    }
  }

  private final class Controller implements RowController {

    @Override
    public CompletableFuture<Throwable> ready() {
      synchronized (lock) {
        if (ready) {
          return CompletableFuture.completedFuture(err);
        }
        if (waitReady == null) {
          waitReady = new CompletableFuture<>();
        }
        return waitReady;
      }
    }

    @Override
    public void setColumns(List<ColumnInfo> cols) {
      Objects.requireNonNull(cols, "columns must not be null");
      synchronized (lock) {
        if (columns != null) {
          throw new DASStateException("Column info already set");
        }
        RowStream.this.setColumns(cols);
      }
      runEffects();
    }

    @Override
    public void pushRow(Row r) {
      Objects.requireNonNull(r, "row must not be null");
      push("pushRow", names -> r);
    }

    @Override
    public void pushArray(List<?> values) {
      push("pushArray", names -> Row.fromArray(values, names));
    }

    @Override
    public void pushObject(Map<String, ?> record) {
      push("pushObject", names -> Row.fromObject(record, names));
    }

    @Override
    public void error(Object e) {
      synchronized (lock) {
        if (closed) {
          logger.debug("Ignoring error(): row stream already closed");
          return;
        }
        Throwable error = asError(e);
        err = error;
        cancel(error);
        endLocked();
      }
      runEffects();
    }

    @Override
    public void end() {
      synchronized (lock) {
        endLocked();
      }
      runEffects();
    }

    @Override
    public void on(RowStreamEvent event, Runnable listener) {
      if (event == RowStreamEvent.COMPLETE) {
        throw new IllegalArgumentException("Controllers cannot listen for " + event);
      }
      events.on(event, listener);
    }

    @Override
    public void off(RowStreamEvent event, Runnable listener) {
      events.off(event, listener);
    }

    @Override
    public boolean isPaused() {
      synchronized (lock) {
        return paused;
      }
    }
  }
}
