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

import static com.rawlabs.das.driver.RowStreamTest.COLUMNS;
import static com.rawlabs.das.driver.RowStreamTest.putData;
import static com.rawlabs.das.driver.RowStreamTest.setCols;
import static com.rawlabs.das.driver.RowStreamTest.withWatermarks;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RowControllerTest {

  @Nested
  class Ready {

    @Test
    void isCompletedIfColumnsAreAlreadySet() {
      RowController ctrl = new RowStream().controller();
      setCols(ctrl);
      assertThat(ctrl.ready()).isCompletedWithValue(null);
    }

    @Test
    void returnsErrorIfAlreadyFailed() {
      RowController ctrl = new RowStream().controller();
      RuntimeException err = new RuntimeException("fail");
      ctrl.error(err);
      assertThat(ctrl.ready()).isCompletedWithValue(err);
    }

    @Test
    void completesWhenColumnsAreSet() {
      RowController ctrl = new RowStream().controller();
      CompletableFuture<Throwable> ready = ctrl.ready();
      assertThat(ready).isNotDone();
      assertThat(ctrl.ready()).isSameAs(ready);

      setCols(ctrl);

      assertThat(ready).isCompletedWithValue(null);
    }

    @Test
    void completesWhenEndIsSignaled() {
      RowController ctrl = new RowStream().controller();
      CompletableFuture<Throwable> ready = ctrl.ready();

      ctrl.end();

      assertThat(ready).isCompletedWithValue(null);
    }

    @Test
    void completesWithErrorWhenErrorIsSignaled() {
      RowController ctrl = new RowStream().controller();
      CompletableFuture<Throwable> ready = ctrl.ready();
      RuntimeException err = new RuntimeException("the end");

      ctrl.error(err);

      assertThat(ready).isCompletedWithValue(err);
    }

    @Test
    void completesWithCancelReasonWhenCanceled() {
      CancelSource source = new CancelSource();
      RowController ctrl =
          new RowStream(RowStreamOptions.builder().canceler(source).build()).controller();
      CompletableFuture<Throwable> ready = ctrl.ready();

      source.cancel();

      assertThat(ready.join()).isInstanceOf(DASCanceledException.class);
    }
  }

  @Nested
  class SetColumns {

    @Test
    void setsColumnInfoAndNames() {
      RowStream rows = new RowStream();
      rows.controller().setColumns(COLUMNS);

      assertThat(rows.columnTypes()).isEqualTo(COLUMNS);
      assertThat(rows.columns()).containsExactly("id", "code", "label");
    }

    @Test
    void canOnlyBeSetOnce() {
      RowStream rows = new RowStream();
      setCols(rows.controller());

      assertThatThrownBy(() -> rows.controller().setColumns(List.of()))
          .isInstanceOf(DASStateException.class)
          .hasMessage("Column info already set");
      assertThat(rows.columnTypes()).isEqualTo(COLUMNS);
    }
  }

  @Nested
  class Push {

    private final Row row =
        Row.fromObject(
            Map.of("id", 1, "code", "1212", "label", "hello"), List.of("id", "code", "label"));

    @Test
    void pushRowAddsRowToBuffer() {
      RowStream rows = new RowStream();
      setCols(rows.controller());

      rows.controller().pushRow(row);

      assertThat(rows.size()).isEqualTo(1);
      rows.next();
      assertThat(rows.row()).isSameAs(row);
    }

    @Test
    void pushArrayBuildsRowFromColumnInfo() {
      RowStream rows = new RowStream();
      setCols(rows.controller());

      rows.controller().pushArray(List.of(1, "abc", "hello"));

      rows.next();
      assertThat(rows.row().toMap()).isEqualTo(Map.of("id", 1, "code", "abc", "label", "hello"));
    }

    @Test
    void pushObjectBuildsRowFromColumnInfo() {
      RowStream rows = new RowStream();
      setCols(rows.controller());

      rows.controller().pushObject(Map.of("label", "hello", "id", 1, "code", "abc"));

      rows.next();
      assertThat(rows.row().toList()).containsExactly(1, "abc", "hello");
    }

    @Test
    void everyPushFailsBeforeColumnsAreSet() {
      RowStream rows = new RowStream();
      RowController ctrl = rows.controller();

      assertThatThrownBy(() -> ctrl.pushRow(row))
          .isInstanceOf(DASStateException.class)
          .hasMessage("Cannot pushRow: Column info not yet set");
      assertThatThrownBy(() -> ctrl.pushArray(List.of(1, "abc", "hello")))
          .isInstanceOf(DASStateException.class)
          .hasMessage("Cannot pushArray: Column info not yet set");
      assertThatThrownBy(() -> ctrl.pushObject(Map.of("id", 1)))
          .isInstanceOf(DASStateException.class)
          .hasMessage("Cannot pushObject: Column info not yet set");
      assertThat(rows.size()).isZero();
    }

    @Test
    void pushFailsBeforeColumnsEvenWhenCanceling() {
      RowStream rows = new RowStream();
      rows.close();

      assertThatThrownBy(() -> rows.controller().pushRow(row))
          .isInstanceOf(DASStateException.class);
    }
  }

  @Nested
  class ErrorReport {

    @Test
    void setsErr() {
      RowStream rows = new RowStream();
      RuntimeException err = new RuntimeException("phooey");
      rows.controller().error(err);
      assertThat(rows.err()).isSameAs(err);
    }

    @Test
    void makesDefaultError() {
      RowStream rows = new RowStream();
      rows.controller().error(null);
      assertThat(rows.err())
          .isInstanceOf(DASUnderlyingException.class)
          .hasMessage("Underlying stream encountered an error");
    }

    @Test
    void wrapsString() {
      RowStream rows = new RowStream();
      rows.controller().error("this is just terrible");
      assertThat(rows.err())
          .isInstanceOf(DASUnderlyingException.class)
          .hasMessage("this is just terrible");
    }

    @Test
    void extractsMessage() {
      RowStream rows = new RowStream();
      rows.controller().error(Map.of("message", "this is just terrible", "code", 42));
      assertThat(rows.err()).hasMessage("this is just terrible");
    }

    @Test
    void stringifiesAnythingElse() {
      RowStream rows = new RowStream();
      rows.controller().error(11);
      assertThat(rows.err()).isInstanceOf(DASUnderlyingException.class).hasMessage("11");
    }

    @Test
    void closesRows() {
      RowStream rows = new RowStream();
      rows.controller().error(null);
      assertThat(rows.isClosed()).isTrue();
    }

    @Test
    void isIgnoredOnceClosed() {
      RowStream rows = new RowStream();
      rows.controller().end();
      rows.close();

      rows.controller().error("late");

      assertThat(rows.err()).isNull();
    }
  }

  @Nested
  class Listeners {

    @Test
    void pauseFiresOncePerCrossing() {
      RowStream rows = withWatermarks(4, 2);
      RowController ctrl = rows.controller();
      AtomicInteger pauses = new AtomicInteger();
      ctrl.on(RowStreamEvent.PAUSE, pauses::incrementAndGet);

      setCols(ctrl);
      putData(ctrl, 4);
      assertThat(pauses).hasValue(1);

      rows.next();
      rows.next();
      assertThat(pauses).hasValue(1);

      putData(ctrl, 2);
      assertThat(pauses).hasValue(2);
    }

    @Test
    void resumeFiresOncePerCrossing() {
      RowStream rows = withWatermarks(2, 1);
      RowController ctrl = rows.controller();
      AtomicInteger resumes = new AtomicInteger();
      ctrl.on(RowStreamEvent.RESUME, resumes::incrementAndGet);

      setCols(ctrl);
      putData(ctrl, 2);
      assertThat(resumes).hasValue(0);

      rows.next();
      assertThat(resumes).hasValue(1);

      putData(ctrl, 1);
      assertThat(resumes).hasValue(1);

      rows.next();
      assertThat(resumes).hasValue(2);
    }

    @Test
    void cancelFiresOnClose() {
      RowStream rows = new RowStream();
      AtomicInteger cancels = new AtomicInteger();
      rows.controller().on(RowStreamEvent.CANCEL, cancels::incrementAndGet);

      rows.close();

      assertThat(cancels).hasValue(1);
    }

    @Test
    void cancelFiresOnError() {
      RowStream rows = new RowStream();
      AtomicInteger cancels = new AtomicInteger();
      rows.controller().on(RowStreamEvent.CANCEL, cancels::incrementAndGet);

      rows.controller().error(null);

      assertThat(cancels).hasValue(1);
    }

    @Test
    void cancelFiresOnCancelerCancel() {
      CancelSource source = new CancelSource();
      RowStream rows = new RowStream(RowStreamOptions.builder().canceler(source).build());
      AtomicInteger cancels = new AtomicInteger();
      rows.controller().on(RowStreamEvent.CANCEL, cancels::incrementAndGet);

      source.cancel();

      assertThat(cancels).hasValue(1);
    }

    @Test
    void offRemovesPauseListener() {
      RowStream rows = withWatermarks(4, 2);
      RowController ctrl = rows.controller();
      AtomicInteger pauses = new AtomicInteger();
      Runnable onPause = pauses::incrementAndGet;
      ctrl.on(RowStreamEvent.PAUSE, onPause);

      setCols(ctrl);
      putData(ctrl, 4);
      rows.next();
      rows.next();
      ctrl.off(RowStreamEvent.PAUSE, onPause);
      putData(ctrl, 2);

      assertThat(pauses).hasValue(1);
      assertThat(rows.stats().isPaused()).isTrue();
    }

    @Test
    void isPausedFollowsWatermarks() {
      RowStream rows = withWatermarks(3, 1);
      RowController ctrl = rows.controller();
      setCols(ctrl);

      putData(ctrl, 2);
      assertThat(ctrl.isPaused()).isFalse();
      putData(ctrl, 1, 2);
      assertThat(ctrl.isPaused()).isTrue();

      rows.next();
      assertThat(ctrl.isPaused()).isTrue();
      rows.next();
      assertThat(ctrl.isPaused()).isFalse();
    }

    @Test
    void offRemovesCancelListener() {
      CancelSource source = new CancelSource();
      RowStream rows = new RowStream(RowStreamOptions.builder().canceler(source).build());
      AtomicInteger cancels = new AtomicInteger();
      Runnable onCancel = cancels::incrementAndGet;
      rows.controller().on(RowStreamEvent.CANCEL, onCancel);
      rows.controller().off(RowStreamEvent.CANCEL, onCancel);

      source.cancel();

      assertThat(cancels).hasValue(0);
    }

    @Test
    void completeIsReservedToTheOwner() {
      RowController ctrl = new RowStream().controller();
      assertThatThrownBy(() -> ctrl.on(RowStreamEvent.COMPLETE, () -> {}))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
