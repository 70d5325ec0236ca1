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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listener lists for {@link RowStreamEvent}s. Listeners run synchronously, in registration order.
 * A listener that throws is logged and does not prevent the others from running.
 */
final class RowStreamEvents {

  private static final Logger logger = LoggerFactory.getLogger(RowStreamEvents.class);

  private final Map<RowStreamEvent, List<Runnable>> listeners = new EnumMap<>(RowStreamEvent.class);

  RowStreamEvents() {
    for (RowStreamEvent event : RowStreamEvent.values()) {
      listeners.put(event, new CopyOnWriteArrayList<>());
    }
  }

  void on(RowStreamEvent event, Runnable listener) {
    listeners.get(event).add(Objects.requireNonNull(listener, "listener must not be null"));
  }

  /** Removes one registration of the listener, if any. */
  void off(RowStreamEvent event, Runnable listener) {
    listeners.get(event).remove(listener);
  }

  void emit(RowStreamEvent event) {
    for (Runnable listener : listeners.get(event)) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        logger.warn("Row stream {} listener failed", event, e);
      }
    }
  }
}
