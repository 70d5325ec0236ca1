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

/**
 * Lifecycle notifications raised by a {@link RowStream}.
 *
 * <p>Listeners usually run on the thread whose call raised the event, so PAUSE runs on the
 * producer thread and RESUME on the consumer thread. Events start in the order they happened, but
 * listeners on different threads can overlap, so a producer that waits for RESUME checks {@link
 * RowController#isPaused()} rather than the order its listeners ran in.
 */
public enum RowStreamEvent {
  /** The buffer reached the pause count. Producers should stop pushing rows for now. */
  PAUSE,
  /** The buffer drained down to the resume count. Producers may push rows again. */
  RESUME,
  /** The stream is being canceled. Producers should stop and call end(). */
  CANCEL,
  /** The producer called end(); the underlying connection can be released. */
  COMPLETE
}
