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
import java.util.function.Consumer;

/** Handle for one callback registered with a {@link Canceler}. */
public final class CancelRegistration {
  private final Consumer<Throwable> callback;

  public CancelRegistration(Consumer<Throwable> callback) {
    this.callback = Objects.requireNonNull(callback, "callback must not be null");
  }

  public Consumer<Throwable> getCallback() {
    return callback;
  }
}
