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

import java.util.function.Consumer;

/**
 * A source of cooperative cancellation. A registered callback is invoked at most once, with the
 * reason for the cancellation.
 */
public interface Canceler {

  /**
   * Register a callback. If the canceler has already been canceled, the callback is invoked
   * before this method returns.
   *
   * @param callback invoked with the cancellation reason
   * @return a registration that can be passed to {@link #off(CancelRegistration)}
   */
  CancelRegistration onCancel(Consumer<Throwable> callback);

  /**
   * Remove a registration. Removing a registration that already fired or was already removed
   * does nothing.
   *
   * @param registration the registration returned by {@link #onCancel(Consumer)}
   */
  void off(CancelRegistration registration);
}
