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
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Canceler} that is canceled explicitly by its owner. Callbacks run on the thread that
 * calls {@link #cancel()}, in registration order, without holding any lock.
 */
public final class CancelSource implements Canceler {

  private static final Logger logger = LoggerFactory.getLogger(CancelSource.class);

  private final Object lock = new Object();
  private final List<CancelRegistration> registrations = new ArrayList<>();
  private Throwable reason;

  @Override
  public CancelRegistration onCancel(Consumer<Throwable> callback) {
    CancelRegistration registration = new CancelRegistration(callback);
    Throwable firedWith;
    synchronized (lock) {
      firedWith = reason;
      if (firedWith == null) {
        registrations.add(registration);
      }
    }
    if (firedWith != null) {
      callback.accept(firedWith);
    }
    return registration;
  }

  @Override
  public void off(CancelRegistration registration) {
    synchronized (lock) {
      registrations.remove(registration);
    }
  }

  /**
   * Cancel with a {@link DASCanceledException}.
   *
   * @return true if this call canceled the source, false if it was already canceled
   */
  public boolean cancel() {
    return cancel(new DASCanceledException());
  }

  /**
   * Cancel with the given reason.
   *
   * @param reason passed to every registered callback
   * @return true if this call canceled the source, false if it was already canceled
   */
  public boolean cancel(Throwable reason) {
    Throwable cause = reason == null ? new DASCanceledException() : reason;
    List<CancelRegistration> fired;
    synchronized (lock) {
      if (this.reason != null) {
        return false;
      }
      this.reason = cause;
      fired = new ArrayList<>(registrations);
      registrations.clear();
    }
    logger.debug("Canceling {} registered callback(s)", fired.size());
    for (CancelRegistration registration : fired) {
      registration.getCallback().accept(cause);
    }
    return true;
  }

  public boolean isCanceled() {
    synchronized (lock) {
      return reason != null;
    }
  }

  /** @return the number of callbacks that are registered and have not fired yet */
  public int size() {
    synchronized (lock) {
      return registrations.size();
    }
  }
}
