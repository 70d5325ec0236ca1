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

/** Something that signals when the connection it was using can be released. */
public interface CompleteEmitter {

  /** Schedule a listener to run when all work on the underlying connection has completed. */
  void onComplete(Runnable listener);

  /** Remove a listener registered with {@link #onComplete(Runnable)}. */
  void offComplete(Runnable listener);
}
