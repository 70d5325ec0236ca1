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
 * DASStateException is thrown when a row stream or its controller is used in a way that is not
 * allowed in its current phase (e.g. pushing a row before the column info is set, reading the
 * current row before calling next(), or issuing a second next() while one is still pending).
 *
 * <p>It is always thrown synchronously and the stream is left unchanged.
 */
public class DASStateException extends DASException {
  public DASStateException(String message) {
    super(message);
  }
}
