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
 * Error reported by the producer of a row stream through {@link RowController#error(Object)},
 * when what it reported was not already a {@link Throwable}.
 */
public class DASUnderlyingException extends DASException {
  public DASUnderlyingException(String message) {
    super(message);
  }
}
