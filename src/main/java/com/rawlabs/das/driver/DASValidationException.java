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
 * DASValidationException is thrown when a row stream is configured with invalid options (e.g. a
 * pause count that is too small, or a resume count that is not below the pause count).
 */
public class DASValidationException extends DASException {
  public DASValidationException(String message) {
    super(message);
  }
}
