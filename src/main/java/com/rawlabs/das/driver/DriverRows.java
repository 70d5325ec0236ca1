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
 * {@link Rows} returned by a driver connection. They emit {@code complete} as soon as the
 * underlying cursor has finished, so the connection can be reused while the client is still
 * reading buffered rows.
 */
public interface DriverRows extends Rows, CompleteEmitter {}
