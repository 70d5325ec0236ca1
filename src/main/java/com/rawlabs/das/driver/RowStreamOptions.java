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

import java.util.Optional;

/**
 * Options of a {@link RowStream}: an optional {@link Canceler}, and optional buffer watermarks
 * for the pause and resume events.
 *
 * <p>Without a pause count the stream never raises pause or resume and its buffer grows without
 * limit. With a pause count alone, the resume count is half the pause count, rounded down.
 */
public final class RowStreamOptions {

  private static final RowStreamOptions NONE = builder().build();

  private final Canceler canceler;
  private final Integer pauseCount;
  private final Integer resumeCount;

  private RowStreamOptions(Builder builder) {
    this.canceler = builder.canceler;
    this.pauseCount = builder.pauseCount;
    this.resumeCount = builder.resumeCount;
  }

  public static RowStreamOptions none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Options with the watermarks configured in the settings. The canceler is left unset.
   *
   * @param settings the settings
   * @return a builder, to which a canceler can still be added
   */
  public static Builder fromSettings(RowStreamSettings settings) {
    Builder builder = builder();
    if (settings.isBackpressureEnabled()) {
      builder.pauseCount(settings.getPauseCount());
      settings.getResumeCount().ifPresent(builder::resumeCount);
    }
    return builder;
  }

  public Optional<Canceler> getCanceler() {
    return Optional.ofNullable(canceler);
  }

  public Optional<Integer> getPauseCount() {
    return Optional.ofNullable(pauseCount);
  }

  public Optional<Integer> getResumeCount() {
    return Optional.ofNullable(resumeCount);
  }

  /**
   * Check the watermarks and resolve the default resume count.
   *
   * @return the effective watermarks
   * @throws DASValidationException if the watermarks are invalid
   */
  Watermarks validate() {
    if (pauseCount == null) {
      if (resumeCount != null) {
        throw new DASValidationException("pauseCount must be provided with resumeCount");
      }
      return Watermarks.DISABLED;
    }
    if (pauseCount < 2) {
      throw new DASValidationException("pauseCount must be more than 1");
    }
    int resume;
    if (resumeCount == null) {
      resume = pauseCount / 2;
    } else if (resumeCount < 0) {
      throw new DASValidationException("resumeCount cannot be negative");
    } else if (resumeCount >= pauseCount) {
      throw new DASValidationException("resumeCount must be less than pauseCount");
    } else {
      resume = resumeCount;
    }
    return new Watermarks(true, pauseCount, resume);
  }

  /** Validated buffer watermarks. */
  static final class Watermarks {
    static final Watermarks DISABLED = new Watermarks(false, 0, 0);

    final boolean enabled;
    final int pauseCount;
    final int resumeCount;

    private Watermarks(boolean enabled, int pauseCount, int resumeCount) {
      this.enabled = enabled;
      this.pauseCount = pauseCount;
      this.resumeCount = resumeCount;
    }
  }

  public static final class Builder {
    private Canceler canceler;
    private Integer pauseCount;
    private Integer resumeCount;

    private Builder() {}

    /** Cancel the stream when this canceler fires. */
    public Builder canceler(Canceler canceler) {
      this.canceler = canceler;
      return this;
    }

    /** Raise pause when this many rows are buffered. Must be at least 2. */
    public Builder pauseCount(Integer pauseCount) {
      this.pauseCount = pauseCount;
      return this;
    }

    /** Raise resume when a paused stream's buffer drains to this many rows. */
    public Builder resumeCount(Integer resumeCount) {
      this.resumeCount = resumeCount;
      return this;
    }

    /** Build the options. They are validated when a stream is created with them. */
    public RowStreamOptions build() {
      return new RowStreamOptions(this);
    }
  }
}
