package com.scholary.recipe.media.client;

import java.time.Duration;

/**
 * How often and how long to poll a video's processing status.
 *
 * <p>The defaults give a video six minutes to become playable.
 */
public record PollingPolicy(Duration interval, int maxAttempts) {

  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(3);
  public static final int DEFAULT_MAX_ATTEMPTS = 120;

  public PollingPolicy {
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive: " + interval);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
    }
  }

  public static PollingPolicy defaults() {
    return new PollingPolicy(DEFAULT_INTERVAL, DEFAULT_MAX_ATTEMPTS);
  }
}
