package com.gentoro.mistadopt.mist;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Bounded exponential backoff for Mist API calls.
 *
 * @param maxAttempts total attempts including the first one
 * @param initialBackoff wait before the second attempt
 * @param maxBackoff upper bound for any single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
  public static final RetryPolicy DEFAULT =
      new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(8));

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("Backoff durations must not be negative");
    }
  }

  public static RetryPolicy fromConfiguration(Configuration config) {
    return new RetryPolicy(
        config.getInt("mist.retry.max-attempts", DEFAULT.maxAttempts()),
        Duration.ofMillis(
            config.getLong("mist.retry.initial-backoff-ms", DEFAULT.initialBackoff().toMillis())),
        Duration.ofMillis(
            config.getLong("mist.retry.max-backoff-ms", DEFAULT.maxBackoff().toMillis())));
  }

  /** Wait before the given attempt (2-based: the first retry is attempt 2). */
  public Duration backoffBefore(int attempt) {
    if (attempt <= 1) return Duration.ZERO;
    int exponent = Math.min(attempt - 2, 30);
    long millis = initialBackoff.toMillis() << exponent;
    if (millis < 0 || millis > maxBackoff.toMillis()) {
      return maxBackoff;
    }
    return Duration.ofMillis(millis);
  }
}
