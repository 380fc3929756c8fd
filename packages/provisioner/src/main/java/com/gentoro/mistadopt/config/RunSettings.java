package com.gentoro.mistadopt.config;

/**
 * Immutable settings for a single provisioning run. Created once before orchestration starts and
 * shared read-only by every device task.
 *
 * @param maxConcurrency maximum number of device tasks running at the same time
 * @param keepPhoneHome keep the {@code delete system phone-home} directive in pushed configuration
 * @param apiKey resolved Mist API key
 */
public record RunSettings(int maxConcurrency, boolean keepPhoneHome, String apiKey) {
  public static final int DEFAULT_MAX_CONCURRENCY = 10;

  public RunSettings {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
    }
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey must not be blank");
    }
  }

  @Override
  public String toString() {
    return "RunSettings[maxConcurrency=%d, keepPhoneHome=%s, apiKey=****]"
        .formatted(maxConcurrency, keepPhoneHome);
  }
}
