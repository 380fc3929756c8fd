package com.gentoro.mistadopt.mist;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffDoublesAndIsCapped() {
    RetryPolicy policy = new RetryPolicy(6, Duration.ofMillis(100), Duration.ofMillis(350));

    assertEquals(Duration.ZERO, policy.backoffBefore(1));
    assertEquals(Duration.ofMillis(100), policy.backoffBefore(2));
    assertEquals(Duration.ofMillis(200), policy.backoffBefore(3));
    assertEquals(Duration.ofMillis(350), policy.backoffBefore(4));
    assertEquals(Duration.ofMillis(350), policy.backoffBefore(60));
  }

  @Test
  void readsConfigurationWithDefaults() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("mist.retry.max-attempts", 5);

    RetryPolicy policy = RetryPolicy.fromConfiguration(config);

    assertEquals(5, policy.maxAttempts());
    assertEquals(RetryPolicy.DEFAULT.initialBackoff(), policy.initialBackoff());
  }

  @Test
  void rejectsZeroAttempts() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO));
  }
}
