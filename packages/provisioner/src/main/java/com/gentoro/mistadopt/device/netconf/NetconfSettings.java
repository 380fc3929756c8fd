package com.gentoro.mistadopt.device.netconf;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Transport settings for NETCONF sessions.
 *
 * @param port SSH port of the NETCONF subsystem
 * @param timeout bound for connect, authentication, channel open and idle reads
 */
public record NetconfSettings(int port, Duration timeout) {
  public static final int DEFAULT_PORT = 830;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  public static NetconfSettings fromConfiguration(Configuration config) {
    return new NetconfSettings(
        config.getInt("netconf.port", DEFAULT_PORT),
        Duration.ofMillis(config.getLong("netconf.timeout-ms", DEFAULT_TIMEOUT.toMillis())));
  }
}
