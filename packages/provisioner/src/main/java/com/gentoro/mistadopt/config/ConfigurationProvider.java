package com.gentoro.mistadopt.config;

import com.gentoro.mistadopt.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration.
 *
 * <p>Defaults come from {@code application.yaml} on the classpath. An optional external YAML file
 * overlays them key by key, so it only needs to contain what differs.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  /** Defaults only. */
  public ConfigurationProvider() {
    this(null);
  }

  /**
   * @param overrideFile optional path to a YAML file overriding the defaults (null or blank to
   *     skip)
   */
  public ConfigurationProvider(String overrideFile) {
    CompositeConfiguration composite = new CompositeConfiguration();
    if (overrideFile != null && !overrideFile.isBlank()) {
      composite.addConfiguration(readFile(Path.of(overrideFile)));
      log.info("Loaded configuration overrides from {}", overrideFile);
    }
    composite.addConfiguration(readClasspath(DEFAULT_RESOURCE));
    this.config = composite;
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration readFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigurationException("Configuration file not found: " + path);
    }
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Failed to read configuration file: " + path, e);
    }
    return yaml;
  }

  private static YAMLConfiguration readClasspath(String resource) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("No {} found on classpath, using built-in defaults", resource);
        return yaml;
      }
      yaml.read(in);
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Failed to read classpath configuration: " + resource, e);
    }
    return yaml;
  }
}
