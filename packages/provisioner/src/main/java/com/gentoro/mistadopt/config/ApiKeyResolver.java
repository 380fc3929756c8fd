package com.gentoro.mistadopt.config;

import com.gentoro.mistadopt.exception.CredentialException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.apache.commons.configuration2.INIConfiguration;
import org.apache.commons.configuration2.SubnodeConfiguration;

/**
 * Resolves the Mist API key.
 *
 * <p>Precedence:
 *
 * <ol>
 *   <li>explicit {@code --api-key} value
 *   <li>environment variable {@value #ENV_VAR}
 *   <li>{@code api_key} in section {@code [Mist]} of {@code ~/.mist/config.ini}
 * </ol>
 *
 * If none yields a non-blank value a {@link CredentialException} is thrown.
 */
public class ApiKeyResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(ApiKeyResolver.class);

  public static final String ENV_VAR = "MIST_API_KEY";
  static final String SECTION = "Mist";
  static final String KEY = "api_key";

  private final Function<String, String> environment;
  private final Path configFile;

  public ApiKeyResolver() {
    this(System::getenv, Path.of(System.getProperty("user.home"), ".mist", "config.ini"));
  }

  public ApiKeyResolver(Function<String, String> environment, Path configFile) {
    this.environment = environment;
    this.configFile = configFile;
  }

  public String resolve(String explicitKey) {
    if (!isBlank(explicitKey)) {
      log.debug("Using Mist API key from command line");
      return explicitKey.trim();
    }

    String fromEnv = environment.apply(ENV_VAR);
    if (!isBlank(fromEnv)) {
      log.debug("Using Mist API key from environment variable {}", ENV_VAR);
      return fromEnv.trim();
    }

    String fromFile = readConfigFile();
    if (!isBlank(fromFile)) {
      log.debug("Using Mist API key from {}", configFile);
      return fromFile.trim();
    }

    throw new CredentialException(
        "Mist API key not found: pass --api-key, set %s or add '%s' under [%s] in %s"
            .formatted(ENV_VAR, KEY, SECTION, configFile));
  }

  private String readConfigFile() {
    if (configFile == null || !Files.isRegularFile(configFile)) {
      log.debug("Mist config file {} not present", configFile);
      return null;
    }
    INIConfiguration ini = new INIConfiguration();
    try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
      ini.read(reader);
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      log.warn("Could not read Mist config file {}: {}", configFile, e.getMessage());
      return null;
    }
    if (!ini.getSections().contains(SECTION)) {
      log.debug("Mist config file {} has no [{}] section", configFile, SECTION);
      return null;
    }
    SubnodeConfiguration section = ini.getSection(SECTION);
    return section.getString(KEY, null);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
