package com.gentoro.mistadopt.exception;

/** Invalid or unreadable application configuration. */
public class ConfigurationException extends ProvisionerException {
  public ConfigurationException(String message) {
    super(ProvisionerErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ProvisionerErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
