package com.gentoro.mistadopt.exception;

/** Stable error codes attached to every {@link ProvisionerException}. */
public enum ProvisionerErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  INVENTORY_ERROR,
  CREDENTIAL_ERROR,
  FETCH_ERROR,
  DEVICE_ERROR
}
