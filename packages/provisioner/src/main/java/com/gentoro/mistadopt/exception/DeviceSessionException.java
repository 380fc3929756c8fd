package com.gentoro.mistadopt.exception;

import com.gentoro.mistadopt.orchestrator.FailureCategory;

/** A NETCONF session step against a device failed. */
public class DeviceSessionException extends ProvisionerException {
  private final FailureCategory category;

  public DeviceSessionException(FailureCategory category, String message) {
    super(ProvisionerErrorCode.DEVICE_ERROR, message);
    this.category = category;
  }

  public DeviceSessionException(FailureCategory category, String message, Throwable cause) {
    super(ProvisionerErrorCode.DEVICE_ERROR, message, cause);
    this.category = category;
  }

  public FailureCategory getCategory() {
    return category;
  }
}
