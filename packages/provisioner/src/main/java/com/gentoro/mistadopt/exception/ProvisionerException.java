package com.gentoro.mistadopt.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base class of all errors raised by the provisioner. */
public class ProvisionerException extends RuntimeException {
  private final ProvisionerErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ProvisionerException(ProvisionerErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ProvisionerException(ProvisionerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ProvisionerErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value pair. Returns {@code this} for chaining. */
  public ProvisionerException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
