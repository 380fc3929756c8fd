package com.gentoro.mistadopt.device;

import com.gentoro.mistadopt.orchestrator.FailureCategory;

/** Lifecycle of one device session driven by {@link DevicePushWorker}. */
public enum SessionState {
  DISCONNECTED(FailureCategory.CONNECT_ERROR),
  CONNECTING(FailureCategory.CONNECT_ERROR),
  CONNECTED(FailureCategory.AUTH_ERROR),
  AUTHENTICATED(FailureCategory.COMMIT_ERROR),
  CONFIG_LOADED(FailureCategory.COMMIT_ERROR),
  COMMITTED(FailureCategory.NONE),
  CLOSED(FailureCategory.NONE),
  ERRORED(FailureCategory.NONE);

  private final FailureCategory failureCategory;

  SessionState(FailureCategory failureCategory) {
    this.failureCategory = failureCategory;
  }

  /** Category reported for an unexpected error raised while leaving this state. */
  public FailureCategory failureCategory() {
    return failureCategory;
  }
}
