package com.gentoro.mistadopt.orchestrator;

/** Why a device was not provisioned. */
public enum FailureCategory {
  /** Not a failure. */
  NONE,
  /** The adoption configuration could not be fetched. */
  FETCH_ERROR,
  /** The NETCONF session could not be established. */
  CONNECT_ERROR,
  /** The device rejected the credentials. */
  AUTH_ERROR,
  /** Loading or committing the configuration failed. */
  COMMIT_ERROR,
  /** The task never ran or was stopped by shutdown. */
  CANCELLED
}
