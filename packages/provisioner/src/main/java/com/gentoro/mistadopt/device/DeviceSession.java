package com.gentoro.mistadopt.device;

import com.gentoro.mistadopt.exception.DeviceSessionException;
import com.gentoro.mistadopt.transform.PushConfig;

/**
 * Management session with a single device. Steps are called in order by {@link DevicePushWorker};
 * each reports failure with a {@link DeviceSessionException} carrying the matching category.
 */
public interface DeviceSession extends AutoCloseable {

  /** Establish the transport. Fails with {@code CONNECT_ERROR}. */
  void connect() throws DeviceSessionException;

  /** Log in with the device credentials. Fails with {@code AUTH_ERROR}. */
  void authenticate() throws DeviceSessionException;

  /** Load the configuration into the candidate. Fails with {@code COMMIT_ERROR}. */
  void loadConfiguration(PushConfig config) throws DeviceSessionException;

  /** Commit the candidate. Fails with {@code COMMIT_ERROR}. */
  void commit() throws DeviceSessionException;

  /** Release the session. Must be safe to call in any state, including after a failed connect. */
  @Override
  void close();
}
