package com.gentoro.mistadopt.device;

import com.gentoro.mistadopt.exception.DeviceSessionException;
import com.gentoro.mistadopt.exception.ExceptionUtil;
import com.gentoro.mistadopt.inventory.DeviceRecord;
import com.gentoro.mistadopt.orchestrator.FailureCategory;
import com.gentoro.mistadopt.orchestrator.PushResult;
import com.gentoro.mistadopt.transform.PushConfig;
import java.time.Duration;

/**
 * Pushes a configuration to one device: connect, authenticate, load, commit.
 *
 * <p>Any failure ends the sequence, the session is closed on every path and the failure is
 * returned as a {@link PushResult}. Nothing is retried here.
 */
public class DevicePushWorker {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(DevicePushWorker.class);

  private final DeviceSessionFactory sessionFactory;

  public DevicePushWorker(DeviceSessionFactory sessionFactory) {
    this.sessionFactory = sessionFactory;
  }

  public PushResult push(DeviceRecord device, PushConfig config) {
    long start = System.nanoTime();
    SessionState state = SessionState.DISCONNECTED;
    DeviceSession session = null;
    try {
      session = sessionFactory.create(device);

      state = SessionState.CONNECTING;
      session.connect();
      state = SessionState.CONNECTED;

      session.authenticate();
      state = SessionState.AUTHENTICATED;

      session.loadConfiguration(config);
      state = SessionState.CONFIG_LOADED;

      session.commit();
      state = SessionState.COMMITTED;

      log.info("{}: configuration committed", device.ip());
      return PushResult.success(device, elapsed(start));
    } catch (DeviceSessionException e) {
      FailureCategory category = categoryOf(e, state);
      log.warn("{}: {} in state {}: {}", device.ip(), category, state, e.getMessage());
      log.debug("{}: session failure", device.ip(), e);
      state = SessionState.ERRORED;
      return PushResult.failed(
          device, category, ExceptionUtil.extractErrorMessage(e), elapsed(start));
    } catch (RuntimeException e) {
      FailureCategory category = state.failureCategory();
      log.error(
          "{}: unexpected {} in state {}: {}",
          device.ip(),
          e.getClass().getSimpleName(),
          state,
          ExceptionUtil.formatCompactStackTrace(e, 5));
      state = SessionState.ERRORED;
      return PushResult.failed(
          device, category, ExceptionUtil.extractErrorMessage(e), elapsed(start));
    } finally {
      close(device, session, state);
    }
  }

  /** The exception's own category, or the state's when it carries none or a success marker. */
  private static FailureCategory categoryOf(DeviceSessionException e, SessionState state) {
    FailureCategory category = e.getCategory();
    if (category == null || category == FailureCategory.NONE) {
      return state.failureCategory();
    }
    return category;
  }

  private static void close(DeviceRecord device, DeviceSession session, SessionState state) {
    if (session == null) return;
    try {
      session.close();
      log.debug("{}: session closed after {}", device.ip(), state);
    } catch (RuntimeException e) {
      // the push outcome is already decided; a failing teardown must not change it
      log.warn("{}: error while closing session: {}", device.ip(), e.getMessage());
    }
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
