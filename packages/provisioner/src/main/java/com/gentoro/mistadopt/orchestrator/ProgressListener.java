package com.gentoro.mistadopt.orchestrator;

/** Notified on the collecting thread each time a device task finishes. */
@FunctionalInterface
public interface ProgressListener {
  void onResult(int completed, int total, PushResult result);

  static ProgressListener noop() {
    return (completed, total, result) -> {};
  }
}
