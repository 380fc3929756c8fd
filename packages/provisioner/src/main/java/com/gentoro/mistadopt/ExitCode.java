package com.gentoro.mistadopt;

/** Process exit codes. */
public final class ExitCode {
  /** Every device was provisioned. */
  public static final int OK = 0;
  /** At least one device failed or was cancelled. */
  public static final int DEVICE_FAILURES = 1;
  /** Nothing was dispatched: bad usage, inventory or credentials. */
  public static final int FATAL = 2;

  private ExitCode() {}
}
