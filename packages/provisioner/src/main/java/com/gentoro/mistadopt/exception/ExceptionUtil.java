package com.gentoro.mistadopt.exception;

import java.time.Instant;
import java.util.Map;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is a
   * {@link ProvisionerException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof ProvisionerException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        ProvisionerErrorCode.UNKNOWN,
        Map.of(),
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frames first.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a single-line, user-facing message from a throwable.
   *
   * <p>The first provisioner exception in the cause chain wins, its message is written for
   * operators. Otherwise the deepest cause with a message is preferred, since wrapper exceptions
   * (e.g. {@link java.util.concurrent.ExecutionException}) only repeat the cause's {@code
   * toString()}.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable best = t;
    Throwable current = t;
    int depth = 0;
    while (current != null && depth++ < 20) {
      if (current instanceof ProvisionerException && !isBlank(current.getMessage())) {
        return singleLine(current.getMessage());
      }
      if (!isBlank(current.getMessage())) {
        best = current;
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }

    String className = best.getClass().getSimpleName();
    if (isBlank(best.getMessage())) {
      return className;
    }
    return className + ": " + singleLine(best.getMessage());
  }

  private static String singleLine(String message) {
    return message.replaceAll("\\s*\\R\\s*", " ").trim();
  }

  private static boolean isBlank(String s) {
    return s == null || s.trim().isEmpty();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
