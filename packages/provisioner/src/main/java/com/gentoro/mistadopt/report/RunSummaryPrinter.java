package com.gentoro.mistadopt.report;

import com.gentoro.mistadopt.orchestrator.PushResult;
import com.gentoro.mistadopt.orchestrator.ResultSet;

/** Human-readable end-of-run summary, one line per device ordered by IP. */
public final class RunSummaryPrinter {
  private RunSummaryPrinter() {}

  public static String render(ResultSet results) {
    StringBuilder sb = new StringBuilder();
    for (PushResult r : results.sortedByIp()) {
      sb.append(r.ip()).append(": ");
      if (r.isSuccess()) {
        sb.append("OK");
      } else {
        sb.append(r.category());
        if (r.detail() != null && !r.detail().isBlank()) {
          sb.append(" - ").append(r.detail());
        }
      }
      sb.append('\n');
    }
    sb.append(
        "Total: %d, succeeded: %d, failed: %d%n"
            .formatted(results.size(), results.successCount(), results.failureCount()));
    return sb.toString();
  }
}
