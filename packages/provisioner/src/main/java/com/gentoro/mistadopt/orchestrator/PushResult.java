package com.gentoro.mistadopt.orchestrator;

import com.gentoro.mistadopt.inventory.DeviceRecord;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of provisioning one device. Immutable.
 *
 * @param ip device management address
 * @param orgId organization the device was adopted into
 * @param siteId site the device was adopted into
 * @param status success or failure
 * @param category {@link FailureCategory#NONE} on success
 * @param detail diagnostic message, null on success
 * @param duration wall time spent on the device task
 */
public record PushResult(
    String ip,
    String orgId,
    String siteId,
    PushStatus status,
    FailureCategory category,
    String detail,
    Duration duration) {

  public PushResult {
    Objects.requireNonNull(ip, "ip");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(duration, "duration");
    if ((status == PushStatus.SUCCESS) != (category == FailureCategory.NONE)) {
      throw new IllegalArgumentException(
          "Inconsistent result: status=%s category=%s".formatted(status, category));
    }
  }

  public static PushResult success(DeviceRecord device, Duration duration) {
    return new PushResult(
        device.ip(),
        device.orgId(),
        device.siteId(),
        PushStatus.SUCCESS,
        FailureCategory.NONE,
        null,
        duration);
  }

  public static PushResult failed(
      DeviceRecord device, FailureCategory category, String detail, Duration duration) {
    return new PushResult(
        device.ip(), device.orgId(), device.siteId(), PushStatus.FAILED, category, detail, duration);
  }

  public static PushResult cancelled(DeviceRecord device) {
    return failed(device, FailureCategory.CANCELLED, "Cancelled before start", Duration.ZERO);
  }

  public boolean isSuccess() {
    return status == PushStatus.SUCCESS;
  }
}
