package com.gentoro.mistadopt.device;

import com.gentoro.mistadopt.inventory.DeviceRecord;

/** Creates unconnected sessions; shared by all worker threads. */
@FunctionalInterface
public interface DeviceSessionFactory {
  DeviceSession create(DeviceRecord device);
}
