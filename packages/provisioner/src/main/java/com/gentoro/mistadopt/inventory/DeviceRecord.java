package com.gentoro.mistadopt.inventory;

import com.gentoro.mistadopt.exception.InventoryException;

/**
 * One device of the inventory. Immutable; every field is required.
 *
 * @param orgId Mist organization id
 * @param siteId Mist site id
 * @param ip management address used for the NETCONF session
 * @param username device login
 * @param password device password, never rendered by {@link #toString()}
 */
public record DeviceRecord(
    String orgId, String siteId, String ip, String username, String password) {

  public DeviceRecord {
    orgId = require("org_id", orgId, ip);
    siteId = require("site_id", siteId, ip);
    ip = require("ip", ip, ip);
    username = require("user_id", username, ip);
    if (password == null || password.isEmpty()) {
      throw new InventoryException("Device %s: missing required field 'password'".formatted(ip));
    }
  }

  public FetchKey fetchKey() {
    return new FetchKey(orgId, siteId);
  }

  @Override
  public String toString() {
    return "DeviceRecord[ip=%s, org=%s, site=%s, user=%s]".formatted(ip, orgId, siteId, username);
  }

  private static String require(String field, String value, String ip) {
    if (value == null || value.isBlank()) {
      String who = ip == null || ip.isBlank() ? "<unknown>" : ip.trim();
      throw new InventoryException(
          "Device %s: missing required field '%s'".formatted(who, field));
    }
    return value.trim();
  }
}
