package com.gentoro.mistadopt.inventory;

import java.util.Objects;

/** Identifies one adoption configuration: the (organization, site) pair. */
public record FetchKey(String orgId, String siteId) {
  public FetchKey {
    Objects.requireNonNull(orgId, "orgId");
    Objects.requireNonNull(siteId, "siteId");
  }

  @Override
  public String toString() {
    return orgId + "/" + siteId;
  }
}
