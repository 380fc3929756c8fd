package com.gentoro.mistadopt.fetch;

import com.gentoro.mistadopt.exception.FetchException;

/** Remote source of adoption configurations. */
public interface AdoptionConfigClient {

  /**
   * Retrieve the adoption configuration for a site.
   *
   * @throws FetchException when the configuration cannot be obtained; never returns partial data
   */
  RawConfig fetch(String orgId, String siteId, String apiKey) throws FetchException;
}
