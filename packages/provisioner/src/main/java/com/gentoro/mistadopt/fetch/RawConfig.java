package com.gentoro.mistadopt.fetch;

import com.gentoro.mistadopt.inventory.FetchKey;
import java.util.Objects;

/**
 * Adoption configuration text exactly as returned by the Mist API for one {@link FetchKey}. Shared
 * read-only by every device mapped to that key.
 */
public record RawConfig(FetchKey key, String text) {
  public RawConfig {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(text, "text");
  }

  @Override
  public String toString() {
    return "RawConfig[key=%s, %d chars]".formatted(key, text.length());
  }
}
