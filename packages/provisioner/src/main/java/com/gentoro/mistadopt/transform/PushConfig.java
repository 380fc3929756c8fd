package com.gentoro.mistadopt.transform;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Configuration text ready to be loaded onto a device as {@code set} commands. */
public record PushConfig(String text) {
  public PushConfig {
    Objects.requireNonNull(text, "text");
  }

  /** The configuration split on line feeds; empty lines are kept. */
  public List<String> lines() {
    return Arrays.asList(text.split("\n", -1));
  }
}
