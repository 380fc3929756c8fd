package com.gentoro.mistadopt.transform;

import com.gentoro.mistadopt.fetch.RawConfig;
import java.util.StringJoiner;

/**
 * Turns a raw adoption configuration into the configuration that is pushed.
 *
 * <p>Unless phone-home is kept, every line containing {@value #PHONE_HOME_DIRECTIVE} is dropped.
 * All other lines are kept byte for byte and in order. Lines are split on {@code \n} only, so
 * carriage returns and any other whitespace stay where they were.
 */
public final class ConfigTransformer {
  public static final String PHONE_HOME_DIRECTIVE = "delete system phone-home";

  private ConfigTransformer() {}

  public static PushConfig transform(RawConfig raw, boolean keepPhoneHome) {
    return new PushConfig(transform(raw.text(), keepPhoneHome));
  }

  public static String transform(String text, boolean keepPhoneHome) {
    if (keepPhoneHome || !text.contains(PHONE_HOME_DIRECTIVE)) {
      return text;
    }
    StringJoiner out = new StringJoiner("\n");
    for (String line : text.split("\n", -1)) {
      if (!line.contains(PHONE_HOME_DIRECTIVE)) {
        out.add(line);
      }
    }
    return out.toString();
  }
}
