package ca.gc.cra.faultline.testutil;

import ca.gc.cra.faultline.config.ClientConfig;
import java.util.HashMap;
import java.util.Map;

/** Builds {@link ClientConfig}s for tests with a fixed server name. */
public final class TestConfigs {
  private TestConfigs() {}

  public static ClientConfig config(String... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("keyValues must be pairs");
    }
    Map<String, String> values = new HashMap<>();
    values.put("serverName", "test-host");
    for (int i = 0; i < keyValues.length; i += 2) {
      values.put(keyValues[i], keyValues[i + 1]);
    }
    return ClientConfig.fromMap(values);
  }
}
