package ca.gc.cra.faultline.application.event;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class InAppClassifierTest {
  private final InAppClassifier classifier =
      new InAppClassifier(List.of("java.util.concurrent.Custom"), List.of("java.", "org.junit."));

  @Test
  void excludedPrefixesAreNotInApp() {
    assertFalse(classifier.isInApp("java.lang.Thread"));
    assertFalse(classifier.isInApp("org.junit.platform.Launcher"));
    assertTrue(classifier.isInApp("com.example.Service"));
  }

  @Test
  void includesOverrideExcludes() {
    assertTrue(classifier.isInApp("java.util.concurrent.CustomPool"));
  }

  @Test
  void runtimeApplicationsAreNeverInApp() {
    assertFalse(classifier.isInApp("stdlib", "gen_server.loop/7"));
    assertFalse(classifier.isInApp("java.base", "com.example.Shaded"));
    assertTrue(classifier.isInApp("my_app", "MyApp.Worker.run/1"));
    assertTrue(classifier.isInApp(null, null));
  }
}
