package ca.gc.cra.faultline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndProfileSections() throws IOException {
    Path yaml = tempDir.resolve("faultline.yaml");
    Files.writeString(yaml, """
        common:
          environment: staging
          sampleRate: 0.5
        production:
          environment: production
          release: 2.4.1
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "Production");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("production", map.get("environment"));
    assertEquals("0.5", map.get("sampleRate"));
    assertEquals("2.4.1", map.get("release"));
  }

  @Test
  void loadFlattensNestedMapsAndJoinsLists() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          includedEnvironments: [production, staging]
          tags:
            team: payments
          transport:
            kafka:
              topic: errors
          release:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "dev").orElseThrow();
    assertEquals("production,staging", map.get("includedEnvironments"));
    assertEquals("payments", map.get("tags.team"));
    assertEquals("errors", map.get("transport.kafka.topic"));
    assertEquals("", map.get("release"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result =
        YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "production");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsNoValues() {
    assertTrue(YamlConfigLoader.load(new StringReader(""), "production", "inline").isEmpty());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - production:
            dsn: http://k@host/1
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "production"));
  }

  @Test
  void listEntriesMustBeCommaFreeScalars() {
    String nested = """
        common:
          inApp:
            includes: [[com.example]]
        """;
    String commas = """
        common:
          inApp:
            includes: ["com.a,com.b"]
        """;

    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(new StringReader(nested), "common", "nested"));
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(new StringReader(commas), "common", "commas"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(new StringReader("common: [unclosed"), "production", "broken.yaml"));

    assertTrue(ex.getMessage().contains("broken.yaml"), ex.getMessage());
  }
}
