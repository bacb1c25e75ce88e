package ca.gc.cra.tracker.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void profileOverridesCommonAndKeysAreFlattened() throws IOException {
    Path yaml = tempDir.resolve("tracker.yaml");
    Files.writeString(yaml, """
        common:
          transport: logging
          dispatch:
            maxAttempts: 3
        prod:
          transport: kafka
          kafka:
            bootstrap: broker:9092
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "PROD").orElseThrow();

    assertEquals("kafka", map.get("transport"));
    assertEquals("3", map.get("dispatch.maxAttempts"));
    assertEquals("broker:9092", map.get("kafka.bootstrap"));
  }

  @Test
  void profilesInheritThroughExtends() throws IOException {
    Path yaml = tempDir.resolve("chain.yaml");
    Files.writeString(yaml, """
        common:
          transport: logging
        staging:
          dispatch:
            maxAttempts: 5
          metrics:
            enabled: true
        production:
          extends: staging
          transport: kafka
          dispatch:
            maxAttempts: 7
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "production").orElseThrow();

    assertEquals("kafka", map.get("transport"));
    assertEquals("7", map.get("dispatch.maxAttempts"));
    assertEquals("true", map.get("metrics.enabled"));
    assertFalse(map.containsKey("extends"));
  }

  @Test
  void extendsCycleIsRejected() throws IOException {
    Path yaml = tempDir.resolve("cycle.yaml");
    Files.writeString(yaml, """
        a:
          extends: b
        b:
          extends: a
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "a"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "default").isPresent());
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("arrays.yaml");
    Files.writeString(yaml, """
        common:
          transport:
            - kafka
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "default"));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - transport: kafka
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "default"));
  }
}
