package ca.gc.cra.tracker.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Loads {@link TrackerConfig} instances from {@code .properties} or YAML files.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} go through {@link YamlConfigLoader}; anything else is read
 * as Java properties. A missing file yields {@link TrackerConfig#defaults()}.</p>
 *
 * @since 0.1.0
 */
public final class TrackerConfigLoader {
  static final String DEFAULT_PROFILE = "default";

  private TrackerConfigLoader() {}

  /**
   * Loads configuration using the {@value #DEFAULT_PROFILE} YAML profile.
   *
   * @param path configuration file; may be {@code null} or non-existent to use defaults
   * @return configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static TrackerConfig load(Path path) throws IOException {
    return load(path, DEFAULT_PROFILE);
  }

  /**
   * Loads configuration from {@code path}.
   *
   * @param path configuration file; may be {@code null} or non-existent to use defaults
   * @param profile YAML profile merged over the {@code common} section; ignored for properties files
   * @return configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value fails validation
   */
  public static TrackerConfig load(Path path, String profile) throws IOException {
    if (path == null || !Files.exists(path)) {
      return TrackerConfig.defaults();
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".yaml") || name.endsWith(".yml")) {
      return TrackerConfig.fromMap(YamlConfigLoader.load(path, profile).orElse(Map.of()));
    }
    return fromProperties(path);
  }

  /**
   * Reads configuration properties from the given path.
   *
   * @param path properties file path; must exist
   * @return configuration populated with file values overriding defaults
   * @throws IOException if the file cannot be read
   */
  public static TrackerConfig fromProperties(Path path) throws IOException {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String key : props.stringPropertyNames()) {
      values.put(key, props.getProperty(key));
    }
    return TrackerConfig.fromMap(values);
  }
}
