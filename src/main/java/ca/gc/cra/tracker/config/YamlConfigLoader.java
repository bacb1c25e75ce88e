package ca.gc.cra.tracker.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads tracker settings from a profile-sectioned YAML document into dotted keys.
 *
 * <p>Layout:</p>
 * <pre>
 * common:
 *   transport: logging
 * staging:
 *   dispatch:
 *     maxAttempts: 5
 * production:
 *   extends: staging
 *   transport: kafka
 * </pre>
 *
 * <p>{@code common} is applied first, then the chain of {@code extends} parents from the furthest ancestor down to
 * the requested profile. Profile names are case-insensitive. Lists are rejected.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  static final String EXTENDS_KEY = "extends";

  private YamlConfigLoader() {}

  /**
   * Resolves the settings of {@code profile}.
   *
   * @param path YAML file
   * @param profile profile section to apply over {@code common}
   * @return dotted key/value settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or {@code extends} forms a cycle
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = normalize(Objects.requireNonNull(profile, "profile"));
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Map<String, Map<?, ?>> sections = readSections(path);
    Map<String, String> settings = new LinkedHashMap<>();
    Map<?, ?> common = sections.get(COMMON_SECTION);
    if (common != null) {
      flatten(common, null, settings);
    }
    for (Map<?, ?> section : inheritanceChain(sections, wanted)) {
      flatten(section, null, settings);
    }
    settings.remove(EXTENDS_KEY);
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<?, ?>> readSections(Path path) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed YAML in " + path, ex);
    }
    Map<String, Map<?, ?>> sections = new LinkedHashMap<>();
    if (document == null) {
      return sections;
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must contain a mapping of profile sections");
    }
    root.forEach((name, body) -> {
      String section = normalize(String.valueOf(name));
      if (body == null) {
        sections.put(section, Map.of());
      } else if (body instanceof Map<?, ?> map) {
        sections.put(section, map);
      } else {
        throw new IllegalArgumentException("Section '" + name + "' in " + path + " must be a mapping");
      }
    });
    return sections;
  }

  private static Deque<Map<?, ?>> inheritanceChain(Map<String, Map<?, ?>> sections, String profile) {
    Deque<Map<?, ?>> chain = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    String current = profile;
    while (current != null && !COMMON_SECTION.equals(current)) {
      if (!seen.add(current)) {
        throw new IllegalArgumentException("Profile inheritance cycle through '" + current + "'");
      }
      Map<?, ?> section = sections.get(current);
      if (section == null) {
        break;
      }
      chain.addFirst(section);
      Object parent = section.get(EXTENDS_KEY);
      current = parent == null ? null : normalize(parent.toString());
    }
    return chain;
  }

  private static void flatten(Map<?, ?> node, String prefix, Map<String, String> out) {
    node.forEach((rawKey, value) -> {
      if (!(rawKey instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("Config keys must be non-blank strings (under '" + prefix + "')");
      }
      String dotted = prefix == null ? key : prefix + "." + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(nested, dotted, out);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Lists are not supported (key '" + dotted + "')");
      } else {
        out.put(dotted, value == null ? "" : value.toString());
      }
    });
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
