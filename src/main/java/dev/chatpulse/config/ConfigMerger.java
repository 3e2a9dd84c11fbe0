package dev.chatpulse.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI overrides; may be {@code null}
   * @param defaults embedded defaults; may be {@code null}
   * @param warn receives a message for each CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlValues.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter"));
    String endpoint = trim(effective.get("otelEndpoint"));
    if (exporter.equalsIgnoreCase("none") && !endpoint.isEmpty()) {
      throw new IllegalArgumentException("otelEndpoint requires metricsExporter=otlp");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
