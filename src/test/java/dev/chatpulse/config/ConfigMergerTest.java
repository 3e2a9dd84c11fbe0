package dev.chatpulse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("workers", "3", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("workers", "2", "host", "chat.example.net");
    Map<String, String> cli = Map.of("workers", "6", "host", "chat2.example.net");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("6", merged.get("workers"));
    assertEquals("chat2.example.net", merged.get("host"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: workers"));
    assertTrue(warnings.contains("CLI overrides YAML for key: host"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("zone", "UTC")), Map.of(), MonitorDefaults.asFlatMap(), warnings::add);

    assertEquals("UTC", merged.get("zone"));
    assertEquals("3", merged.get("workers"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void otelEndpointRequiresOtlpExporter() {
    Map<String, String> cli = Map.of("metricsExporter", "none", "otelEndpoint", "http://collector:4317");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(Optional.empty(), cli, MonitorDefaults.asFlatMap(), msg -> { }));
  }
}
