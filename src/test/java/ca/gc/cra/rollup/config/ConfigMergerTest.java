package ca.gc.cra.rollup.config;

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
  void cliOverridesYamlWhichOverridesDefaults() {
    Map<String, String> defaults = Map.of("method", "sum", "window", "60s", "in", "", "out", "");
    Map<String, String> yaml = Map.of("method", "avg", "window", "5m");
    Map<String, String> cli = Map.of("method", "max", "in", "raw.json", "out", "out.json");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "compress", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("max", merged.get("method"));
    assertEquals("5m", merged.get("window"));
    assertEquals("raw.json", merged.get("in"));
    assertEquals(List.of("CLI overrides YAML for key: method"), warnings);
  }

  @Test
  void fileModesRequireInputAndOutput() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "batch", Optional.empty(), Map.of("in", "dir"), Map.of(), msg -> {}));
    assertTrue(ex.getMessage().contains("out is required"));
  }

  @Test
  void relayRequiresBootstrap() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "relay", Optional.of(Map.of()), Map.of(), Map.of("kafkaBootstrap", ""), msg -> {}));
    assertTrue(ex.getMessage().contains("kafkaBootstrap is required"));
  }
}
