package ca.gc.cra.rollup.config;

import ca.gc.cra.rollup.validation.Durations;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each rollup command.
 *
 * <p>Compressor defaults are rendered from {@link CompressorConfig#defaults()} and relay defaults
 * from the {@link RelayConfig} constants so the map and the typed configs cannot drift.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command name (compress, batch, relay)
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "compress", "batch" -> buildFileDefaults();
      case "relay" -> buildRelayDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    CompressorConfig defaults = CompressorConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("timestamp", defaults.timestampField());
    map.put("values", String.join(",", defaults.valueFields()));
    map.put("groupBy", "");
    map.put("unique", "");
    map.put("method", defaults.method());
    map.put("window", Durations.format(defaults.window()));
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildFileDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildRelayDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("kafkaBootstrap", "");
    map.put("inputTopic", RelayConfig.DEFAULT_INPUT_TOPIC);
    map.put("outputTopic", RelayConfig.DEFAULT_OUTPUT_TOPIC);
    map.put("groupId", RelayConfig.DEFAULT_GROUP_ID);
    map.put("pollMillis", Integer.toString(RelayConfig.DEFAULT_POLL_MILLIS));
    map.put("dryRun", "false");
    return map;
  }
}
