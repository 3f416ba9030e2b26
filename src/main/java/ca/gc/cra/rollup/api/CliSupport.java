package ca.gc.cra.rollup.api;

import ca.gc.cra.rollup.application.compress.InputFormatException;
import ca.gc.cra.rollup.config.ConfigMerger;
import ca.gc.cra.rollup.config.DefaultsForMode;
import ca.gc.cra.rollup.config.YamlConfigLoader;
import ca.gc.cra.rollup.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Argument handling shared by the {@code compress}, {@code batch}, and {@code relay} commands:
 * help, verbose logging, YAML loading, default merging, telemetry properties, and the mapping of
 * run-time exceptions to exit codes.
 */
final class CliSupport {
  private CliSupport() {
    // Utility
  }

  /**
   * Resolves the effective configuration for {@code mode}.
   *
   * <p>Returns an {@link Setup#exit() exit code} instead of a configuration when help was printed
   * or the arguments were rejected; the caller returns it unchanged.</p>
   */
  static Setup prepare(String mode, String[] args, String summaryUsage, String helpText, Logger log) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return Setup.halt(ExitCode.SUCCESS);
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      return invalid(log, summaryUsage, "Invalid argument: {}", ex);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(summaryUsage);
        return Setup.halt(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        return invalid(log, summaryUsage, "Invalid YAML configuration: {}", ex);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Setup.halt(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    boolean dryRun;
    boolean allowOverwrite;
    String metricsExporter;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled from configuration");
      }
      dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
      allowOverwrite = input.hasFlag("--allow-overwrite")
          || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");
      metricsExporter = effective.getOrDefault("metricsExporter", "none");
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      return invalid(log, summaryUsage, "Invalid " + mode + " arguments: {}", ex);
    }
    return new Setup(new Prepared(Map.copyOf(effective), dryRun, allowOverwrite, metricsExporter), null);
  }

  /**
   * Runs a command body and maps its failures to exit codes.
   *
   * @param mode command name used in log messages
   * @param log command logger
   * @param body work to run
   * @return the body's exit code, or the code for the exception it raised
   */
  static ExitCode execute(String mode, Logger log, CommandBody body) {
    try {
      return body.run();
    } catch (InputFormatException ex) {
      log.error("{} failed: {}", mode, ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", mode, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} I/O failure", mode, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", mode, ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Setup invalid(Logger log, String summaryUsage, String format, IllegalArgumentException ex) {
    log.error(format, ex.getMessage());
    CliPrinter.println(summaryUsage);
    return Setup.halt(ExitCode.INVALID_ARGS);
  }

  @FunctionalInterface
  interface CommandBody {
    ExitCode run() throws Exception;
  }

  /**
   * Effective settings for one invocation.
   *
   * @param config merged configuration with telemetry keys removed
   * @param dryRun whether to print the plan and stop
   * @param allowOverwrite whether existing outputs may be replaced
   * @param metricsExporter exporter selected for this run, for logging
   */
  record Prepared(
      Map<String, String> config, boolean dryRun, boolean allowOverwrite, String metricsExporter) {}

  /** Either a prepared configuration or the exit code to return immediately. */
  record Setup(Prepared prepared, ExitCode exit) {
    static Setup halt(ExitCode code) {
      return new Setup(null, code);
    }

    boolean done() {
      return exit != null;
    }
  }
}
