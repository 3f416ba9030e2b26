package ca.gc.cra.rollup.api;

import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.application.pipeline.BatchUseCase;
import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.infrastructure.file.FileCompressedOutputAdapter;
import ca.gc.cra.rollup.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rollup.validation.Durations;
import ca.gc.cra.rollup.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compresses every {@code *.json} file of a directory concurrently, writing results under the same
 * file names in an output directory.
 *
 * @since 0.1.0
 */
public final class BatchCli {
  private static final Logger log = LoggerFactory.getLogger(BatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: batch in=DIR out=DIR [config=rollup.yaml] [workers=N] [timestamp=FIELD] "
          + "[values=F1,F2] [groupBy=F1,F2] [unique=F1,F2] [method=NAME] [window=60s] "
          + "[--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      rollup batch

      Usage:
        batch in=./raw out=./compressed [options]

      Required:
        in=DIR                    Directory of *.json arrays
        out=DIR                   Output directory (created when missing)

      Optional:
        config=PATH               YAML file; keys under common: and batch: apply
        workers=N                 Concurrent compressions, 1-1024 (default 4)
        timestamp=FIELD           Timestamp path, Unix seconds (default timestamp)
        values=F1,F2              Value paths (default value)
        groupBy=F1,F2             Paths copied onto every aggregated record
        unique=F1,F2              Paths whose distinct values are never merged
        method=NAME               sum, avg, min, max, count, first, last (default sum)
        window=DURATION           Window width such as 60s, 5m, PT1M (default 60s)
        --dry-run                 Validate directories and print the plan
        --allow-overwrite         Write into a non-empty output directory
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Files that cannot be compressed are logged and skipped; the exit code is then 5.
      """;

  private BatchCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliSupport.Setup setup = CliSupport.prepare("batch", args, SUMMARY_USAGE, HELP_TEXT, log);
    if (setup.done()) {
      return setup.exit();
    }
    CliSupport.Prepared prepared = setup.prepared();
    Map<String, String> effective = prepared.config();

    CompressorConfig config;
    Path input;
    Path output;
    try {
      config = CompressorConfig.fromMap(effective);
      input = Paths.requireReadableDir("in", Path.of(effective.get("in").trim()));
      Path requested = Path.of(effective.get("out").trim());
      if (requested.toAbsolutePath().normalize().equals(input)) {
        throw new IllegalArgumentException("out must differ from in");
      }
      output = Paths.validateWritableDir(requested, !prepared.dryRun(), prepared.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid batch arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (prepared.dryRun()) {
      CliPrinter.printLines(
          "Batch dry-run: no output will be written.",
          " Input directory   : " + input,
          " Output directory  : " + output,
          " Workers           : " + config.workers(),
          " Timestamp field   : " + config.timestampField(),
          " Value fields      : " + String.join(",", config.valueFields()),
          " Group-by fields   : " + CompressCli.describe(config.groupByFields()),
          " Unique fields     : " + CompressCli.describe(config.uniqueFields()),
          " Method            : " + config.method(),
          " Window            : " + Durations.format(config.window()),
          " Allow overwrite   : " + prepared.allowOverwrite(),
          " Re-run without --dry-run to compress.");
      return ExitCode.SUCCESS;
    }

    return CliSupport.execute("batch", log, () -> {
      log.info("Compressing {} into {} with {} workers (metricsExporter={})",
          input, output, config.workers(), prepared.metricsExporter());
      BatchUseCase.Summary summary;
      try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
          FileCompressedOutputAdapter sink = new FileCompressedOutputAdapter(output)) {
        summary = new BatchUseCase(new TimeSeriesCompressor(config, metrics), sink).run(input);
      }
      if (summary.failed() > 0) {
        log.error("{} of {} files could not be compressed", summary.failed(), summary.total());
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    });
  }
}
