package ca.gc.cra.rollup.api;

import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.application.pipeline.CompressUseCase;
import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.infrastructure.file.FileCompressedOutputAdapter;
import ca.gc.cra.rollup.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rollup.validation.Durations;
import ca.gc.cra.rollup.validation.Paths;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compresses one JSON array file into one output file.
 *
 * @since 0.1.0
 */
public final class CompressCli {
  private static final Logger log = LoggerFactory.getLogger(CompressCli.class);
  private static final String SUMMARY_USAGE =
      "usage: compress in=FILE out=FILE [config=rollup.yaml] [timestamp=FIELD] [values=F1,F2] "
          + "[groupBy=F1,F2] [unique=F1,F2] [method=sum|avg|min|max|count|first|last] "
          + "[window=60s] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      rollup compress

      Usage:
        compress in=./raw.json out=./compressed.json [options]

      Required:
        in=FILE                   JSON array of data points
        out=FILE                  Destination for the compressed JSON array

      Optional:
        config=PATH               YAML file; keys under common: and compress: apply
        timestamp=FIELD           Timestamp path, Unix seconds (default timestamp)
        values=F1,F2              Value paths (default value)
        groupBy=F1,F2             Paths copied onto every aggregated record
        unique=F1,F2              Paths whose distinct values are never merged
        method=NAME               sum, avg, min, max, count, first, last (default sum)
        window=DURATION           Window width such as 60s, 5m, PT1M (default 60s)
        --dry-run                 Validate inputs and print the plan without compressing
        --allow-overwrite         Replace an existing output file
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Paths may be nested (device.id, tags.0). Records without a timestamp are skipped.
      """;

  private CompressCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the command and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliSupport.Setup setup = CliSupport.prepare("compress", args, SUMMARY_USAGE, HELP_TEXT, log);
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
      input = Paths.requireReadableFile("in", Path.of(effective.get("in").trim()));
      output = Paths.validateWritableFile("out", Path.of(effective.get("out").trim()), prepared.allowOverwrite());
      if (input.equals(output)) {
        throw new IllegalArgumentException("out must differ from in");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid compress arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (prepared.dryRun()) {
      CliPrinter.printLines(
          "Compress dry-run: no output will be written.",
          " Input file        : " + input,
          " Output file       : " + output,
          " Timestamp field   : " + config.timestampField(),
          " Value fields      : " + String.join(",", config.valueFields()),
          " Group-by fields   : " + describe(config.groupByFields()),
          " Unique fields     : " + describe(config.uniqueFields()),
          " Method            : " + config.method(),
          " Window            : " + Durations.format(config.window()),
          " Allow overwrite   : " + prepared.allowOverwrite(),
          " Re-run without --dry-run to compress.");
      return ExitCode.SUCCESS;
    }

    return CliSupport.execute("compress", log, () -> {
      log.info("Compressing {} into {} (method={}, window={}, metricsExporter={})",
          input, output, config.method(), Durations.format(config.window()), prepared.metricsExporter());
      try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
          FileCompressedOutputAdapter sink = new FileCompressedOutputAdapter(output.getParent())) {
        CompressUseCase useCase = new CompressUseCase(new TimeSeriesCompressor(config, metrics), sink);
        useCase.run(input, output.getFileName().toString());
      }
      return ExitCode.SUCCESS;
    });
  }

  static String describe(List<String> fields) {
    return fields.isEmpty() ? "<none>" : String.join(",", fields);
  }
}
