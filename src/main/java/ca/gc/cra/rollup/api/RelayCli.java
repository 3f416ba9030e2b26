package ca.gc.cra.rollup.api;

import ca.gc.cra.rollup.adapter.kafka.KafkaCompressedOutputAdapter;
import ca.gc.cra.rollup.adapter.kafka.KafkaPayloadReader;
import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.application.pipeline.RelayUseCase;
import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.config.RelayConfig;
import ca.gc.cra.rollup.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rollup.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rollup.validation.Durations;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-running relay: consumes raw payloads from one Kafka topic, compresses them, and publishes the
 * results to another. Stops on SIGINT/SIGTERM.
 *
 * @since 0.1.0
 */
public final class RelayCli {
  private static final Logger log = LoggerFactory.getLogger(RelayCli.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 10;
  private static final String SUMMARY_USAGE =
      "usage: relay kafkaBootstrap=HOST:PORT [inputTopic=TOPIC] [outputTopic=TOPIC] "
          + "[groupId=ID] [pollMillis=N] [config=rollup.yaml] [workers=N] [timestamp=FIELD] "
          + "[values=F1,F2] [groupBy=F1,F2] [unique=F1,F2] [method=NAME] [window=60s] "
          + "[--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      rollup relay

      Usage:
        relay kafkaBootstrap=localhost:9092 [options]

      Required:
        kafkaBootstrap=HOST:PORT  Comma-separated Kafka brokers

      Optional:
        config=PATH               YAML file; keys under common: and relay: apply
        inputTopic=TOPIC          Raw payload topic (default timeseries.raw)
        outputTopic=TOPIC         Compressed payload topic (default timeseries.compressed)
        groupId=ID                Consumer group shared by relay instances (default compressor)
        pollMillis=N              Poll timeout in milliseconds, 1-60000 (default 500)
        workers=N                 Concurrent compressions per poll (default 4)
        timestamp=FIELD           Timestamp path, Unix seconds (default timestamp)
        values=F1,F2              Value paths (default value)
        groupBy=F1,F2             Paths copied onto every aggregated record
        unique=F1,F2              Paths whose distinct values are never merged
        method=NAME               sum, avg, min, max, count, first, last (default sum)
        window=DURATION           Window width such as 60s, 5m, PT1M (default 60s)
        --dry-run                 Validate settings and print the plan without connecting
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Payloads that fail to compress or publish are logged and dropped; the relay keeps running.
      """;

  private RelayCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliSupport.Setup setup = CliSupport.prepare("relay", args, SUMMARY_USAGE, HELP_TEXT, log);
    if (setup.done()) {
      return setup.exit();
    }
    CliSupport.Prepared prepared = setup.prepared();
    Map<String, String> effective = prepared.config();

    CompressorConfig compressorConfig;
    RelayConfig relayConfig;
    try {
      compressorConfig = CompressorConfig.fromMap(effective);
      relayConfig = RelayConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid relay arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (prepared.dryRun()) {
      CliPrinter.printLines(
          "Relay dry-run: no connection will be opened.",
          " Kafka bootstrap   : " + relayConfig.bootstrapServers(),
          " Input topic       : " + relayConfig.inputTopic(),
          " Output topic      : " + relayConfig.outputTopic(),
          " Consumer group    : " + relayConfig.groupId(),
          " Poll timeout      : " + Durations.format(relayConfig.pollTimeout()),
          " Workers           : " + compressorConfig.workers(),
          " Timestamp field   : " + compressorConfig.timestampField(),
          " Value fields      : " + String.join(",", compressorConfig.valueFields()),
          " Group-by fields   : " + CompressCli.describe(compressorConfig.groupByFields()),
          " Unique fields     : " + CompressCli.describe(compressorConfig.uniqueFields()),
          " Method            : " + compressorConfig.method(),
          " Window            : " + Durations.format(compressorConfig.window()),
          " Re-run without --dry-run to start relaying.");
      return ExitCode.SUCCESS;
    }

    return CliSupport.execute("relay", log, () -> {
      CountDownLatch finished = new CountDownLatch(1);
      try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
          KafkaPayloadReader source = new KafkaPayloadReader(
              relayConfig.bootstrapServers(), relayConfig.inputTopic(), relayConfig.groupId());
          KafkaCompressedOutputAdapter sink = new KafkaCompressedOutputAdapter(
              relayConfig.bootstrapServers(), relayConfig.outputTopic(), metrics)) {
        RelayUseCase relay = new RelayUseCase(
            source, new TimeSeriesCompressor(compressorConfig, metrics), sink, metrics);
        Runtime.getRuntime().addShutdownHook(
            ExecutorFactories.newNamedThread("rollup-relay-shutdown", () -> awaitShutdown(relay, finished)));
        log.info("Relaying {} -> {} via {} (group={}, metricsExporter={})",
            relayConfig.inputTopic(), relayConfig.outputTopic(), relayConfig.bootstrapServers(),
            relayConfig.groupId(), prepared.metricsExporter());
        relay.run(relayConfig.pollTimeout());
      } finally {
        // Released only after the producer has flushed and both clients are closed.
        finished.countDown();
      }
      return ExitCode.SUCCESS;
    });
  }

  private static void awaitShutdown(RelayUseCase relay, CountDownLatch finished) {
    log.info("Shutdown requested; stopping relay");
    relay.stop();
    try {
      if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Relay did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for relay shutdown");
    }
  }
}
