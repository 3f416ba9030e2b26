package ca.gc.cra.rollup.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RelayCliTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RelayCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingBootstrapReturnsUsageAndInvalidArgs() {
    ExitCode code = RelayCli.run(new String[] {"--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: relay"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("kafkaBootstrap is required")));
  }

  @Test
  void malformedBootstrapReturnsInvalidArgs() {
    ExitCode code = RelayCli.run(new String[] {"kafkaBootstrap=broker", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() {
    ExitCode code = RelayCli.run(new String[] {
        "kafkaBootstrap=broker1:9092, broker2:9092",
        "inputTopic=metrics.raw",
        "groupId=rollup",
        "pollMillis=250",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Relay dry-run: no connection will be opened."));
    assertTrue(text.contains("Kafka bootstrap   : broker1:9092,broker2:9092"));
    assertTrue(text.contains("Input topic       : metrics.raw"));
    assertTrue(text.contains("Output topic      : timeseries.compressed"));
    assertTrue(text.contains("Consumer group    : rollup"));
    assertTrue(text.contains("Poll timeout      : 250ms"));
  }
}
