package ca.gc.cra.nmapper.infrastructure.notify;

import static ca.gc.cra.nmapper.testing.Fixtures.T0;
import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static ca.gc.cra.nmapper.testing.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nmapper.application.diff.SnapshotDiffEngine;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.testing.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingNotificationAdapterTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger("nmapper.notifications");
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void significantChangeIsOneWarnLine() {
    NetworkSnapshot before = snapshot("s1", T0, device("10.0.0.1", 22));
    NetworkSnapshot after = snapshot("s2", T0.plusSeconds(300), device("10.0.0.1", 22, 80), device("10.0.0.2"));
    LoggingNotificationAdapter adapter = new LoggingNotificationAdapter(metrics);

    adapter.significantChange(after, new SnapshotDiffEngine().diff(before, after), 1);

    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    String message = event.getFormattedMessage();
    assertTrue(message.startsWith("Significant network change ["));
    assertTrue(message.contains("snapshot=s2"));
    assertTrue(message.contains("previous=s1"));
    assertTrue(message.contains("total=3"));
    assertTrue(message.contains("joined=1"));
    assertEquals(1, metrics.count("notify.log.significantChange"));
  }

  @Test
  void scanFailureNamesJobAndTarget() {
    new LoggingNotificationAdapter(null).scanFailed("job-7", "10.0.0.0/24", 3, "scanner exited with code 1");

    String message = appender.list.get(0).getFormattedMessage();
    assertEquals("Scan failed [job=job-7, target=10.0.0.0/24, attempts=3]: scanner exited with code 1", message);
  }
}
