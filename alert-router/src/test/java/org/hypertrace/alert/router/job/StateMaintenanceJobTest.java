package org.hypertrace.alert.router.job;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.silence.SilenceStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.quartz.CronTrigger;
import org.quartz.JobExecutionContext;
import org.quartz.JobKey;
import org.quartz.Scheduler;

class StateMaintenanceJobTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir Path tempDir;

  private final AtomicReference<Instant> now = new AtomicReference<>(T0);
  private Clock clock;
  private NotificationLog notificationLog;
  private SilenceStore silenceStore;
  private Inhibitor inhibitor;

  @BeforeEach
  void setUp() {
    clock = mock(Clock.class);
    when(clock.instant()).thenAnswer(invocation -> now.get());
    notificationLog = new NotificationLog("peer-0", clock, Duration.ofHours(1));
    silenceStore = mock(SilenceStore.class);
    inhibitor = mock(Inhibitor.class);
  }

  @Test
  void testCollectsGarbageAndWritesSnapshot() throws Exception {
    Path snapshot = tempDir.resolve("nflog.snap");
    notificationLog.log("ops", "{}:{a=\"1\"}", Set.of(1L), Set.of());
    now.set(T0.plus(Duration.ofMinutes(45)));
    notificationLog.log("ops", "{}:{a=\"2\"}", Set.of(2L), Set.of());
    now.set(T0.plus(Duration.ofMinutes(90)));

    StateMaintenanceJobManager jobManager =
        new StateMaintenanceJobManager(notificationLog, silenceStore, inhibitor);
    jobManager.initJob(
        ConfigFactory.parseMap(Map.of("state.nflog.snapshotFile", snapshot.toString())));
    new StateMaintenanceJob().execute(context(jobManager));

    Assertions.assertEquals(1, notificationLog.size());
    Assertions.assertEquals(1, Files.readAllLines(snapshot).size());
    verify(silenceStore).maintenance(Optional.empty());
    verify(inhibitor).gc();

    NotificationLog restored = new NotificationLog("peer-1", clock, Duration.ofDays(1));
    restored.restore(snapshot);
    Assertions.assertTrue(restored.query("ops", "{}:{a=\"2\"}").isPresent());
    Assertions.assertTrue(restored.query("ops", "{}:{a=\"1\"}").isEmpty());
  }

  @Test
  void testSnapshotsAreSkippedWithoutFiles() throws Exception {
    StateMaintenanceJobManager jobManager =
        new StateMaintenanceJobManager(notificationLog, silenceStore, inhibitor);
    jobManager.initJob(ConfigFactory.empty());

    new StateMaintenanceJob().execute(context(jobManager));

    verify(silenceStore).maintenance(Optional.empty());
    try (Stream<Path> files = Files.list(tempDir)) {
      Assertions.assertEquals(0, files.count());
    }
  }

  @Test
  void testCronExpression() {
    StateMaintenanceJobManager defaults =
        new StateMaintenanceJobManager(notificationLog, silenceStore, inhibitor);
    defaults.initJob(ConfigFactory.empty());
    Assertions.assertEquals(
        "0 0/15 * * * ?", ((CronTrigger) defaults.getJobTrigger()).getCronExpression());

    StateMaintenanceJobManager configured =
        new StateMaintenanceJobManager(notificationLog, silenceStore, inhibitor);
    Config config =
        ConfigFactory.parseMap(Map.of("state.maintenance.cronExpression", "0 0 * * * ?"));
    configured.initJob(config);
    Assertions.assertEquals(
        "0 0 * * * ?", ((CronTrigger) configured.getJobTrigger()).getCronExpression());
  }

  @Test
  void testStartAndStop() throws Exception {
    StateMaintenanceJobManager jobManager =
        new StateMaintenanceJobManager(notificationLog, silenceStore, inhibitor);
    jobManager.initJob(ConfigFactory.empty());
    Scheduler scheduler = mock(Scheduler.class);
    JobKey jobKey = jobManager.getJobDetail().getKey();

    jobManager.startJob(scheduler);
    verify(scheduler).scheduleJob(jobManager.getJobDetail(), jobManager.getJobTrigger());

    when(scheduler.checkExists(jobKey)).thenReturn(false);
    jobManager.stopJob(scheduler);
    verify(scheduler, never()).deleteJob(jobKey);

    when(scheduler.checkExists(jobKey)).thenReturn(true);
    jobManager.stopJob(scheduler);
    verify(scheduler).deleteJob(jobKey);
  }

  private static JobExecutionContext context(StateMaintenanceJobManager jobManager) {
    JobExecutionContext context = mock(JobExecutionContext.class);
    when(context.getJobDetail()).thenReturn(jobManager.getJobDetail());
    return context;
  }
}
