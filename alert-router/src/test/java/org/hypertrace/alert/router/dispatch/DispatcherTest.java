package org.hypertrace.alert.router.dispatch;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import com.typesafe.config.ConfigFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.notification.notifier.Notifier;
import org.hypertrace.alert.router.notification.pipeline.AlertMarker;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;
import org.hypertrace.alert.router.notification.pipeline.NotificationOutcome;
import org.hypertrace.alert.router.notification.pipeline.NotificationPipeline;
import org.hypertrace.alert.router.notification.pipeline.NotificationPipelineBuilder;
import org.hypertrace.alert.router.notification.pipeline.RetryPolicy;
import org.hypertrace.alert.router.notification.pipeline.Stage;
import org.hypertrace.alert.router.notification.pipeline.StageResult;
import org.hypertrace.alert.router.notification.route.Route;
import org.hypertrace.alert.router.notification.route.RouteTreeReader;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.nflog.NotificationLogEntry;
import org.hypertrace.alert.router.state.silence.SilenceStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class DispatcherTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
  private static final String RECEIVER = "checkout-team";

  private final AtomicReference<Instant> now = new AtomicReference<>(T0);
  private Clock clock;
  private ManualFlushScheduler flushScheduler;
  private Inhibitor inhibitor;
  private AlertMarker alertMarker;
  private NotificationLog notificationLog;
  private Notifier notifier;

  @BeforeEach
  void setUp() {
    clock = mock(Clock.class);
    when(clock.instant()).thenAnswer(invocation -> now.get());
    flushScheduler = new ManualFlushScheduler(now);
    inhibitor = new Inhibitor(List.of(), clock);
    alertMarker = new AlertMarker();
    notificationLog = new NotificationLog("peer-0", clock, Duration.ofDays(5));
    notifier = mock(Notifier.class);
    when(notifier.getIntegration()).thenReturn("webhook");
    when(notifier.isSendResolved()).thenReturn(true);
  }

  @Test
  void testFlushesAfterGroupWaitThenEveryGroupInterval() {
    List<Instant> flushTimes = new ArrayList<>();
    Stage recording =
        (context, batch) -> {
          flushTimes.add(batch.getFlushTime());
          return StageResult.CONTINUE;
        };
    Dispatcher dispatcher =
        dispatcher(
            route("groupWait = 10s, groupInterval = 30s"),
            new NotificationPipeline(RECEIVER, List.of(recording)),
            0);

    dispatcher.submit(alert(Map.of("service", "checkout", "alertname", "A"), null));
    flushScheduler.advanceTo(T0.plusSeconds(9));
    Assertions.assertTrue(flushTimes.isEmpty());

    flushScheduler.advanceTo(T0.plusSeconds(25));
    dispatcher.submit(alert(Map.of("service", "checkout", "alertname", "B"), null));
    flushScheduler.advanceTo(T0.plusSeconds(75));

    Assertions.assertEquals(
        List.of(T0.plusSeconds(10), T0.plusSeconds(40), T0.plusSeconds(70)), flushTimes);
  }

  @Test
  void testGroupsAreNotifiedOnceAndResolutionFollowsOnNextInterval() throws Exception {
    Dispatcher dispatcher =
        dispatcher(
            route("groupWait = 30s, groupInterval = 5m, groupBy = [service]"), pipeline(), 0);
    Alert first = alert(Map.of("service", "checkout", "alertname", "Latency"), null);
    dispatcher.submit(first);
    now.set(T0.plusSeconds(1));
    Alert second = alert(Map.of("service", "checkout", "alertname", "Errors"), null);
    dispatcher.submit(second);

    flushScheduler.advanceTo(T0.plusSeconds(31));
    flushScheduler.advanceTo(T0.plusSeconds(60));
    dispatcher.submit(
        first.toBuilder().endsAt(T0.plusSeconds(60)).updatedAt(T0.plusSeconds(60)).build());
    flushScheduler.advanceTo(T0.plusSeconds(331));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Alert>> captor = ArgumentCaptor.forClass(List.class);
    verify(notifier, times(2)).notify(any(), captor.capture());
    Assertions.assertEquals(
        Set.of(first.getFingerprint(), second.getFingerprint()),
        fingerprints(captor.getAllValues().get(0)));
    List<Alert> resolution = captor.getAllValues().get(1);
    Assertions.assertEquals(2, resolution.size());
    Instant secondFlush = T0.plusSeconds(330);
    Alert resolvedFirst = find(resolution, first);
    Assertions.assertEquals(T0.plusSeconds(60), resolvedFirst.getEndsAt());
    Assertions.assertTrue(resolvedFirst.isResolved(secondFlush));
    Alert firingSecond = find(resolution, second);
    Assertions.assertNull(firingSecond.getEndsAt());
    Assertions.assertFalse(firingSecond.isResolved(secondFlush));

    String groupKey = "{}:{service=\"checkout\"}";
    NotificationLogEntry entry = notificationLog.query(RECEIVER, groupKey).orElseThrow();
    Assertions.assertEquals(Set.of(first.getFingerprint()), entry.getResolvedAlerts());
    Assertions.assertEquals(Set.of(second.getFingerprint()), entry.getFiringAlerts());

    // the resolved alert left the group after being notified
    AggregationGroup group = dispatcher.groups().get(0);
    Assertions.assertEquals(groupKey, group.getGroupKey());
    Assertions.assertEquals(
        Set.of(second.getFingerprint()), fingerprints(group.getAlerts()));
  }

  @Test
  void testUnchangedGroupIsNotNotifiedTwice() throws Exception {
    Dispatcher dispatcher =
        dispatcher(route("groupWait = 10s, groupInterval = 30s"), pipeline(), 0);
    dispatcher.submit(alert(Map.of("alertname", "A"), null));

    flushScheduler.advanceTo(T0.plus(Duration.ofMinutes(10)));
    verify(notifier, times(1)).notify(any(), anyList());

    dispatcher.submit(alert(Map.of("alertname", "B"), null));
    flushScheduler.advanceTo(T0.plus(Duration.ofMinutes(11)));
    verify(notifier, times(2)).notify(any(), anyList());
  }

  @Test
  void testEmptyGroupIsDeletedWithItsTimer() throws Exception {
    Dispatcher dispatcher =
        dispatcher(route("groupWait = 10s, groupInterval = 30s"), pipeline(), 0);
    dispatcher.submit(alert(Map.of("alertname", "A"), T0.plusSeconds(5)));
    Assertions.assertEquals(1, dispatcher.groups().size());

    flushScheduler.advanceTo(T0.plusSeconds(10));

    Assertions.assertTrue(dispatcher.groups().isEmpty());
    Assertions.assertEquals(0, flushScheduler.activeTimers());
  }

  @Test
  void testAlertStatusIsForgottenOnceResolvedAlertsLeaveTheirGroups() {
    Dispatcher dispatcher =
        dispatcher(route("groupWait = 10s, groupInterval = 30s, groupBy = [a]"), pipeline(), 0);
    List<Alert> alerts = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      alerts.add(alert(Map.of("a", String.valueOf(i)), null));
    }
    alerts.forEach(dispatcher::submit);
    flushScheduler.advanceTo(T0.plusSeconds(10));
    Assertions.assertEquals(3, alertMarker.size());

    now.set(T0.plusSeconds(20));
    alerts.forEach(
        alert ->
            dispatcher.submit(
                alert.toBuilder().endsAt(now.get()).updatedAt(now.get()).build()));
    flushScheduler.advanceTo(T0.plusSeconds(40));

    Assertions.assertTrue(dispatcher.groups().isEmpty());
    Assertions.assertEquals(0, flushScheduler.activeTimers());
    Assertions.assertEquals(0, alertMarker.size());
  }

  @Test
  void testStatusIsKeptWhileAnotherGroupHoldsTheAlert() {
    Route root =
        RouteTreeReader.fromConfig(
            ConfigFactory.parseString(
                "receiver = "
                    + RECEIVER
                    + "\n"
                    + "routes = [\n"
                    + "  { groupWait = 10s, groupInterval = 30s, continue = true }\n"
                    + "  { groupWait = 10s, groupInterval = 1h }\n"
                    + "]"));
    Dispatcher dispatcher = dispatcher(root, pipeline(), 0);
    Alert alert = alert(Map.of("a", "1"), null);
    dispatcher.submit(alert);
    flushScheduler.advanceTo(T0.plusSeconds(10));
    Assertions.assertEquals(2, dispatcher.groups().size());

    now.set(T0.plusSeconds(20));
    dispatcher.submit(alert.toBuilder().endsAt(now.get()).updatedAt(now.get()).build());
    flushScheduler.advanceTo(T0.plusSeconds(40));

    // only the group with the shorter interval has flushed the resolution
    Assertions.assertEquals(1, dispatcher.groups().size());
    Assertions.assertEquals(1, alertMarker.size());
  }

  @Test
  void testNewFlushCancelsTheOneInFlightAndWaitsForIt() throws Exception {
    Dispatcher dispatcher = dispatcher(route("groupWait = 10s"), pipeline(), 0);
    Alert alert = alert(Map.of("alertname", "A"), null);
    dispatcher.submit(alert);
    AggregationGroup group = dispatcher.groups().get(0);

    AtomicReference<NotificationContext> firstContext = new AtomicReference<>();
    CountDownLatch sending = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              firstContext.compareAndSet(null, invocation.getArgument(0));
              sending.countDown();
              Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
              return null;
            })
        .when(notifier)
        .notify(any(), anyList());

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<NotificationOutcome> first = executor.submit(() -> dispatcher.flush(group));
      Assertions.assertTrue(sending.await(5, TimeUnit.SECONDS));

      Future<NotificationOutcome> second = executor.submit(() -> dispatcher.flush(group));
      Assertions.assertTrue(firstContext.get().awaitCancellation(Duration.ofSeconds(5)));
      Assertions.assertFalse(second.isDone());

      release.countDown();
      // the delivered notification is recorded, so the newer flush deduplicates it
      Assertions.assertEquals(NotificationOutcome.SENT, first.get(5, TimeUnit.SECONDS));
      Assertions.assertEquals(NotificationOutcome.SUPPRESSED, second.get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }

    verify(notifier, times(1)).notify(any(), anyList());
    Assertions.assertEquals(
        Set.of(alert.getFingerprint()),
        notificationLog.query(RECEIVER, group.getGroupKey()).orElseThrow().getFiringAlerts());
  }

  @Test
  void testAlertForDeletedGroupGoesToNewGroup() {
    Dispatcher dispatcher = dispatcher(route("groupBy = [a]"), pipeline(), 0);
    dispatcher.submit(alert(Map.of("a", "1", "b", "x"), null));
    AggregationGroup deleted = dispatcher.groups().get(0);
    // deleted between the lookup and the add of the next submit
    deleted.delete();

    Alert alert = alert(Map.of("a", "1", "b", "y"), null);
    dispatcher.submit(alert);

    AggregationGroup group = dispatcher.groups().get(0);
    Assertions.assertEquals(1, dispatcher.groups().size());
    Assertions.assertNotSame(deleted, group);
    Assertions.assertEquals(Set.of(alert.getFingerprint()), fingerprints(group.getAlerts()));
    Assertions.assertEquals(1, flushScheduler.activeTimers());
  }

  @Test
  void testConcurrentSubmitsToSeveralGroups() throws Exception {
    Dispatcher dispatcher = dispatcher(route("groupBy = [a]"), pipeline(), 0);
    int threads = 8;
    int alertsPerThread = 50;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> submitters = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        int thread = t;
        submitters.add(
            executor.submit(
                () -> {
                  Assertions.assertTrue(start.await(5, TimeUnit.SECONDS));
                  for (int i = 0; i < alertsPerThread; i++) {
                    dispatcher.submit(
                        alert(
                            Map.of("a", String.valueOf(i % 4), "id", thread + "-" + i),
                            null));
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> submitter : submitters) {
        submitter.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    Assertions.assertEquals(4, dispatcher.groups().size());
    Assertions.assertEquals(
        threads * alertsPerThread,
        dispatcher.groups().stream().mapToInt(group -> group.getAlerts().size()).sum());
    Assertions.assertEquals(4, flushScheduler.activeTimers());
  }

  @Test
  void testGrouping() {
    Dispatcher byA = dispatcher(route("groupBy = [a]"), pipeline(), 0);
    byA.submit(alert(Map.of("a", "1", "b", "x"), null));
    byA.submit(alert(Map.of("a", "1", "b", "y"), null));
    Assertions.assertEquals(1, byA.groups().size());
    Assertions.assertEquals(2, byA.groups().get(0).getAlerts().size());
    Assertions.assertEquals(Map.of("a", "1"), byA.groups().get(0).getGroupLabels());

    Dispatcher byAb = dispatcher(route("groupBy = [a, b]"), pipeline(), 0);
    byAb.submit(alert(Map.of("a", "1", "b", "x"), null));
    byAb.submit(alert(Map.of("a", "1", "b", "y"), null));
    Assertions.assertEquals(2, byAb.groups().size());
  }

  @Test
  void testAlertVersionsAreMerged() {
    Dispatcher dispatcher = dispatcher(route("groupBy = [a]"), pipeline(), 0);
    Alert alert = alert(Map.of("a", "1"), null);
    dispatcher.submit(alert);
    dispatcher.submit(alert);
    // an older version does not replace the held one
    dispatcher.submit(
        alert.toBuilder().endsAt(T0.minusSeconds(10)).updatedAt(T0.minusSeconds(30)).build());

    List<Alert> members = dispatcher.groups().get(0).getAlerts();
    Assertions.assertEquals(1, members.size());
    Assertions.assertNull(members.get(0).getEndsAt());
  }

  @Test
  void testGroupLimit() {
    Dispatcher dispatcher = dispatcher(route("groupBy = [a]"), pipeline(), 1);
    dispatcher.submit(alert(Map.of("a", "1"), null));
    dispatcher.submit(alert(Map.of("a", "2"), null));
    dispatcher.submit(alert(Map.of("a", "1", "b", "x"), null));

    Assertions.assertEquals(1, dispatcher.groups().size());
    Assertions.assertEquals(2, dispatcher.groups().get(0).getAlerts().size());
  }

  @Test
  void testStopCancelsTimers() {
    Dispatcher dispatcher = dispatcher(route("groupBy = [a]"), pipeline(), 0);
    dispatcher.submit(alert(Map.of("a", "1"), null));
    dispatcher.submit(alert(Map.of("a", "2"), null));
    Assertions.assertEquals(2, flushScheduler.activeTimers());

    dispatcher.stop();

    Assertions.assertEquals(0, flushScheduler.activeTimers());
    Assertions.assertTrue(dispatcher.groups().isEmpty());
    Assertions.assertThrows(
        IllegalStateException.class, () -> dispatcher.submit(alert(Map.of("a", "1"), null)));
  }

  private Dispatcher dispatcher(Route root, NotificationPipeline pipeline, int maxGroups) {
    return Dispatcher.builder()
        .root(root)
        .pipelines(Map.of(RECEIVER, pipeline))
        .inhibitor(inhibitor)
        .alertMarker(alertMarker)
        .flushScheduler(flushScheduler)
        .pipelineExecutor(MoreExecutors.directExecutor())
        .clock(clock)
        .maxAggregationGroups(maxGroups)
        .build();
  }

  private NotificationPipeline pipeline() {
    return new NotificationPipelineBuilder()
        .notificationLog(notificationLog)
        .silenceStore(new SilenceStore("peer-0", clock, Duration.ofDays(5), 0))
        .inhibitor(inhibitor)
        .alertMarker(alertMarker)
        .retryPolicy(
            RetryPolicy.builder()
                .initialBackoff(Duration.ZERO)
                .maxBackoff(Duration.ZERO)
                .maxAttempts(1)
                .build())
        .sleeper((duration, context) -> true)
        .build(RECEIVER, notifier);
  }

  private static Route route(String options) {
    return RouteTreeReader.fromConfig(
        ConfigFactory.parseString("receiver = " + RECEIVER + "\n" + options.replace(", ", "\n")));
  }

  private Alert alert(Map<String, String> labels, Instant endsAt) {
    return Alert.builder()
        .labels(labels)
        .startsAt(now.get())
        .endsAt(endsAt)
        .updatedAt(now.get())
        .build();
  }

  private static Alert find(List<Alert> alerts, Alert alert) {
    return alerts.stream()
        .filter(candidate -> candidate.getFingerprint() == alert.getFingerprint())
        .findFirst()
        .orElseThrow();
  }

  private static Set<Long> fingerprints(List<Alert> alerts) {
    return alerts.stream().map(Alert::getFingerprint).collect(Collectors.toSet());
  }
}
