package org.hypertrace.alert.router.notification.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.notification.notifier.Notifier;
import org.hypertrace.alert.router.notification.notifier.NotifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the alerts left after all exclusions, retrying with backoff. Exhausted retries and rejected
 * batches still fall through to the record stage; a cancelled flush stops the pipeline.
 */
public class SendStage implements Stage {
  private static final Logger LOGGER = LoggerFactory.getLogger(SendStage.class);
  private static final String INTEGRATION_TAG = "integration";
  private static final String NOTIFICATIONS_COUNTER =
      "hypertrace.alert.router.notifications.total";
  private static final String FAILED_COUNTER =
      "hypertrace.alert.router.notifications.failed.total";
  private static final String REQUESTS_COUNTER =
      "hypertrace.alert.router.notification.requests.total";
  private static final String LATENCY_TIMER = "hypertrace.alert.router.notification.latency";
  private static final ConcurrentMap<String, Counter> notificationsCounter =
      new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Counter> failedCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Counter> requestsCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Timer> latencyTimer = new ConcurrentHashMap<>();

  private final Notifier notifier;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public SendStage(Notifier notifier, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.notifier = notifier;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch)
      throws InterruptedException {
    List<Alert> alerts =
        batch.getCandidates().stream()
            .filter(alert -> notifier.isSendResolved() || !alert.isResolved(batch.getFlushTime()))
            .collect(Collectors.toList());
    if (alerts.isEmpty()) {
      LOGGER.debug("Nothing to send for {}", context);
      context.setOutcome(NotificationOutcome.NOTHING_TO_SEND);
      return StageResult.CONTINUE;
    }

    String integration = notifier.getIntegration();
    for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
      if (context.isCancelled()) {
        return cancelled(context);
      }
      try {
        counter(requestsCounter, REQUESTS_COUNTER, integration).increment();
        long start = System.nanoTime();
        try {
          notifier.notify(context, alerts);
        } finally {
          timer(integration).record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
        counter(notificationsCounter, NOTIFICATIONS_COUNTER, integration).increment();
        LOGGER.info("Notified {} with {} alerts", context, alerts.size());
        context.setOutcome(NotificationOutcome.SENT);
        return StageResult.CONTINUE;
      } catch (NotifierException e) {
        if (!e.isRetryable()) {
          LOGGER.error("Notification rejected, not retrying: {}", context, e);
          return failed(context, integration);
        }
        LOGGER.debug("Attempt {} to notify {} failed", attempt, context, e);
        if (attempt == retryPolicy.getMaxAttempts()) {
          LOGGER.warn(
              "Giving up notifying {} after {} attempts: {}", context, attempt, e.getMessage());
          break;
        }
        if (!sleeper.sleep(retryPolicy.backoff(attempt), context)) {
          return cancelled(context);
        }
      }
    }
    return failed(context, integration);
  }

  private static StageResult failed(NotificationContext context, String integration) {
    counter(failedCounter, FAILED_COUNTER, integration).increment();
    context.setOutcome(NotificationOutcome.FAILED);
    return StageResult.CONTINUE;
  }

  private static StageResult cancelled(NotificationContext context) {
    LOGGER.debug("Flush superseded, abandoning send: {}", context);
    context.setOutcome(NotificationOutcome.CANCELLED);
    return StageResult.STOP;
  }

  private static Counter counter(
      ConcurrentMap<String, Counter> counters, String name, String integration) {
    return counters.computeIfAbsent(
        integration, k -> Metrics.counter(name, INTEGRATION_TAG, integration));
  }

  private static Timer timer(String integration) {
    return latencyTimer.computeIfAbsent(
        integration, k -> Metrics.timer(LATENCY_TIMER, INTEGRATION_TAG, integration));
  }
}
