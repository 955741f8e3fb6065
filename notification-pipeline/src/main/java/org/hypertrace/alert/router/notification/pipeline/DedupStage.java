package org.hypertrace.alert.router.notification.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.nflog.NotificationLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stops the pipeline when the notification log shows the batch was already notified. */
public class DedupStage implements Stage {
  private static final Logger LOGGER = LoggerFactory.getLogger(DedupStage.class);

  private final NotificationLog notificationLog;
  private final boolean sendResolved;

  public DedupStage(NotificationLog notificationLog, boolean sendResolved) {
    this.notificationLog = notificationLog;
    this.sendResolved = sendResolved;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch) {
    Set<Long> firing = batch.firingFingerprints();
    Set<Long> resolved = batch.resolvedFingerprints();
    Optional<NotificationLogEntry> entry =
        notificationLog.query(context.getReceiver(), context.getGroupKey());
    if (needsUpdate(
        entry,
        firing,
        resolved,
        context.getRouteOptions().getRepeatInterval(),
        batch.getFlushTime())) {
      return StageResult.CONTINUE;
    }
    LOGGER.debug("Notification already sent for {}", context);
    context.setOutcome(NotificationOutcome.SUPPRESSED);
    return StageResult.STOP;
  }

  boolean needsUpdate(
      Optional<NotificationLogEntry> maybeEntry,
      Set<Long> firing,
      Set<Long> resolved,
      Duration repeatInterval,
      Instant now) {
    if (maybeEntry.isEmpty()) {
      return !firing.isEmpty();
    }
    NotificationLogEntry entry = maybeEntry.get();
    if (!entry.isFiringSubset(firing)) {
      return true;
    }
    // everything resolved, notify only when the last notification still had firing alerts
    if (firing.isEmpty()) {
      return !entry.getFiringAlerts().isEmpty();
    }
    if (sendResolved && !entry.isResolvedSubset(resolved)) {
      return true;
    }
    return entry.getTimestamp().isBefore(now.minus(repeatInterval));
  }
}
