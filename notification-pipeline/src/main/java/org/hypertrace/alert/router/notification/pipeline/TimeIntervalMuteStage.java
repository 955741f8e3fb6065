package org.hypertrace.alert.router.notification.pipeline;

import java.time.Instant;
import org.hypertrace.alert.router.notification.route.RouteOptions;
import org.hypertrace.alert.router.notification.timeinterval.TimeIntervals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Excludes the whole batch while one of the route's mute time intervals is active, or while none
 * of its active time intervals is.
 */
public class TimeIntervalMuteStage implements Stage {
  private static final Logger LOGGER = LoggerFactory.getLogger(TimeIntervalMuteStage.class);

  private final TimeIntervals timeIntervals;

  public TimeIntervalMuteStage(TimeIntervals timeIntervals) {
    this.timeIntervals = timeIntervals;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch) {
    RouteOptions options = context.getRouteOptions();
    Instant now = batch.getFlushTime();
    boolean muted =
        options.getMuteTimeIntervals().stream().anyMatch(name -> timeIntervals.isActive(name, now));
    if (!muted && !options.getActiveTimeIntervals().isEmpty()) {
      muted =
          options.getActiveTimeIntervals().stream()
              .noneMatch(name -> timeIntervals.isActive(name, now));
    }
    if (muted) {
      LOGGER.debug("Time interval mutes {}", context);
      batch.getAlerts().forEach(alert -> batch.exclude(alert, ExclusionReason.MUTED));
    }
    return StageResult.CONTINUE;
  }
}
