package org.hypertrace.alert.router.notification.pipeline;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delays peers by their position in the cluster, giving the notification log entry of the first
 * peer time to arrive through gossip before the later peers deduplicate.
 */
public class WaitStage implements Stage {
  private static final Logger LOGGER = LoggerFactory.getLogger(WaitStage.class);

  private final Duration wait;
  private final Sleeper sleeper;

  public WaitStage(int position, Duration peerTimeout, Sleeper sleeper) {
    this.wait = peerTimeout.multipliedBy(position);
    this.sleeper = sleeper;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch)
      throws InterruptedException {
    if (wait.isZero()) {
      return StageResult.CONTINUE;
    }
    if (!sleeper.sleep(wait, context)) {
      LOGGER.debug("Flush cancelled while waiting for peers: {}", context);
      context.setOutcome(NotificationOutcome.CANCELLED);
      return StageResult.STOP;
    }
    return StageResult.CONTINUE;
  }
}
