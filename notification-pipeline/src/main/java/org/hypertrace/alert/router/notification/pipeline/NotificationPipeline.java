package org.hypertrace.alert.router.notification.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The ordered stages run for every flush of a group towards one receiver. */
public class NotificationPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationPipeline.class);

  private final String receiver;
  private final List<Stage> stages;

  public NotificationPipeline(String receiver, List<Stage> stages) {
    this.receiver = receiver;
    this.stages = ImmutableList.copyOf(stages);
  }

  /**
   * Runs the stages in order until one stops the chain. A stage failing unexpectedly ends this
   * flush without recording it, so the next flush tries again.
   */
  public NotificationOutcome execute(NotificationContext context, AlertBatch batch) {
    for (Stage stage : stages) {
      try {
        if (stage.execute(context, batch) == StageResult.STOP) {
          break;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        context.setOutcome(NotificationOutcome.CANCELLED);
        break;
      } catch (RuntimeException e) {
        LOGGER.error(
            "Stage {} failed for {}", stage.getClass().getSimpleName(), context, e);
        context.setOutcome(NotificationOutcome.FAILED);
        break;
      }
    }
    return context.getOutcome();
  }

  public String getReceiver() {
    return receiver;
  }
}
