package org.hypertrace.alert.router.notification.pipeline;

import java.util.List;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.state.silence.SilenceStore;

/** Excludes alerts muted by an active silence and marks them with the silence ids. */
public class SilenceStage implements Stage {
  private final SilenceStore silenceStore;
  private final AlertMarker alertMarker;

  public SilenceStage(SilenceStore silenceStore, AlertMarker alertMarker) {
    this.silenceStore = silenceStore;
    this.alertMarker = alertMarker;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch) {
    for (Alert alert : batch.getAlerts()) {
      List<String> silenceIds = silenceStore.mutedBy(alert.getLabels());
      alertMarker.setSilenced(alert.getFingerprint(), silenceIds);
      if (!silenceIds.isEmpty()) {
        batch.exclude(alert, ExclusionReason.SILENCED);
      }
    }
    return StageResult.CONTINUE;
  }
}
