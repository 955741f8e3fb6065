package org.hypertrace.alert.router.notification.pipeline;

import java.util.List;
import java.util.Optional;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;

/** Excludes alerts inhibited by a firing source alert. Silenced alerts are not evaluated. */
public class InhibitStage implements Stage {
  private final Inhibitor inhibitor;
  private final AlertMarker alertMarker;

  public InhibitStage(Inhibitor inhibitor, AlertMarker alertMarker) {
    this.inhibitor = inhibitor;
    this.alertMarker = alertMarker;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch) {
    for (Alert alert : batch.getAlerts()) {
      if (batch.isExcluded(alert)) {
        continue;
      }
      Optional<Long> inhibiting = inhibitor.inhibitedBy(alert.getLabels());
      alertMarker.setInhibited(
          alert.getFingerprint(), inhibiting.map(List::of).orElse(List.of()));
      if (inhibiting.isPresent()) {
        batch.exclude(alert, ExclusionReason.INHIBITED);
      }
    }
    return StageResult.CONTINUE;
  }
}
