package org.hypertrace.alert.router.notification.pipeline;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.List;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.notification.notifier.Notifier;
import org.hypertrace.alert.router.notification.timeinterval.TimeIntervals;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.silence.SilenceStore;

/**
 * Wires the stages of a receiver's pipeline: wait for peers, dedup, silence, inhibit, time
 * interval mute, send, record. Waiting comes first so that the dedup decision sees the
 * notification log entries gossiped by earlier peers.
 */
public class NotificationPipelineBuilder {
  private NotificationLog notificationLog;
  private SilenceStore silenceStore;
  private Inhibitor inhibitor;
  private TimeIntervals timeIntervals = TimeIntervals.empty();
  private AlertMarker alertMarker = new AlertMarker();
  private RetryPolicy retryPolicy;
  private Sleeper sleeper = Sleeper.CANCELLABLE;
  private int peerPosition;
  private Duration peerTimeout = Duration.ofSeconds(15);

  public NotificationPipelineBuilder notificationLog(NotificationLog notificationLog) {
    this.notificationLog = notificationLog;
    return this;
  }

  public NotificationPipelineBuilder silenceStore(SilenceStore silenceStore) {
    this.silenceStore = silenceStore;
    return this;
  }

  public NotificationPipelineBuilder inhibitor(Inhibitor inhibitor) {
    this.inhibitor = inhibitor;
    return this;
  }

  public NotificationPipelineBuilder timeIntervals(TimeIntervals timeIntervals) {
    this.timeIntervals = timeIntervals;
    return this;
  }

  public NotificationPipelineBuilder alertMarker(AlertMarker alertMarker) {
    this.alertMarker = alertMarker;
    return this;
  }

  public NotificationPipelineBuilder retryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = retryPolicy;
    return this;
  }

  public NotificationPipelineBuilder sleeper(Sleeper sleeper) {
    this.sleeper = sleeper;
    return this;
  }

  public NotificationPipelineBuilder peer(int position, Duration timeout) {
    this.peerPosition = position;
    this.peerTimeout = timeout;
    return this;
  }

  public NotificationPipeline build(String receiver, Notifier notifier) {
    Preconditions.checkState(notificationLog != null, "notification log is required");
    Preconditions.checkState(silenceStore != null, "silence store is required");
    Preconditions.checkState(inhibitor != null, "inhibitor is required");
    Preconditions.checkState(retryPolicy != null, "retry policy is required");
    return new NotificationPipeline(
        receiver,
        List.of(
            new WaitStage(peerPosition, peerTimeout, sleeper),
            new DedupStage(notificationLog, notifier.isSendResolved()),
            new SilenceStage(silenceStore, alertMarker),
            new InhibitStage(inhibitor, alertMarker),
            new TimeIntervalMuteStage(timeIntervals),
            new SendStage(notifier, retryPolicy, sleeper),
            new RecordStage(notificationLog)));
  }
}
