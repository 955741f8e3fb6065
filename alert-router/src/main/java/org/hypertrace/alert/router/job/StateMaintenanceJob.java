package org.hypertrace.alert.router.job;

import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_INHIBITOR;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_NFLOG_SNAPSHOT_FILE;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_NOTIFICATION_LOG;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_SILENCES_SNAPSHOT_FILE;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_SILENCE_STORE;

import java.nio.file.Path;
import java.util.Optional;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.silence.SilenceStore;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops expired notification log entries and silences, writes both snapshots when configured and
 * forgets resolved inhibiting alerts.
 */
@DisallowConcurrentExecution
public class StateMaintenanceJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(StateMaintenanceJob.class);

  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting state maintenance job: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    NotificationLog notificationLog =
        (NotificationLog) jobDataMap.get(JOB_DATA_MAP_NOTIFICATION_LOG);
    SilenceStore silenceStore = (SilenceStore) jobDataMap.get(JOB_DATA_MAP_SILENCE_STORE);
    Inhibitor inhibitor = (Inhibitor) jobDataMap.get(JOB_DATA_MAP_INHIBITOR);

    notificationLog.maintenance(snapshotFile(jobDataMap, JOB_DATA_MAP_NFLOG_SNAPSHOT_FILE));
    silenceStore.maintenance(snapshotFile(jobDataMap, JOB_DATA_MAP_SILENCES_SNAPSHOT_FILE));
    int inhibitorRemoved = inhibitor.gc();
    LOGGER.debug(
        "State maintenance kept {} nflog entries and {} silences, removed {} inhibiting alerts",
        notificationLog.size(),
        silenceStore.size(),
        inhibitorRemoved);
  }

  private static Optional<Path> snapshotFile(JobDataMap jobDataMap, String key) {
    return jobDataMap.containsKey(key)
        ? Optional.of(Path.of(jobDataMap.getString(key)))
        : Optional.empty();
  }
}
