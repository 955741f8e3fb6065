package org.hypertrace.alert.router.job;

import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_INHIBITOR;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_NFLOG_SNAPSHOT_FILE;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_NOTIFICATION_LOG;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_SILENCES_SNAPSHOT_FILE;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_SILENCE_STORE;
import static org.hypertrace.alert.router.job.JobConstants.JOB_GROUP;
import static org.hypertrace.alert.router.job.JobConstants.MAINTENANCE_CRON_EXPRESSION;
import static org.hypertrace.alert.router.job.JobConstants.MAINTENANCE_CRON_EXPRESSION_CONFIG;
import static org.hypertrace.alert.router.job.JobConstants.MAINTENANCE_JOB_NAME;
import static org.hypertrace.alert.router.job.JobConstants.MAINTENANCE_JOB_TRIGGER_NAME;
import static org.hypertrace.alert.router.job.JobConstants.NFLOG_SNAPSHOT_FILE;
import static org.hypertrace.alert.router.job.JobConstants.SILENCES_SNAPSHOT_FILE;
import static org.hypertrace.alert.router.job.JobConstants.STATE_CONFIG;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.silence.SilenceStore;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StateMaintenanceJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(StateMaintenanceJobManager.class);

  private final NotificationLog notificationLog;
  private final SilenceStore silenceStore;
  private final Inhibitor inhibitor;

  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public StateMaintenanceJobManager(
      NotificationLog notificationLog, SilenceStore silenceStore, Inhibitor inhibitor) {
    this.notificationLog = notificationLog;
    this.silenceStore = silenceStore;
    this.inhibitor = inhibitor;
  }

  public void initJob(Config appConfig) {
    Config stateConfig =
        appConfig.hasPath(STATE_CONFIG)
            ? appConfig.getConfig(STATE_CONFIG)
            : ConfigFactory.parseMap(Map.of());

    jobKey = JobKey.jobKey(MAINTENANCE_JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_NOTIFICATION_LOG, notificationLog);
    jobDataMap.put(JOB_DATA_MAP_SILENCE_STORE, silenceStore);
    jobDataMap.put(JOB_DATA_MAP_INHIBITOR, inhibitor);
    if (stateConfig.hasPath(NFLOG_SNAPSHOT_FILE)) {
      jobDataMap.put(JOB_DATA_MAP_NFLOG_SNAPSHOT_FILE, stateConfig.getString(NFLOG_SNAPSHOT_FILE));
    }
    if (stateConfig.hasPath(SILENCES_SNAPSHOT_FILE)) {
      jobDataMap.put(
          JOB_DATA_MAP_SILENCES_SNAPSHOT_FILE, stateConfig.getString(SILENCES_SNAPSHOT_FILE));
    }

    jobDetail =
        JobBuilder.newJob(StateMaintenanceJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    String cronExpression =
        stateConfig.hasPath(MAINTENANCE_CRON_EXPRESSION_CONFIG)
            ? stateConfig.getString(MAINTENANCE_CRON_EXPRESSION_CONFIG)
            : MAINTENANCE_CRON_EXPRESSION;
    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(MAINTENANCE_JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .build();
  }

  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }

  JobDetail getJobDetail() {
    return jobDetail;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }
}
