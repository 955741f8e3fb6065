package org.hypertrace.alert.router.job;

import static org.hypertrace.alert.router.job.JobConstants.CLUSTER_CONFIG;
import static org.hypertrace.alert.router.job.JobConstants.GOSSIP_SYNC_CRON_EXPRESSION;
import static org.hypertrace.alert.router.job.JobConstants.GOSSIP_SYNC_JOB_NAME;
import static org.hypertrace.alert.router.job.JobConstants.GOSSIP_SYNC_JOB_TRIGGER_NAME;
import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_GOSSIP_COORDINATOR;
import static org.hypertrace.alert.router.job.JobConstants.JOB_GROUP;
import static org.hypertrace.alert.router.job.JobConstants.SYNC_CRON_EXPRESSION_CONFIG;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.hypertrace.alert.router.state.gossip.GossipCoordinator;
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

public class GossipSyncJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(GossipSyncJobManager.class);

  private final GossipCoordinator gossipCoordinator;

  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public GossipSyncJobManager(GossipCoordinator gossipCoordinator) {
    this.gossipCoordinator = gossipCoordinator;
  }

  public void initJob(Config appConfig) {
    Config clusterConfig =
        appConfig.hasPath(CLUSTER_CONFIG)
            ? appConfig.getConfig(CLUSTER_CONFIG)
            : ConfigFactory.parseMap(Map.of());

    jobKey = JobKey.jobKey(GOSSIP_SYNC_JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_GOSSIP_COORDINATOR, gossipCoordinator);

    jobDetail =
        JobBuilder.newJob(GossipSyncJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    String cronExpression =
        clusterConfig.hasPath(SYNC_CRON_EXPRESSION_CONFIG)
            ? clusterConfig.getString(SYNC_CRON_EXPRESSION_CONFIG)
            : GOSSIP_SYNC_CRON_EXPRESSION;
    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(GOSSIP_SYNC_JOB_TRIGGER_NAME, JOB_GROUP)
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
