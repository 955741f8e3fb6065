package org.hypertrace.alert.router.job;

import static org.hypertrace.alert.router.job.JobConstants.JOB_DATA_MAP_GOSSIP_COORDINATOR;

import org.hypertrace.alert.router.state.gossip.GossipCoordinator;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Broadcasts the full replicated state so that peers catch up on lost messages. */
@DisallowConcurrentExecution
public class GossipSyncJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(GossipSyncJob.class);

  public void execute(JobExecutionContext jobExecutionContext) {
    GossipCoordinator gossipCoordinator =
        (GossipCoordinator)
            jobExecutionContext
                .getJobDetail()
                .getJobDataMap()
                .get(JOB_DATA_MAP_GOSSIP_COORDINATOR);
    try {
      gossipCoordinator.fullSync();
    } catch (RuntimeException e) {
      LOGGER.warn("Full state sync failed, retrying on the next run", e);
    }
  }
}
