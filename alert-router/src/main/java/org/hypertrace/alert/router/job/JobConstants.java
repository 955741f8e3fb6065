package org.hypertrace.alert.router.job;

public class JobConstants {
  public static final String JOB_DATA_MAP_NOTIFICATION_LOG = "notificationLog";
  public static final String JOB_DATA_MAP_SILENCE_STORE = "silenceStore";
  public static final String JOB_DATA_MAP_INHIBITOR = "inhibitor";
  public static final String JOB_DATA_MAP_NFLOG_SNAPSHOT_FILE = "nflogSnapshotFile";
  public static final String JOB_DATA_MAP_SILENCES_SNAPSHOT_FILE = "silencesSnapshotFile";
  public static final String JOB_DATA_MAP_GOSSIP_COORDINATOR = "gossipCoordinator";

  public static final String JOB_GROUP = "alert-router";

  public static final String MAINTENANCE_JOB_NAME = "state-maintenance";
  public static final String MAINTENANCE_JOB_TRIGGER_NAME = "state-maintenance-trigger";
  public static final String MAINTENANCE_CRON_EXPRESSION = "0 0/15 * * * ?";

  public static final String GOSSIP_SYNC_JOB_NAME = "gossip-sync";
  public static final String GOSSIP_SYNC_JOB_TRIGGER_NAME = "gossip-sync-trigger";
  public static final String GOSSIP_SYNC_CRON_EXPRESSION = "0 * * * * ?";

  public static final String STATE_CONFIG = "state";
  public static final String NFLOG_SNAPSHOT_FILE = "nflog.snapshotFile";
  public static final String SILENCES_SNAPSHOT_FILE = "silences.snapshotFile";
  public static final String MAINTENANCE_CRON_EXPRESSION_CONFIG = "maintenance.cronExpression";
  public static final String CLUSTER_CONFIG = "cluster";
  public static final String SYNC_CRON_EXPRESSION_CONFIG = "syncCronExpression";

  private JobConstants() {}
}
