package org.hypertrace.alert.router;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.datamodel.queue.KafkaAlertConsumer;
import org.hypertrace.alert.router.dispatch.Dispatcher;
import org.hypertrace.alert.router.dispatch.ScheduledExecutorFlushScheduler;
import org.hypertrace.alert.router.job.GossipSyncJobManager;
import org.hypertrace.alert.router.job.JobManager;
import org.hypertrace.alert.router.job.StateMaintenanceJobManager;
import org.hypertrace.alert.router.notification.inhibit.InhibitRuleReader;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.notification.notifier.NotifierFactory;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfigReader;
import org.hypertrace.alert.router.notification.pipeline.AlertMarker;
import org.hypertrace.alert.router.notification.pipeline.NotificationPipeline;
import org.hypertrace.alert.router.notification.pipeline.NotificationPipelineBuilder;
import org.hypertrace.alert.router.notification.pipeline.RetryPolicy;
import org.hypertrace.alert.router.notification.route.Route;
import org.hypertrace.alert.router.notification.route.RouteTreeReader;
import org.hypertrace.alert.router.notification.timeinterval.TimeIntervalReader;
import org.hypertrace.alert.router.notification.timeinterval.TimeIntervals;
import org.hypertrace.alert.router.notification.transport.NotificationSenderConfig;
import org.hypertrace.alert.router.notification.transport.WebhookSender;
import org.hypertrace.alert.router.notification.transport.http.HttpWithJsonSender;
import org.hypertrace.alert.router.state.ReplicatedStore;
import org.hypertrace.alert.router.state.gossip.GossipCoordinator;
import org.hypertrace.alert.router.state.gossip.GossipTransport;
import org.hypertrace.alert.router.state.gossip.InMemoryGossipTransport;
import org.hypertrace.alert.router.state.gossip.KafkaGossipTransport;
import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.hypertrace.alert.router.state.silence.SilenceStore;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SchedulerFactory;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires routing, dispatching, the notification pipelines and the replicated state together and
 * drives their lifecycle.
 */
public class AlertRouterService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertRouterService.class);

  private static final String ROUTE_CONFIG = "route";
  private static final String RECEIVERS_CONFIG = "receivers";
  private static final String INHIBIT_RULES_CONFIG = "inhibitRules";
  private static final String TIME_INTERVALS_CONFIG = "timeIntervals";
  private static final String DISPATCHER_CONFIG = "dispatcher";
  private static final String MAX_AGGREGATION_GROUPS = "maxAggregationGroups";
  private static final String PIPELINE_THREADS = "pipelineThreads";
  private static final String NOTIFY_CONFIG = "notify";
  private static final String PEER_TIMEOUT = "peerTimeout";
  private static final String STATE_CONFIG = "state";
  private static final String NFLOG_RETENTION = "nflog.retention";
  private static final String NFLOG_SNAPSHOT_FILE = "nflog.snapshotFile";
  private static final String SILENCES_RETENTION = "silences.retention";
  private static final String SILENCES_SNAPSHOT_FILE = "silences.snapshotFile";
  private static final String MAX_SILENCES = "silences.maxSilences";
  private static final String CLUSTER_CONFIG = "cluster";
  private static final String CLUSTER_ENABLED = "enabled";
  private static final String PEER_NAME = "peerName";
  private static final String PEER_POSITION = "position";
  private static final String KAFKA_QUEUE_CONFIG = "queue.config.kafka";
  private static final String ALERTS_KAFKA_QUEUE_CONFIG = "alerts.queue.config.kafka";

  private static final Duration DEFAULT_RETENTION = Duration.ofHours(120);
  private static final Duration DEFAULT_PEER_TIMEOUT = Duration.ofSeconds(15);
  private static final int DEFAULT_PIPELINE_THREADS = 4;
  private static final String DEFAULT_PEER_NAME = "alert-router-0";
  private static final long STOP_TIMEOUT_SECONDS = 10;

  private final Config appConfig;
  private final Clock clock;

  private Optional<Path> nflogSnapshotFile;
  private Optional<Path> silencesSnapshotFile;
  private NotificationLog notificationLog;
  private SilenceStore silenceStore;
  private Inhibitor inhibitor;
  private AlertMarker alertMarker;
  private GossipCoordinator gossipCoordinator;
  private ExecutorService pipelineExecutor;
  private Dispatcher dispatcher;
  private Scheduler scheduler;
  private List<JobManager> jobManagers;
  private KafkaAlertConsumer alertConsumer;
  private Thread consumerThread;
  private volatile boolean running;

  public AlertRouterService(Config appConfig) {
    this(appConfig, Clock.systemUTC());
  }

  @VisibleForTesting
  AlertRouterService(Config appConfig, Clock clock) {
    this.appConfig = appConfig;
    this.clock = clock;
  }

  /** Reads and validates the configuration and restores the persisted state. */
  public void doInit() {
    Route root = RouteTreeReader.fromConfig(appConfig.getConfig(ROUTE_CONFIG));
    List<ReceiverConfig> receivers =
        ReceiverConfigReader.fromConfig(appConfig.getConfigList(RECEIVERS_CONFIG));
    TimeIntervals timeIntervals =
        appConfig.hasPath(TIME_INTERVALS_CONFIG)
            ? TimeIntervalReader.fromConfig(appConfig.getConfigList(TIME_INTERVALS_CONFIG))
            : TimeIntervals.empty();
    RouteTreeReader.validateReceivers(
        root, receivers.stream().map(ReceiverConfig::getName).collect(Collectors.toSet()));
    RouteTreeReader.validateTimeIntervals(root, timeIntervals.names());

    inhibitor =
        new Inhibitor(
            appConfig.hasPath(INHIBIT_RULES_CONFIG)
                ? InhibitRuleReader.fromConfig(appConfig.getConfigList(INHIBIT_RULES_CONFIG))
                : List.of(),
            clock);

    Config clusterConfig = getOrEmpty(appConfig, CLUSTER_CONFIG);
    String peerName =
        clusterConfig.hasPath(PEER_NAME) ? clusterConfig.getString(PEER_NAME) : DEFAULT_PEER_NAME;
    initState(getOrEmpty(appConfig, STATE_CONFIG), peerName);
    initGossip(clusterConfig, peerName);

    Config notifyConfig = getOrEmpty(appConfig, NOTIFY_CONFIG);
    NotifierFactory notifierFactory =
        new NotifierFactory(
            new WebhookSender(HttpWithJsonSender.create(NotificationSenderConfig.from(appConfig))));
    alertMarker = new AlertMarker();
    NotificationPipelineBuilder pipelineBuilder =
        new NotificationPipelineBuilder()
            .notificationLog(notificationLog)
            .silenceStore(silenceStore)
            .inhibitor(inhibitor)
            .timeIntervals(timeIntervals)
            .alertMarker(alertMarker)
            .retryPolicy(RetryPolicy.fromConfig(notifyConfig))
            .peer(
                clusterConfig.hasPath(PEER_POSITION) ? clusterConfig.getInt(PEER_POSITION) : 0,
                notifyConfig.hasPath(PEER_TIMEOUT)
                    ? notifyConfig.getDuration(PEER_TIMEOUT)
                    : DEFAULT_PEER_TIMEOUT);
    Map<String, NotificationPipeline> pipelines = new HashMap<>();
    for (ReceiverConfig receiver : receivers) {
      pipelines.put(
          receiver.getName(),
          pipelineBuilder.build(receiver.getName(), notifierFactory.create(receiver)));
    }

    Config dispatcherConfig = getOrEmpty(appConfig, DISPATCHER_CONFIG);
    int pipelineThreads =
        dispatcherConfig.hasPath(PIPELINE_THREADS)
            ? dispatcherConfig.getInt(PIPELINE_THREADS)
            : DEFAULT_PIPELINE_THREADS;
    pipelineExecutor =
        Executors.newFixedThreadPool(
            pipelineThreads,
            new ThreadFactoryBuilder()
                .setNameFormat("notification-pipeline-%d")
                .setDaemon(true)
                .build());
    dispatcher =
        Dispatcher.builder()
            .root(root)
            .pipelines(pipelines)
            .inhibitor(inhibitor)
            .alertMarker(alertMarker)
            .flushScheduler(new ScheduledExecutorFlushScheduler(1))
            .pipelineExecutor(pipelineExecutor)
            .clock(clock)
            .maxAggregationGroups(
                dispatcherConfig.hasPath(MAX_AGGREGATION_GROUPS)
                    ? dispatcherConfig.getInt(MAX_AGGREGATION_GROUPS)
                    : 0)
            .build();

    try {
      SchedulerFactory schedulerFactory = new StdSchedulerFactory();
      scheduler = schedulerFactory.getScheduler();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
    jobManagers =
        List.of(
            new StateMaintenanceJobManager(notificationLog, silenceStore, inhibitor),
            new GossipSyncJobManager(gossipCoordinator));
    jobManagers.forEach(jobManager -> jobManager.initJob(appConfig));

    if (appConfig.hasPath(ALERTS_KAFKA_QUEUE_CONFIG)) {
      alertConsumer = new KafkaAlertConsumer(appConfig.getConfig(ALERTS_KAFKA_QUEUE_CONFIG));
    }
    LOGGER.info(
        "Initialized alert router peer: {} with {} receivers", peerName, pipelines.size());
  }

  private void initState(Config stateConfig, String peerName) {
    notificationLog =
        new NotificationLog(
            peerName,
            clock,
            stateConfig.hasPath(NFLOG_RETENTION)
                ? stateConfig.getDuration(NFLOG_RETENTION)
                : DEFAULT_RETENTION);
    silenceStore =
        new SilenceStore(
            peerName,
            clock,
            stateConfig.hasPath(SILENCES_RETENTION)
                ? stateConfig.getDuration(SILENCES_RETENTION)
                : DEFAULT_RETENTION,
            stateConfig.hasPath(MAX_SILENCES) ? stateConfig.getInt(MAX_SILENCES) : 0);
    nflogSnapshotFile = getPath(stateConfig, NFLOG_SNAPSHOT_FILE);
    silencesSnapshotFile = getPath(stateConfig, SILENCES_SNAPSHOT_FILE);
    restore(notificationLog, nflogSnapshotFile);
    restore(silenceStore, silencesSnapshotFile);
  }

  private void initGossip(Config clusterConfig, String peerName) {
    GossipTransport transport;
    if (clusterConfig.hasPath(CLUSTER_ENABLED) && clusterConfig.getBoolean(CLUSTER_ENABLED)) {
      transport = new KafkaGossipTransport(clusterConfig.getConfig(KAFKA_QUEUE_CONFIG), peerName);
    } else {
      transport = new InMemoryGossipTransport.Network().join();
    }
    gossipCoordinator = new GossipCoordinator(peerName, transport);
    gossipCoordinator.register(notificationLog);
    gossipCoordinator.register(silenceStore);
  }

  public void doStart() {
    gossipCoordinator.start();
    try {
      for (JobManager jobManager : jobManagers) {
        jobManager.startJob(scheduler);
      }
      scheduler.start();
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
    running = true;
    if (alertConsumer != null) {
      consumerThread = new Thread(this::consumeAlerts, "alert-consumer");
      consumerThread.setDaemon(true);
      consumerThread.start();
    }
    LOGGER.info("Alert router started");
  }

  private void consumeAlerts() {
    try {
      while (running) {
        try {
          alertConsumer.dequeue().ifPresent(dispatcher::submit);
        } catch (RuntimeException e) {
          LOGGER.error("Exception processing alert", e);
        }
      }
    } finally {
      alertConsumer.close();
    }
  }

  /** Accepts an alert from any source other than the alert topic. */
  public void submit(Alert alert) {
    dispatcher.submit(alert);
  }

  public void doStop() {
    running = false;
    if (consumerThread != null) {
      try {
        consumerThread.join(TimeUnit.SECONDS.toMillis(STOP_TIMEOUT_SECONDS));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    dispatcher.stop();
    MoreExecutors.shutdownAndAwaitTermination(
        pipelineExecutor, STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    notificationLog.maintenance(nflogSnapshotFile);
    silenceStore.maintenance(silencesSnapshotFile);
    try {
      for (JobManager jobManager : jobManagers) {
        jobManager.stopJob(scheduler);
      }
      scheduler.shutdown();
    } catch (Exception e) {
      throw new RuntimeException(e);
    } finally {
      gossipCoordinator.close();
    }
    LOGGER.info("Alert router stopped");
  }

  public boolean healthCheck() {
    try {
      return running
          && scheduler.isStarted()
          && !scheduler.isShutdown()
          && (consumerThread == null || consumerThread.isAlive());
    } catch (SchedulerException e) {
      LOGGER.warn("Failed to read the scheduler state", e);
      return false;
    }
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public NotificationLog getNotificationLog() {
    return notificationLog;
  }

  public SilenceStore getSilenceStore() {
    return silenceStore;
  }

  public AlertMarker getAlertMarker() {
    return alertMarker;
  }

  private static void restore(ReplicatedStore<?> store, Optional<Path> snapshotFile) {
    if (snapshotFile.isEmpty()) {
      return;
    }
    try {
      store.restore(snapshotFile.get());
    } catch (IOException e) {
      LOGGER.warn(
          "Failed to restore {} from {}, starting empty", store.getName(), snapshotFile.get(), e);
    }
  }

  private static Config getOrEmpty(Config config, String path) {
    return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
  }

  private static Optional<Path> getPath(Config config, String path) {
    return config.hasPath(path) ? Optional.of(Path.of(config.getString(path))) : Optional.empty();
  }
}
