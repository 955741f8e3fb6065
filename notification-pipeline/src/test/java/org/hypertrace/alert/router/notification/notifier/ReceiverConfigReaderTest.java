package org.hypertrace.alert.router.notification.notifier;

import static org.mockito.Mockito.mock;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.LogReceiverConfig;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.WebhookReceiverConfig;
import org.hypertrace.alert.router.notification.transport.WebhookSender;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junitpioneer.jupiter.SetSystemProperty;

class ReceiverConfigReaderTest {

  @Test
  void testReadReceivers() {
    List<ReceiverConfig> receivers =
        ReceiverConfigReader.fromConfig(
            receivers(
                "receivers = [\n"
                    + "  {name = ops, type = webhook, url = \"http://localhost/ops\","
                    + " maxAlerts = 5, tokenSecret = ops-token}\n"
                    + "  {name = audit, type = log}\n"
                    + "  {name = quiet, type = webhook, url = \"http://localhost/q\","
                    + " sendResolved = false}\n"
                    + "]"));

    Assertions.assertEquals(3, receivers.size());
    WebhookReceiverConfig ops = (WebhookReceiverConfig) receivers.get(0);
    Assertions.assertEquals("ops", ops.getName());
    Assertions.assertEquals("http://localhost/ops", ops.getUrl());
    Assertions.assertEquals(5, ops.getMaxAlerts());
    Assertions.assertEquals("ops-token", ops.getTokenSecret());
    Assertions.assertTrue(ops.isSendResolved());
    Assertions.assertTrue(receivers.get(1) instanceof LogReceiverConfig);
    Assertions.assertFalse(receivers.get(1).isSendResolved());
    WebhookReceiverConfig quiet = (WebhookReceiverConfig) receivers.get(2);
    Assertions.assertFalse(quiet.isSendResolved());
    Assertions.assertEquals(0, quiet.getMaxAlerts());
    Assertions.assertNull(quiet.getTokenSecret());
  }

  @Test
  void testDuplicateNames() {
    List<? extends Config> configs =
        receivers("receivers = [{name = a, type = log}, {name = a, type = log}]");
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> ReceiverConfigReader.fromConfig(configs));
  }

  @Test
  void testUnknownType() {
    List<? extends Config> configs = receivers("receivers = [{name = a, type = pigeon}]");
    RuntimeException exception =
        Assertions.assertThrows(
            RuntimeException.class, () -> ReceiverConfigReader.fromConfig(configs));
    Assertions.assertEquals("Invalid receiver type:pigeon", exception.getMessage());
  }

  @Test
  @SetSystemProperty(key = "notification.secret.ops-token", value = "s3cr3t")
  void testFactoryResolvesToken() {
    NotifierFactory factory = new NotifierFactory(mock(WebhookSender.class));
    Notifier notifier =
        factory.create(
            WebhookReceiverConfig.builder()
                .name("ops")
                .type(ReceiverConfigReader.RECEIVER_TYPE_WEBHOOK)
                .url("http://localhost/ops")
                .tokenSecret("ops-token")
                .build());

    Assertions.assertTrue(notifier instanceof WebhookNotifier);
    Assertions.assertEquals("webhook", notifier.getIntegration());
    Assertions.assertEquals(
        "log",
        factory
            .create(LogReceiverConfig.builder().name("audit").type("log").build())
            .getIntegration());
  }

  @Test
  @SetSystemProperty(key = "notification.secrets.dir", value = "/nonexistent/alert-router")
  void testFactoryFailsOnMissingSecret() {
    NotifierFactory factory = new NotifierFactory(mock(WebhookSender.class));
    WebhookReceiverConfig config =
        WebhookReceiverConfig.builder()
            .name("ops")
            .type(ReceiverConfigReader.RECEIVER_TYPE_WEBHOOK)
            .url("http://localhost/ops")
            .tokenSecret("missing-token")
            .build();
    Assertions.assertThrows(IllegalArgumentException.class, () -> factory.create(config));
  }

  private static List<? extends Config> receivers(String config) {
    return ConfigFactory.parseString(config).getConfigList("receivers");
  }
}
