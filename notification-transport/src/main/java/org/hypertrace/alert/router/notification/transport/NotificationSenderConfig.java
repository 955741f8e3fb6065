package org.hypertrace.alert.router.notification.transport;

import com.typesafe.config.Config;
import java.time.Duration;

/** HTTP client settings for outbound notifications, read from the {@code notify.http} section. */
public class NotificationSenderConfig {
  private static final String HTTP_CONFIG = "notify.http";
  private static final String CONNECT_TIMEOUT = "connectTimeout";
  private static final String READ_TIMEOUT = "readTimeout";
  private static final String USER_AGENT = "userAgent";
  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
  private static final String DEFAULT_USER_AGENT = "hypertrace-alert-router";

  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final String userAgent;

  public static NotificationSenderConfig from(Config config) {
    return new NotificationSenderConfig(
        config.hasPath(HTTP_CONFIG) ? config.getConfig(HTTP_CONFIG) : null);
  }

  private NotificationSenderConfig(Config httpConfig) {
    if (httpConfig == null) {
      this.connectTimeout = DEFAULT_CONNECT_TIMEOUT;
      this.readTimeout = DEFAULT_READ_TIMEOUT;
      this.userAgent = DEFAULT_USER_AGENT;
      return;
    }
    this.connectTimeout =
        httpConfig.hasPath(CONNECT_TIMEOUT)
            ? httpConfig.getDuration(CONNECT_TIMEOUT)
            : DEFAULT_CONNECT_TIMEOUT;
    this.readTimeout =
        httpConfig.hasPath(READ_TIMEOUT)
            ? httpConfig.getDuration(READ_TIMEOUT)
            : DEFAULT_READ_TIMEOUT;
    this.userAgent =
        httpConfig.hasPath(USER_AGENT) ? httpConfig.getString(USER_AGENT) : DEFAULT_USER_AGENT;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public String getUserAgent() {
    return userAgent;
  }
}
