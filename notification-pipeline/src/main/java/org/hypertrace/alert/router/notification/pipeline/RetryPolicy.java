package org.hypertrace.alert.router.notification.pipeline;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Exponential backoff between send attempts, bounded by a maximum delay and attempt count. */
@Getter
@ToString
public class RetryPolicy {
  private static final String RETRY_CONFIG = "retry";
  private static final String INITIAL_BACKOFF = "initialBackoff";
  private static final String MAX_BACKOFF = "maxBackoff";
  private static final String MAX_ATTEMPTS = "maxAttempts";
  private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
  private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(1);
  private static final int DEFAULT_MAX_ATTEMPTS = 10;

  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final int maxAttempts;

  @Builder
  public RetryPolicy(Duration initialBackoff, Duration maxBackoff, int maxAttempts) {
    Preconditions.checkArgument(maxAttempts > 0, "maxAttempts must be positive");
    Preconditions.checkArgument(
        !initialBackoff.isNegative() && maxBackoff.compareTo(initialBackoff) >= 0,
        "invalid backoff bounds %s, %s",
        initialBackoff,
        maxBackoff);
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.maxAttempts = maxAttempts;
  }

  /** Reads the {@code retry} block of the {@code notify} section. */
  public static RetryPolicy fromConfig(Config notifyConfig) {
    Config retryConfig =
        notifyConfig.hasPath(RETRY_CONFIG) ? notifyConfig.getConfig(RETRY_CONFIG) : null;
    if (retryConfig == null) {
      return new RetryPolicy(DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_MAX_ATTEMPTS);
    }
    return new RetryPolicy(
        retryConfig.hasPath(INITIAL_BACKOFF)
            ? retryConfig.getDuration(INITIAL_BACKOFF)
            : DEFAULT_INITIAL_BACKOFF,
        retryConfig.hasPath(MAX_BACKOFF)
            ? retryConfig.getDuration(MAX_BACKOFF)
            : DEFAULT_MAX_BACKOFF,
        retryConfig.hasPath(MAX_ATTEMPTS)
            ? retryConfig.getInt(MAX_ATTEMPTS)
            : DEFAULT_MAX_ATTEMPTS);
  }

  /** Delay after the given failed attempt, counting from 1. */
  public Duration backoff(int attempt) {
    Duration backoff = initialBackoff;
    for (int i = 1; i < attempt && backoff.compareTo(maxBackoff) < 0; i++) {
      backoff = backoff.multipliedBy(2);
    }
    return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
  }
}
