package org.hypertrace.alert.router.notification.transport;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves receiver secrets such as webhook tokens. A system property {@code
 * notification.secret.<key>} wins, otherwise the secret is read from the file named {@code key} in
 * the secrets directory.
 */
public class NotificationSecretFinder {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationSecretFinder.class);
  private static final String DEFAULT_ROOT_PATH = "/var/alert-router/secrets";
  static final String ROOT_PATH_SYS_PROP = "notification.secrets.dir";
  static final String SECRET_SYS_PROP_PREFIX = "notification.secret.";

  public static Optional<String> findSecret(String key) {
    String secret = System.getProperty(SECRET_SYS_PROP_PREFIX + key);
    if (secret != null) {
      return Optional.of(secret);
    }

    File file = new File(System.getProperty(ROOT_PATH_SYS_PROP, DEFAULT_ROOT_PATH), key);
    if (!file.exists() || !file.canRead()) {
      LOG.error("Unable to read secret file: {}", file.getPath());
      return Optional.empty();
    }

    StringBuilder value = new StringBuilder();
    try (Stream<String> stream = Files.lines(file.toPath(), StandardCharsets.UTF_8)) {
      stream.forEach(value::append);
      return Optional.of(value.toString().trim());
    } catch (IOException e) {
      LOG.error("Unable to read lines from secret file: {}", file.getPath(), e);
      return Optional.empty();
    }
  }
}
