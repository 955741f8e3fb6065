package org.hypertrace.alert.router;

import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AlertRouterMain {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertRouterMain.class);

  public static void main(String[] args) {
    AlertRouterService service = new AlertRouterService(ConfigFactory.load());
    service.doInit();
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOGGER.info("Shutting down alert router");
                  service.doStop();
                },
                "alert-router-shutdown"));
    service.doStart();
  }
}
