package com.phoenixgateway.client;

import com.phoenixgateway.client.api.impl.PhoenixGatewayContext;
import com.phoenixgateway.client.config.GatewayConfig;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

/**
 * Starts the gateway components and keeps the process alive until it is terminated. An optional
 * first argument names an external properties file.
 */
public class PhoenixGatewayMain {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(PhoenixGatewayMain.class);

  public static void main(String[] args) throws InterruptedException {
    Path externalConfig = args.length > 0 ? Paths.get(args[0]) : null;
    GatewayConfig config;
    try {
      config = GatewayConfig.load(externalConfig, System.getenv());
    } catch (PhoenixValidationException e) {
      LOGGER.error(e, "Invalid gateway configuration");
      System.exit(1);
      return;
    }

    PhoenixGatewayContext context = new PhoenixGatewayContext(config).start();
    CountDownLatch shutdown = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  context.close();
                  shutdown.countDown();
                },
                "Phoenix-Gateway-Shutdown"));
    LOGGER.info(
        "Phoenix gateway started; query server {}, HBase REST {}",
        config.getPhoenixUrl(),
        config.getHBaseUrl());
    shutdown.await();
  }
}
