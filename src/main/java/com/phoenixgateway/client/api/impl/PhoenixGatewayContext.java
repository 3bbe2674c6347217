package com.phoenixgateway.client.api.impl;

import com.google.common.annotations.VisibleForTesting;
import com.phoenixgateway.client.api.IPhoenixConnectionManager;
import com.phoenixgateway.client.config.IGatewayConfig;
import com.phoenixgateway.client.dbclient.IHBaseRestClient;
import com.phoenixgateway.client.dbclient.impl.avatica.AvaticaProtocolTransport;
import com.phoenixgateway.client.dbclient.impl.common.ConnectRetryPolicy;
import com.phoenixgateway.client.dbclient.impl.hbase.HBaseRestClient;
import com.phoenixgateway.client.dbclient.impl.http.GatewayHttpClient;
import com.phoenixgateway.client.dbclient.impl.jdbc.PhoenixDriverTransport;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import java.io.IOException;
import java.time.Duration;

/** Owns every long-lived component of the gateway and closes them in reverse order. */
public class PhoenixGatewayContext implements AutoCloseable {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(PhoenixGatewayContext.class);

  private final IGatewayConfig config;
  private final GatewayHttpClient httpClient;
  private final IPhoenixConnectionManager connectionManager;
  private final PhoenixConnectionInitializer initializer;
  private final IHBaseRestClient hbaseClient;
  private final PhoenixQueryService queryService;

  public PhoenixGatewayContext(IGatewayConfig config) {
    this(config, new GatewayHttpClient(config.getHttpTimeoutSeconds()));
  }

  private PhoenixGatewayContext(IGatewayConfig config, GatewayHttpClient httpClient) {
    this(
        config,
        httpClient,
        new PhoenixConnectionManager(
            new PhoenixDriverTransport(config),
            new AvaticaProtocolTransport(config, httpClient),
            ConnectRetryPolicy.fromConfig(config)),
        new HBaseRestClient(config, httpClient));
  }

  @VisibleForTesting
  PhoenixGatewayContext(
      IGatewayConfig config,
      GatewayHttpClient httpClient,
      IPhoenixConnectionManager connectionManager,
      IHBaseRestClient hbaseClient) {
    this.config = config;
    this.httpClient = httpClient;
    this.connectionManager = connectionManager;
    this.initializer =
        new PhoenixConnectionInitializer(
            connectionManager, Duration.ofSeconds(config.getWarmupDelaySeconds()));
    this.hbaseClient = hbaseClient;
    this.queryService = new PhoenixQueryService(connectionManager, hbaseClient);
  }

  /** Starts the connection warm-up unless it is disabled by configuration. */
  public PhoenixGatewayContext start() {
    if (config.isWarmupEnabled()) {
      initializer.start();
    } else {
      LOGGER.info("Connection warm-up disabled; connecting on first request");
    }
    return this;
  }

  public IGatewayConfig getConfig() {
    return config;
  }

  public IPhoenixConnectionManager getConnectionManager() {
    return connectionManager;
  }

  public PhoenixConnectionInitializer getInitializer() {
    return initializer;
  }

  public IHBaseRestClient getHBaseClient() {
    return hbaseClient;
  }

  public PhoenixQueryService getQueryService() {
    return queryService;
  }

  @Override
  public void close() {
    initializer.close();
    connectionManager.close();
    if (httpClient != null) {
      try {
        httpClient.close();
      } catch (IOException e) {
        LOGGER.warn("Failed to close HTTP client: {}", e.getMessage());
      }
    }
    LOGGER.info("Phoenix gateway context closed");
  }
}
