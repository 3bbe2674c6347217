package com.phoenixgateway.client.config;

/** Resolved configuration for the query client, the warm-up task and the storage client. */
public interface IGatewayConfig {

  /** Query server JSON endpoint, e.g. {@code http://localhost:8765/json}. */
  String getPhoenixUrl();

  String getDriverClassName();

  String getDriverUrl();

  /** Whether the driver transport may be attempted at all. */
  boolean isDriverEnabled();

  /** Number of open attempts made by the protocol transport before giving up. */
  int getConnectMaxAttempts();

  int getConnectRetryDelaySeconds();

  /** Upper bound on rows requested per query. */
  int getMaxRowCount();

  int getHttpTimeoutSeconds();

  int getWarmupDelaySeconds();

  boolean isWarmupEnabled();

  /** Base URL of the HBase REST server, e.g. {@code http://localhost:8080}. */
  String getHBaseUrl();
}
