package com.phoenixgateway.client.common;

import java.util.Map;

public final class GatewayConstants {

  private GatewayConstants() {}

  public static final String DEFAULT_PHOENIX_SERVER = "localhost";
  public static final int DEFAULT_PHOENIX_PORT = 8765;
  public static final String PHOENIX_JSON_PATH = "/json";
  public static final String DEFAULT_DRIVER_CLASS_NAME =
      "org.apache.phoenix.queryserver.client.Driver";
  public static final String DRIVER_URL_TEMPLATE =
      "jdbc:phoenix:thin:url=http://%s:%d;serialization=JSON";

  public static final int DEFAULT_CONNECT_MAX_ATTEMPTS = 10;
  public static final int DEFAULT_CONNECT_RETRY_DELAY_SECONDS = 15;
  public static final int DEFAULT_MAX_ROW_COUNT = 10_000;
  public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 300;
  public static final int DEFAULT_WARMUP_DELAY_SECONDS = 30;

  public static final String DEFAULT_HBASE_SERVER = "localhost";
  public static final int DEFAULT_HBASE_PORT = 8080;
  public static final String DEFAULT_HBASE_NAMESPACE = "default";
  public static final String DEFAULT_SENSOR_TABLE = "sensor_info";

  public static final int MAX_LOGGED_SQL_LENGTH = 100;
  public static final int MAX_ERROR_RESPONSE_LENGTH = 500;

  public static final Map<String, String> JSON_HTTP_HEADERS =
      Map.of("Accept", "application/json", "Content-Type", "application/json");
}
