package com.phoenixgateway.client.config;

import static com.phoenixgateway.client.common.GatewayConstants.*;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.phoenixgateway.client.common.error.GatewayErrorCode;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration built from layered sources. Precedence, lowest first: the classpath resource {@code
 * phoenix-gateway.properties}, an optional external properties file, then environment variables
 * named after the key upper-cased with dots replaced by underscores ({@code phoenix.server} is read
 * from {@code PHOENIX_SERVER}).
 */
public class GatewayConfig implements IGatewayConfig {

  private static final GatewayLogger LOGGER = GatewayLoggerFactory.getLogger(GatewayConfig.class);

  static final String DEFAULT_RESOURCE = "phoenix-gateway.properties";

  public static final String PHOENIX_SERVER = "phoenix.server";
  public static final String PHOENIX_PORT = "phoenix.port";
  public static final String PHOENIX_URL = "phoenix.url";
  public static final String DRIVER_CLASS_NAME = "phoenix.driver.className";
  public static final String DRIVER_URL = "phoenix.driver.url";
  public static final String DRIVER_ENABLED = "phoenix.driver.enabled";
  public static final String CONNECT_MAX_ATTEMPTS = "phoenix.connect.maxAttempts";
  public static final String CONNECT_RETRY_DELAY_SECONDS = "phoenix.connect.retryDelaySeconds";
  public static final String MAX_ROW_COUNT = "phoenix.maxRowCount";
  public static final String HTTP_TIMEOUT_SECONDS = "phoenix.http.timeoutSeconds";
  public static final String WARMUP_DELAY_SECONDS = "phoenix.warmup.delaySeconds";
  public static final String WARMUP_ENABLED = "phoenix.warmup.enabled";
  public static final String HBASE_SERVER = "hbase.server";
  public static final String HBASE_PORT = "hbase.port";
  public static final String HBASE_URL = "hbase.url";

  private static final String[] KEYS = {
    PHOENIX_SERVER,
    PHOENIX_PORT,
    PHOENIX_URL,
    DRIVER_CLASS_NAME,
    DRIVER_URL,
    DRIVER_ENABLED,
    CONNECT_MAX_ATTEMPTS,
    CONNECT_RETRY_DELAY_SECONDS,
    MAX_ROW_COUNT,
    HTTP_TIMEOUT_SECONDS,
    WARMUP_DELAY_SECONDS,
    WARMUP_ENABLED,
    HBASE_SERVER,
    HBASE_PORT,
    HBASE_URL
  };

  private final String phoenixUrl;
  private final String driverClassName;
  private final String driverUrl;
  private final boolean driverEnabled;
  private final int connectMaxAttempts;
  private final int connectRetryDelaySeconds;
  private final int maxRowCount;
  private final int httpTimeoutSeconds;
  private final int warmupDelaySeconds;
  private final boolean warmupEnabled;
  private final String hbaseUrl;

  /**
   * Creates a configuration from already merged properties. Missing keys take their defaults.
   *
   * @throws PhoenixValidationException if a numeric or boolean value cannot be parsed
   */
  public GatewayConfig(Properties properties) throws PhoenixValidationException {
    String server = properties.getProperty(PHOENIX_SERVER, DEFAULT_PHOENIX_SERVER);
    int port = parsePositiveInt(properties, PHOENIX_PORT, DEFAULT_PHOENIX_PORT);
    this.phoenixUrl =
        toJsonEndpoint(
            Strings.isNullOrEmpty(properties.getProperty(PHOENIX_URL))
                ? String.format("http://%s:%d", server, port)
                : properties.getProperty(PHOENIX_URL));
    this.driverClassName = properties.getProperty(DRIVER_CLASS_NAME, DEFAULT_DRIVER_CLASS_NAME);
    this.driverUrl =
        properties.getProperty(DRIVER_URL, String.format(DRIVER_URL_TEMPLATE, server, port));
    this.driverEnabled = parseBoolean(properties, DRIVER_ENABLED, true);
    this.connectMaxAttempts =
        parsePositiveInt(properties, CONNECT_MAX_ATTEMPTS, DEFAULT_CONNECT_MAX_ATTEMPTS);
    this.connectRetryDelaySeconds =
        parseNonNegativeInt(
            properties, CONNECT_RETRY_DELAY_SECONDS, DEFAULT_CONNECT_RETRY_DELAY_SECONDS);
    this.maxRowCount = parsePositiveInt(properties, MAX_ROW_COUNT, DEFAULT_MAX_ROW_COUNT);
    this.httpTimeoutSeconds =
        parsePositiveInt(properties, HTTP_TIMEOUT_SECONDS, DEFAULT_HTTP_TIMEOUT_SECONDS);
    this.warmupDelaySeconds =
        parseNonNegativeInt(properties, WARMUP_DELAY_SECONDS, DEFAULT_WARMUP_DELAY_SECONDS);
    this.warmupEnabled = parseBoolean(properties, WARMUP_ENABLED, true);
    String hbaseServer = properties.getProperty(HBASE_SERVER, DEFAULT_HBASE_SERVER);
    int hbasePort = parsePositiveInt(properties, HBASE_PORT, DEFAULT_HBASE_PORT);
    String configuredHBaseUrl = properties.getProperty(HBASE_URL);
    this.hbaseUrl =
        stripTrailingSlash(
            Strings.isNullOrEmpty(configuredHBaseUrl)
                ? String.format("http://%s:%d", hbaseServer, hbasePort)
                : configuredHBaseUrl);
  }

  /** Loads the classpath defaults overlaid with the process environment. */
  public static GatewayConfig load() throws PhoenixValidationException {
    return load(null, System.getenv());
  }

  /**
   * Loads the classpath defaults, then {@code externalFile} if given, then {@code environment}.
   *
   * @param externalFile optional properties file, may be null
   * @param environment environment variables to overlay
   */
  public static GatewayConfig load(Path externalFile, Map<String, String> environment)
      throws PhoenixValidationException {
    Properties merged = new Properties();
    ClassLoader classLoader = GatewayConfig.class.getClassLoader();
    try (InputStream in = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in != null) {
        merged.load(in);
      }
    } catch (IOException e) {
      throw new PhoenixValidationException(
          "Failed to read " + DEFAULT_RESOURCE, e, GatewayErrorCode.CONFIGURATION_ERROR);
    }
    if (externalFile != null) {
      try (Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
        merged.load(reader);
      } catch (IOException e) {
        throw new PhoenixValidationException(
            "Failed to read configuration file " + externalFile,
            e,
            GatewayErrorCode.CONFIGURATION_ERROR);
      }
    }
    applyEnvironment(merged, environment);
    return new GatewayConfig(merged);
  }

  @VisibleForTesting
  static void applyEnvironment(Properties properties, Map<String, String> environment) {
    for (String key : KEYS) {
      String value = environment.get(toEnvironmentName(key));
      if (!Strings.isNullOrEmpty(value)) {
        LOGGER.debug("Configuration key {} overridden from environment", key);
        properties.setProperty(key, value);
      }
    }
  }

  @VisibleForTesting
  static String toEnvironmentName(String key) {
    return key.replace('.', '_').toUpperCase(Locale.ROOT);
  }

  private static String toJsonEndpoint(String url) {
    String trimmed = stripTrailingSlash(url);
    return trimmed.endsWith(PHOENIX_JSON_PATH) ? trimmed : trimmed + PHOENIX_JSON_PATH;
  }

  private static String stripTrailingSlash(String url) {
    String trimmed = url.strip();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static int parsePositiveInt(Properties properties, String key, int defaultValue)
      throws PhoenixValidationException {
    int value = parseNonNegativeInt(properties, key, defaultValue);
    if (value == 0) {
      throw new PhoenixValidationException(
          String.format("Configuration value for %s must be positive", key),
          GatewayErrorCode.CONFIGURATION_ERROR);
    }
    return value;
  }

  private static int parseNonNegativeInt(Properties properties, String key, int defaultValue)
      throws PhoenixValidationException {
    String raw = properties.getProperty(key);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    try {
      int value = Integer.parseInt(raw.strip());
      if (value < 0) {
        throw new PhoenixValidationException(
            String.format("Configuration value for %s must not be negative: %s", key, raw),
            GatewayErrorCode.CONFIGURATION_ERROR);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new PhoenixValidationException(
          String.format("Invalid integer for %s: %s", key, raw),
          e,
          GatewayErrorCode.CONFIGURATION_ERROR);
    }
  }

  private static boolean parseBoolean(Properties properties, String key, boolean defaultValue)
      throws PhoenixValidationException {
    String raw = properties.getProperty(key);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    String normalized = raw.strip().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "true":
      case "1":
        return true;
      case "false":
      case "0":
        return false;
      default:
        throw new PhoenixValidationException(
            String.format("Invalid boolean for %s: %s", key, raw),
            GatewayErrorCode.CONFIGURATION_ERROR);
    }
  }

  @Override
  public String getPhoenixUrl() {
    return phoenixUrl;
  }

  @Override
  public String getDriverClassName() {
    return driverClassName;
  }

  @Override
  public String getDriverUrl() {
    return driverUrl;
  }

  @Override
  public boolean isDriverEnabled() {
    return driverEnabled;
  }

  @Override
  public int getConnectMaxAttempts() {
    return connectMaxAttempts;
  }

  @Override
  public int getConnectRetryDelaySeconds() {
    return connectRetryDelaySeconds;
  }

  @Override
  public int getMaxRowCount() {
    return maxRowCount;
  }

  @Override
  public int getHttpTimeoutSeconds() {
    return httpTimeoutSeconds;
  }

  @Override
  public int getWarmupDelaySeconds() {
    return warmupDelaySeconds;
  }

  @Override
  public boolean isWarmupEnabled() {
    return warmupEnabled;
  }

  @Override
  public String getHBaseUrl() {
    return hbaseUrl;
  }
}
