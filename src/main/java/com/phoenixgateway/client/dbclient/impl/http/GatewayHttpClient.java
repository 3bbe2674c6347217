package com.phoenixgateway.client.dbclient.impl.http;

import com.google.common.annotations.VisibleForTesting;
import com.phoenixgateway.client.dbclient.IGatewayHttpClient;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.IdleConnectionEvictor;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

/** Http client implementation to be used for executing http requests. */
public class GatewayHttpClient implements IGatewayHttpClient, Closeable {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(GatewayHttpClient.class);
  private static final int DEFAULT_MAX_HTTP_CONNECTIONS = 100;
  private static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 50;
  private static final int IDLE_CONNECTION_EXPIRY_SECONDS = 60;

  private final PoolingHttpClientConnectionManager connectionManager;
  private final CloseableHttpClient httpClient;
  private final IdleConnectionEvictor idleConnectionEvictor;

  /**
   * Creates a pooled client whose connect, socket and pool-lease timeouts are all {@code
   * timeoutSeconds}.
   */
  public GatewayHttpClient(int timeoutSeconds) {
    connectionManager = new PoolingHttpClientConnectionManager();
    connectionManager.setMaxTotal(DEFAULT_MAX_HTTP_CONNECTIONS);
    connectionManager.setDefaultMaxPerRoute(DEFAULT_MAX_CONNECTIONS_PER_ROUTE);
    int timeoutMillis = (int) TimeUnit.SECONDS.toMillis(timeoutSeconds);
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(timeoutMillis)
            .setConnectionRequestTimeout(timeoutMillis)
            .setSocketTimeout(timeoutMillis)
            .build();
    httpClient =
        HttpClientBuilder.create()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .build();
    idleConnectionEvictor =
        new IdleConnectionEvictor(
            connectionManager, IDLE_CONNECTION_EXPIRY_SECONDS, TimeUnit.SECONDS);
    idleConnectionEvictor.start();
  }

  @VisibleForTesting
  GatewayHttpClient(
      CloseableHttpClient testCloseableHttpClient,
      PoolingHttpClientConnectionManager testConnectionManager) {
    httpClient = testCloseableHttpClient;
    connectionManager = testConnectionManager;
    idleConnectionEvictor = null;
  }

  @Override
  public CloseableHttpResponse execute(HttpUriRequest request) throws PhoenixConnectException {
    LOGGER.debug("Executing HTTP request {} {}", request.getMethod(), request.getURI());
    try {
      return httpClient.execute(request);
    } catch (IOException e) {
      String errorMsg =
          String.format(
              "Caught error while executing http request: [%s %s]. Error: %s",
              request.getMethod(), request.getURI(), e.getMessage());
      LOGGER.debug(errorMsg);
      throw new PhoenixConnectException(errorMsg, e);
    }
  }

  @Override
  public void close() throws IOException {
    if (idleConnectionEvictor != null) {
      idleConnectionEvictor.shutdown();
    }
    if (httpClient != null) {
      httpClient.close();
    }
    if (connectionManager != null) {
      connectionManager.shutdown();
    }
  }
}
