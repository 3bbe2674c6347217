package com.phoenixgateway.client.dbclient.impl.avatica;

import com.google.common.annotations.VisibleForTesting;
import com.phoenixgateway.client.api.impl.converters.ResultNormalizer;
import com.phoenixgateway.client.common.GatewayConstants;
import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.common.util.HttpUtil;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import com.phoenixgateway.client.config.IGatewayConfig;
import com.phoenixgateway.client.dbclient.IGatewayHttpClient;
import com.phoenixgateway.client.dbclient.IPhoenixTransport;
import com.phoenixgateway.client.dbclient.impl.common.TransportCapability;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixProtocolException;
import com.phoenixgateway.client.exception.PhoenixRemoteException;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import com.phoenixgateway.client.model.avatica.AvaticaResultFrame;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

/**
 * Talks to the query server through its JSON-over-HTTP endpoint. Every call is a single POST; this
 * class never retries.
 */
public class AvaticaProtocolTransport implements IPhoenixTransport {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(AvaticaProtocolTransport.class);

  private final String endpointUrl;
  private final int maxRowCount;
  private final IGatewayHttpClient httpClient;
  private final AvaticaProtocolCodec codec;
  private final ResultNormalizer normalizer;
  private final Supplier<String> connectionIdGenerator;
  private final Set<String> lostConnections = ConcurrentHashMap.newKeySet();

  public AvaticaProtocolTransport(IGatewayConfig config, IGatewayHttpClient httpClient) {
    this(
        config,
        httpClient,
        new AvaticaProtocolCodec(),
        new ResultNormalizer(),
        () -> UUID.randomUUID().toString());
  }

  @VisibleForTesting
  AvaticaProtocolTransport(
      IGatewayConfig config,
      IGatewayHttpClient httpClient,
      AvaticaProtocolCodec codec,
      ResultNormalizer normalizer,
      Supplier<String> connectionIdGenerator) {
    this.endpointUrl = config.getPhoenixUrl();
    this.maxRowCount = config.getMaxRowCount();
    this.httpClient = httpClient;
    this.codec = codec;
    this.normalizer = normalizer;
    this.connectionIdGenerator = connectionIdGenerator;
  }

  @Override
  public TransportKind getKind() {
    return TransportKind.PROTOCOL;
  }

  @Override
  public TransportCapability probe() {
    return TransportCapability.available();
  }

  @Override
  public String open() throws PhoenixSQLException {
    String requestedId = connectionIdGenerator.get();
    ServerResponse response = post(codec.encodeOpenConnection(requestedId));
    if (!response.isSuccessful()) {
      throw new PhoenixConnectException(
          String.format(
              "openConnection returned HTTP %d: %s",
              response.statusCode,
              SqlTextUtil.truncate(response.body, GatewayConstants.MAX_ERROR_RESPONSE_LENGTH)));
    }
    String token = codec.decodeOpenConnection(response.body, requestedId);
    LOGGER.debug("Opened query server connection {}", token);
    return token;
  }

  @Override
  public TabularResult execute(String connectionToken, StatementRequest request)
      throws PhoenixSQLException {
    if (connectionToken == null) {
      throw new PhoenixValidationException("No connection token; open the connection first");
    }
    LOGGER.debug(
        "Executing statement: {}",
        SqlTextUtil.truncate(request.getSql(), GatewayConstants.MAX_LOGGED_SQL_LENGTH));
    try {
      return executeStatement(connectionToken, request);
    } catch (PhoenixConnectException e) {
      lostConnections.add(connectionToken);
      throw e;
    }
  }

  /**
   * A token is alive until a statement on it fails with a connection error or it is closed. The
   * server is not asked.
   */
  @Override
  public boolean isAlive(String connectionToken) {
    return connectionToken != null && !lostConnections.contains(connectionToken);
  }

  private TabularResult executeStatement(String connectionToken, StatementRequest request)
      throws PhoenixSQLException {
    ServerResponse created = post(codec.encodeCreateStatement(connectionToken));
    int statementId = codec.decodeCreateStatement(checkStatus(created));
    try {
      long rowCap = request.isQuery() ? maxRowCount : 0L;
      ServerResponse executed =
          post(
              codec.encodePrepareAndExecute(
                  connectionToken, statementId, request.getSql(), rowCap));
      AvaticaResultFrame frame = codec.decodeExecute(checkStatus(executed));
      TabularResult result = normalizer.normalize(frame);
      if (request.isQuery() && result.getRowCount() == 0) {
        LOGGER.debug("Query returned no rows");
      }
      return result;
    } finally {
      closeStatement(connectionToken, statementId);
    }
  }

  @Override
  public void close(String connectionToken) {
    if (connectionToken == null) {
      return;
    }
    lostConnections.remove(connectionToken);
    try {
      post(codec.encodeCloseConnection(connectionToken));
      LOGGER.debug("Closed query server connection {}", connectionToken);
    } catch (PhoenixSQLException e) {
      LOGGER.debug("Ignoring failure while closing connection {}: {}", connectionToken, e);
    }
  }

  private void closeStatement(String connectionToken, int statementId) {
    try {
      post(codec.encodeCloseStatement(connectionToken, statementId));
    } catch (PhoenixSQLException e) {
      LOGGER.debug("Ignoring failure while closing statement {}: {}", statementId, e);
    }
  }

  /**
   * Returns the body of a successful response. A failed response carrying an error object raises
   * the remote error; any other failed response is treated as a connection failure.
   */
  private String checkStatus(ServerResponse response)
      throws PhoenixConnectException, PhoenixRemoteException, PhoenixProtocolException {
    if (response.isSuccessful()) {
      return response.body;
    }
    if (!response.body.isBlank()) {
      try {
        codec.checkForError(codec.parse(response.body));
      } catch (PhoenixProtocolException e) {
        LOGGER.debug("HTTP {} response body is not JSON", response.statusCode);
      }
    }
    throw new PhoenixConnectException(
        String.format(
            "Query server returned HTTP %d: %s",
            response.statusCode,
            SqlTextUtil.truncate(response.body, GatewayConstants.MAX_ERROR_RESPONSE_LENGTH)));
  }

  private ServerResponse post(String body) throws PhoenixConnectException {
    HttpPost post = new HttpPost(endpointUrl);
    GatewayConstants.JSON_HTTP_HEADERS.forEach(post::addHeader);
    post.setEntity(
        new StringEntity(body, ContentType.create("application/json", StandardCharsets.UTF_8)));
    try (CloseableHttpResponse response = httpClient.execute(post)) {
      return new ServerResponse(
          response.getStatusLine().getStatusCode(), HttpUtil.readBody(response));
    } catch (IOException e) {
      throw new PhoenixConnectException(
          "Failed to read response from " + endpointUrl + ": " + e.getMessage(), e);
    }
  }

  private static final class ServerResponse {
    private final int statusCode;
    private final String body;

    private ServerResponse(int statusCode, String body) {
      this.statusCode = statusCode;
      this.body = body;
    }

    private boolean isSuccessful() {
      return HttpUtil.isSuccessfulStatus(statusCode);
    }
  }
}
