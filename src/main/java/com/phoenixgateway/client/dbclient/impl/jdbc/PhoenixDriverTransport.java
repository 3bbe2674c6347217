package com.phoenixgateway.client.dbclient.impl.jdbc;

import com.google.common.annotations.VisibleForTesting;
import com.phoenixgateway.client.api.impl.converters.ResultNormalizer;
import com.phoenixgateway.client.common.GatewayConstants;
import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import com.phoenixgateway.client.config.IGatewayConfig;
import com.phoenixgateway.client.dbclient.IPhoenixTransport;
import com.phoenixgateway.client.dbclient.impl.common.TransportCapability;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixRemoteException;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.exception.PhoenixTransportUnavailableException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Reaches the query server through the thin JDBC driver, when one is on the class path. The
 * transport holds at most one {@link Connection}; it issues no connection token.
 */
public class PhoenixDriverTransport implements IPhoenixTransport {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(PhoenixDriverTransport.class);
  private static final String NO_SUITABLE_DRIVER = "No suitable driver";
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  private final boolean enabled;
  private final String driverClassName;
  private final String driverUrl;
  private final int maxRowCount;
  private final JdbcConnectionFactory connectionFactory;
  private final ResultNormalizer normalizer;
  private volatile Connection connection;
  private volatile boolean connectionLost;

  public PhoenixDriverTransport(IGatewayConfig config) {
    this(config, JdbcConnectionFactory.DRIVER_MANAGER, new ResultNormalizer());
  }

  @VisibleForTesting
  PhoenixDriverTransport(
      IGatewayConfig config, JdbcConnectionFactory connectionFactory, ResultNormalizer normalizer) {
    this.enabled = config.isDriverEnabled();
    this.driverClassName = config.getDriverClassName();
    this.driverUrl = config.getDriverUrl();
    this.maxRowCount = config.getMaxRowCount();
    this.connectionFactory = connectionFactory;
    this.normalizer = normalizer;
  }

  @Override
  public TransportKind getKind() {
    return TransportKind.DRIVER;
  }

  @Override
  public TransportCapability probe() {
    if (!enabled) {
      return TransportCapability.unavailable("Driver transport disabled by configuration");
    }
    if (!connectionFactory.isDriverAvailable(driverClassName)) {
      return TransportCapability.unavailable("Driver class " + driverClassName + " not found");
    }
    return TransportCapability.available();
  }

  @Override
  public String open() throws PhoenixSQLException {
    Connection opened;
    try {
      opened = connectionFactory.connect(driverUrl, new Properties());
    } catch (SQLException e) {
      if (isNoSuitableDriver(e)) {
        throw new PhoenixTransportUnavailableException(e.getMessage(), e);
      }
      throw new PhoenixConnectException(
          "Driver connection to " + driverUrl + " failed: " + e.getMessage(), e);
    }
    if (opened == null) {
      throw new PhoenixTransportUnavailableException(
          "No registered driver accepts the url " + driverUrl);
    }
    connection = opened;
    connectionLost = false;
    LOGGER.debug("Opened driver connection to {}", driverUrl);
    return null;
  }

  @Override
  public TabularResult execute(String connectionToken, StatementRequest request)
      throws PhoenixSQLException {
    Connection current = connection;
    if (current == null) {
      throw new PhoenixConnectException("Driver connection is not open");
    }
    LOGGER.debug(
        "Executing statement: {}",
        SqlTextUtil.truncate(request.getSql(), GatewayConstants.MAX_LOGGED_SQL_LENGTH));
    try (Statement statement = current.createStatement()) {
      if (!request.isQuery()) {
        return TabularResult.ofUpdateCount(statement.executeUpdate(request.getSql()));
      }
      statement.setMaxRows(maxRowCount);
      try (ResultSet resultSet = statement.executeQuery(request.getSql())) {
        TabularResult result = normalizer.normalize(resultSet, maxRowCount);
        if (result.getRowCount() == 0) {
          LOGGER.debug("Query returned no rows");
        }
        return result;
      }
    } catch (SQLException e) {
      throw classifyExecuteFailure(current, e);
    }
  }

  /** A connection is dead once it is closed or a statement on it failed with a connection error. */
  @Override
  public boolean isAlive(String connectionToken) {
    Connection current = connection;
    return current != null && !connectionLost && !isClosed(current);
  }

  @Override
  public void close(String connectionToken) {
    Connection current = connection;
    connection = null;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (SQLException e) {
      LOGGER.debug("Ignoring failure while closing driver connection: {}", e.getMessage());
    }
  }

  private PhoenixSQLException classifyExecuteFailure(Connection current, SQLException e) {
    String sqlState = e.getSQLState();
    if (sqlState != null && sqlState.startsWith(CONNECTION_EXCEPTION_CLASS) || isClosed(current)) {
      connectionLost = true;
      return new PhoenixConnectException("Driver connection lost: " + e.getMessage(), e);
    }
    return new PhoenixRemoteException(e.getMessage(), sqlState, e.getErrorCode(), e);
  }

  private static boolean isClosed(Connection current) {
    try {
      return current.isClosed();
    } catch (SQLException e) {
      return true;
    }
  }

  private static boolean isNoSuitableDriver(SQLException e) {
    return e.getMessage() != null && e.getMessage().contains(NO_SUITABLE_DRIVER);
  }
}
