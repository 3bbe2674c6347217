package com.phoenixgateway.client.api.impl;

import com.phoenixgateway.client.api.IPhoenixConnectionManager;
import com.phoenixgateway.client.common.ConnectionState;
import com.phoenixgateway.client.common.GatewayConstants;
import com.phoenixgateway.client.common.TransportFailure;
import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.common.error.GatewayErrorCode;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import com.phoenixgateway.client.dbclient.IPhoenixTransport;
import com.phoenixgateway.client.dbclient.impl.common.ConnectRetryPolicy;
import com.phoenixgateway.client.dbclient.impl.common.TransportCapability;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link IPhoenixConnectionManager}. State changes happen under a single lock so that
 * concurrent {@link #open()} calls issue one handshake between them; statement execution reads the
 * current connection snapshot without locking.
 */
public class PhoenixConnectionManager implements IPhoenixConnectionManager {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(PhoenixConnectionManager.class);
  private static final String[] PROTOBUF_MARKERS = {
    "InvalidProtocolBufferException", "InvalidWireTypeException"
  };

  private final IPhoenixTransport driverTransport;
  private final IPhoenixTransport protocolTransport;
  private final ConnectRetryPolicy retryPolicy;
  private final ReentrantLock stateLock = new ReentrantLock();

  private volatile LogicalConnection connection = LogicalConnection.closed();
  private volatile boolean driverEligible = true;

  public PhoenixConnectionManager(
      IPhoenixTransport driverTransport,
      IPhoenixTransport protocolTransport,
      ConnectRetryPolicy retryPolicy) {
    this.driverTransport = driverTransport;
    this.protocolTransport = protocolTransport;
    this.retryPolicy = retryPolicy;
  }

  /**
   * Does nothing while the current connection is open and its transport still reports it alive.
   * A connection that died since it was opened is released and established again.
   */
  @Override
  public void open() throws PhoenixSQLException {
    if (isAlive(connection)) {
      return;
    }
    stateLock.lock();
    try {
      LogicalConnection current = connection;
      if (isAlive(current)) {
        return;
      }
      if (current.isOpen()) {
        LOGGER.warn(
            "The {} connection is no longer usable; reconnecting", current.getTransportKind());
        transportFor(current.getTransportKind()).close(current.getConnectionToken());
      }
      connection = LogicalConnection.opening();
      try {
        if (driverEligible && openDriver()) {
          return;
        }
        openProtocol();
      } catch (PhoenixSQLException e) {
        connection = LogicalConnection.failed();
        throw e;
      }
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public TabularResult execute(StatementRequest request) throws PhoenixSQLException {
    if (request == null || request.getSql().isEmpty()) {
      throw new PhoenixValidationException("SQL statement is required");
    }
    LogicalConnection current = connection;
    if (!current.isOpen()) {
      throw new PhoenixValidationException(
          "Connection is " + current.getState() + "; open it before executing statements",
          GatewayErrorCode.INVALID_STATE);
    }
    IPhoenixTransport transport = transportFor(current.getTransportKind());
    try {
      return transport.execute(current.getConnectionToken(), request);
    } catch (PhoenixSQLException e) {
      if (e.isTransportFailure(TransportFailure.CONNECT_FAILED)) {
        LOGGER.warn(
            "Statement failed on the {} transport with a connection error: {}",
            current.getTransportKind(),
            e.getMessage());
      }
      throw e;
    }
  }

  @Override
  public void close() {
    stateLock.lock();
    try {
      LogicalConnection current = connection;
      if (current.getTransportKind() != TransportKind.NONE) {
        transportFor(current.getTransportKind()).close(current.getConnectionToken());
        LOGGER.info("Closed {} connection", current.getTransportKind());
      }
      connection = LogicalConnection.closed();
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public ConnectionState getState() {
    return connection.getState();
  }

  @Override
  public TransportKind getActiveTransportKind() {
    return connection.getTransportKind();
  }

  @Override
  public Optional<String> getConnectionToken() {
    return Optional.ofNullable(connection.getConnectionToken());
  }

  @Override
  public boolean isDriverEligible() {
    return driverEligible;
  }

  /** Returns {@code true} if the driver transport was opened; otherwise it is never tried again. */
  private boolean openDriver() {
    TransportCapability capability = driverTransport.probe();
    if (!capability.isAvailable()) {
      markDriverUnusable(capability.getReason());
      return false;
    }
    try {
      driverTransport.open();
    } catch (PhoenixSQLException e) {
      markDriverUnusable(e.getMessage());
      return false;
    }
    connection = LogicalConnection.open(TransportKind.DRIVER, null);
    LOGGER.info("Connected to the query server using the driver transport");
    return true;
  }

  private void markDriverUnusable(String reason) {
    driverEligible = false;
    LOGGER.warn(
        "Driver transport is unusable, using the protocol transport from now on: {}", reason);
  }

  private void openProtocol() throws PhoenixSQLException {
    int maxAttempts = retryPolicy.getMaxAttempts();
    PhoenixSQLException lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        String token = protocolTransport.open();
        connection = LogicalConnection.open(TransportKind.PROTOCOL, token);
        LOGGER.info(
            "Connected to the query server using the protocol transport on attempt {}/{}",
            attempt,
            maxAttempts);
        return;
      } catch (PhoenixSQLException e) {
        if (!isRetryable(e)) {
          throw e;
        }
        lastFailure = e;
        if (attempt < maxAttempts) {
          LOGGER.warn(
              "Connection attempt {}/{} failed: {}. Retrying in {} seconds",
              attempt,
              maxAttempts,
              e.getMessage(),
              retryPolicy.getDelay().getSeconds());
          pause(attempt);
        } else {
          LOGGER.warn("Connection attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
        }
      }
    }
    throw exhausted(maxAttempts, lastFailure);
  }

  private void pause(int attempt) throws PhoenixConnectException {
    try {
      retryPolicy.pause();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PhoenixConnectException(
          "Interrupted while waiting to retry the query server connection", e, attempt);
    }
  }

  private static boolean isRetryable(PhoenixSQLException e) {
    return e.isTransportFailure(TransportFailure.CONNECT_FAILED)
        || e.isTransportFailure(TransportFailure.REMOTE_ERROR);
  }

  private static PhoenixConnectException exhausted(int attempts, PhoenixSQLException lastFailure) {
    String lastResponse = lastFailure == null ? "" : String.valueOf(lastFailure.getMessage());
    StringBuilder message =
        new StringBuilder()
            .append("Failed to connect to the query server after ")
            .append(attempts)
            .append(" attempts. Last response: ")
            .append(SqlTextUtil.truncate(lastResponse, GatewayConstants.MAX_ERROR_RESPONSE_LENGTH));
    for (String marker : PROTOBUF_MARKERS) {
      if (lastResponse.contains(marker)) {
        message.append(
            ". The query server appears to use Protobuf serialization; configure it to serve JSON");
        break;
      }
    }
    return new PhoenixConnectException(message.toString(), lastFailure, attempts);
  }

  private boolean isAlive(LogicalConnection current) {
    return current.isOpen()
        && transportFor(current.getTransportKind()).isAlive(current.getConnectionToken());
  }

  private IPhoenixTransport transportFor(TransportKind kind) {
    return kind == TransportKind.DRIVER ? driverTransport : protocolTransport;
  }
}
