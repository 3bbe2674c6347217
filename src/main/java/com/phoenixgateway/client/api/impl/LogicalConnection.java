package com.phoenixgateway.client.api.impl;

import com.phoenixgateway.client.common.ConnectionState;
import com.phoenixgateway.client.common.TransportKind;
import java.util.Objects;

/**
 * Immutable snapshot of the logical connection. A token is present exactly when the connection is
 * open on the protocol transport.
 */
final class LogicalConnection {

  private static final LogicalConnection CLOSED =
      new LogicalConnection(ConnectionState.CLOSED, TransportKind.NONE, null);
  private static final LogicalConnection OPENING =
      new LogicalConnection(ConnectionState.OPENING, TransportKind.NONE, null);
  private static final LogicalConnection FAILED =
      new LogicalConnection(ConnectionState.FAILED, TransportKind.NONE, null);

  private final ConnectionState state;
  private final TransportKind transportKind;
  private final String connectionToken;

  private LogicalConnection(
      ConnectionState state, TransportKind transportKind, String connectionToken) {
    this.state = state;
    this.transportKind = transportKind;
    this.connectionToken = connectionToken;
  }

  static LogicalConnection closed() {
    return CLOSED;
  }

  static LogicalConnection opening() {
    return OPENING;
  }

  static LogicalConnection failed() {
    return FAILED;
  }

  static LogicalConnection open(TransportKind transportKind, String connectionToken) {
    Objects.requireNonNull(transportKind, "transportKind");
    if (transportKind == TransportKind.NONE) {
      throw new IllegalArgumentException("An open connection needs a transport");
    }
    if ((transportKind == TransportKind.PROTOCOL) != (connectionToken != null)) {
      throw new IllegalArgumentException(
          "Connection token must be set for, and only for, the protocol transport");
    }
    return new LogicalConnection(ConnectionState.OPEN, transportKind, connectionToken);
  }

  ConnectionState getState() {
    return state;
  }

  TransportKind getTransportKind() {
    return transportKind;
  }

  String getConnectionToken() {
    return connectionToken;
  }

  boolean isOpen() {
    return state == ConnectionState.OPEN;
  }

  @Override
  public String toString() {
    return "LogicalConnection{state="
        + state
        + ", transportKind="
        + transportKind
        + (connectionToken == null ? "" : ", connectionToken=" + connectionToken)
        + "}";
  }
}
