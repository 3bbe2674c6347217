package com.phoenixgateway.client.api;

import com.phoenixgateway.client.common.ConnectionState;
import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import java.util.Optional;

/** Owner of the single logical connection to the query server. */
public interface IPhoenixConnectionManager extends AutoCloseable {

  /**
   * Establishes the logical connection. Does nothing if the connection is already open and still
   * alive; a connection that died since it was opened is re-established. The driver transport is
   * tried first while it is eligible; any failure there permanently switches this manager to the
   * protocol transport, whose open is retried with a fixed delay.
   *
   * @throws PhoenixSQLException if no transport could be opened
   */
  void open() throws PhoenixSQLException;

  /**
   * Runs one statement on the open connection. Failures are never retried and never cause a
   * transport switch.
   *
   * @throws PhoenixSQLException if the connection is not open, the statement is blank or the
   *     transport fails
   */
  TabularResult execute(StatementRequest request) throws PhoenixSQLException;

  /** Closes the active transport, if any. A later {@link #open()} establishes a new connection. */
  @Override
  void close();

  ConnectionState getState();

  TransportKind getActiveTransportKind();

  Optional<String> getConnectionToken();

  boolean isDriverEligible();
}
