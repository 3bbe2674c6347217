package com.phoenixgateway.client.dbclient;

import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.dbclient.impl.common.TransportCapability;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;

/** One way of reaching the query server. Implementations perform a single attempt per call. */
public interface IPhoenixTransport {

  TransportKind getKind();

  /** Reports whether this transport can be used at all in the current environment. */
  TransportCapability probe();

  /**
   * Opens a session with the query server.
   *
   * @return the connection token issued by the server, or {@code null} if the transport does not
   *     use one
   */
  String open() throws PhoenixSQLException;

  /**
   * Reports whether the session opened by {@link #open()} can still run statements. Must not call
   * the server.
   *
   * @param connectionToken token returned by {@link #open()}, ignored by transports without one
   */
  boolean isAlive(String connectionToken);

  /**
   * Runs one statement.
   *
   * @param connectionToken token returned by {@link #open()}, ignored by transports without one
   */
  TabularResult execute(String connectionToken, StatementRequest request)
      throws PhoenixSQLException;

  /** Closes the session. Failures are logged, never thrown. */
  void close(String connectionToken);
}
