package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.TransportFailure;

/**
 * SQL or engine error reported by the query server. The message is the engine's own message so it
 * can be looked up in the server documentation. The remote SQLState and error code are kept when
 * the server sends them.
 */
public class PhoenixRemoteException extends PhoenixSQLException {

  private final String remoteSqlState;

  public PhoenixRemoteException(String reason) {
    this(reason, null, 0, null);
  }

  public PhoenixRemoteException(
      String reason, String remoteSqlState, int remoteErrorCode, Throwable cause) {
    super(
        reason,
        TransportFailure.REMOTE_ERROR.name(),
        remoteErrorCode,
        cause,
        TransportFailure.REMOTE_ERROR);
    this.remoteSqlState = remoteSqlState;
  }

  /** SQLState reported by the server, or {@code null} if it sent none. */
  public String getRemoteSqlState() {
    return remoteSqlState;
  }
}
