package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.TransportFailure;

/** Network or handshake failure while talking to the query server. */
public class PhoenixConnectException extends PhoenixSQLException {

  private final int attempts;

  public PhoenixConnectException(String reason) {
    this(reason, null, 1);
  }

  public PhoenixConnectException(String reason, Throwable cause) {
    this(reason, cause, 1);
  }

  public PhoenixConnectException(String reason, Throwable cause, int attempts) {
    super(reason, cause, TransportFailure.CONNECT_FAILED);
    this.attempts = attempts;
  }

  /** Number of connection attempts made before giving up. */
  public int getAttempts() {
    return attempts;
  }
}
