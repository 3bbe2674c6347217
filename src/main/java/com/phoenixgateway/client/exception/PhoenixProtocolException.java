package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.TransportFailure;

/** Malformed or unexpected response body from the query server. */
public class PhoenixProtocolException extends PhoenixSQLException {

  public PhoenixProtocolException(String reason) {
    super(reason, TransportFailure.PROTOCOL_ERROR);
  }

  public PhoenixProtocolException(String reason, Throwable cause) {
    super(reason, cause, TransportFailure.PROTOCOL_ERROR);
  }
}
