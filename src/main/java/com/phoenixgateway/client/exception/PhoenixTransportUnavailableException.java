package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.TransportFailure;

/** Thrown when the driver or client library needed by a transport is missing. */
public class PhoenixTransportUnavailableException extends PhoenixSQLException {

  public PhoenixTransportUnavailableException(String reason) {
    super(reason, TransportFailure.UNAVAILABLE);
  }

  public PhoenixTransportUnavailableException(String reason, Throwable cause) {
    super(reason, cause, TransportFailure.UNAVAILABLE);
  }
}
