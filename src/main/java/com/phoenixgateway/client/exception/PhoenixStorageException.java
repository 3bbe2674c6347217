package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.error.GatewayErrorCode;

/** Failure of an operation against the HBase REST storage surface. */
public class PhoenixStorageException extends PhoenixSQLException {

  private final int statusCode;

  public PhoenixStorageException(String reason, int statusCode) {
    super(reason, GatewayErrorCode.STORAGE_OPERATION_ERROR);
    this.statusCode = statusCode;
  }

  public PhoenixStorageException(String reason, Throwable cause) {
    super(reason, cause, GatewayErrorCode.STORAGE_OPERATION_ERROR);
    this.statusCode = -1;
  }

  /** HTTP status returned by the storage REST server, or -1 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
