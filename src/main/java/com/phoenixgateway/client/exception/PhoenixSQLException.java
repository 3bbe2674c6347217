package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.TransportFailure;
import com.phoenixgateway.client.common.error.GatewayErrorCode;
import java.sql.SQLException;

/** Top level exception for the Phoenix gateway client */
public class PhoenixSQLException extends SQLException {

  private final TransportFailure failure;

  public PhoenixSQLException(String reason, TransportFailure failure) {
    super(reason, failure.name());
    this.failure = failure;
  }

  public PhoenixSQLException(String reason, Throwable cause, TransportFailure failure) {
    super(reason, failure.name(), cause);
    this.failure = failure;
  }

  public PhoenixSQLException(String reason, GatewayErrorCode internalError) {
    super(reason, internalError.name());
    this.failure = null;
  }

  public PhoenixSQLException(String reason, Throwable cause, GatewayErrorCode internalError) {
    super(reason, internalError.name(), cause);
    this.failure = null;
  }

  protected PhoenixSQLException(
      String reason, String sqlState, int vendorCode, Throwable cause, TransportFailure failure) {
    super(reason, sqlState, vendorCode, cause);
    this.failure = failure;
  }

  /**
   * @return the transport failure classification, or {@code null} when the error did not originate
   *     in a transport
   */
  public TransportFailure getFailure() {
    return failure;
  }

  public boolean isTransportFailure(TransportFailure expected) {
    return failure == expected;
  }
}
