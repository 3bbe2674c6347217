package com.phoenixgateway.client.exception;

import com.phoenixgateway.client.common.error.GatewayErrorCode;

/** Invalid input, configuration or call sequence. */
public class PhoenixValidationException extends PhoenixSQLException {

  public PhoenixValidationException(String reason) {
    super(reason, GatewayErrorCode.INPUT_VALIDATION_ERROR);
  }

  public PhoenixValidationException(String reason, GatewayErrorCode internalError) {
    super(reason, internalError);
  }

  public PhoenixValidationException(
      String reason, Throwable cause, GatewayErrorCode internalError) {
    super(reason, cause, internalError);
  }
}
