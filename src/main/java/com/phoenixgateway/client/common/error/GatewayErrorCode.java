package com.phoenixgateway.client.common.error;

/** Internal error codes, reported as the SQLState of errors that are not transport failures. */
public enum GatewayErrorCode {
  INVALID_STATE,
  INPUT_VALIDATION_ERROR,
  CONFIGURATION_ERROR,
  STORAGE_OPERATION_ERROR
}
