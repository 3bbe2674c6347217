package com.phoenixgateway.client.common;

/**
 * Classification of why a transport could not complete an operation. Drives the fallback and retry
 * decisions of the connection manager.
 */
public enum TransportFailure {
  /** Client library or driver missing from this environment. Permanent for the process. */
  UNAVAILABLE,
  /** Network or handshake failure. */
  CONNECT_FAILED,
  /** Response body that could not be understood. */
  PROTOCOL_ERROR,
  /** Structured SQL or engine error reported by the server. */
  REMOTE_ERROR
}
