package com.phoenixgateway.client.common;

/** Transport implementing the logical connection to the query server. */
public enum TransportKind {
  /** JDBC driver talking to the query server through its own client library. */
  DRIVER,
  /** JSON over HTTP requests sent directly to the query server endpoint. */
  PROTOCOL,
  NONE
}
