package com.phoenixgateway.client.common;

/** Lifecycle state of the logical connection. */
public enum ConnectionState {
  CLOSED,
  OPENING,
  OPEN,
  FAILED
}
