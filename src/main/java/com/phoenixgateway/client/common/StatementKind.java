package com.phoenixgateway.client.common;

public enum StatementKind {
  /** Statement expected to return rows. */
  QUERY,
  /** Statement executed for its side effect (DDL, UPSERT, DELETE). */
  EXECUTE
}
