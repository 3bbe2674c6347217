package com.phoenixgateway.client.common;

/** Tag of a normalized result cell. */
public enum CellKind {
  NULL,
  STRING,
  INTEGER,
  FLOAT,
  BOOLEAN,
  BYTES
}
