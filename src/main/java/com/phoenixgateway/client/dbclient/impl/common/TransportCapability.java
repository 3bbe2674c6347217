package com.phoenixgateway.client.dbclient.impl.common;

/** Outcome of probing whether a transport can run in this environment. */
public final class TransportCapability {

  private static final TransportCapability AVAILABLE = new TransportCapability(true, null);

  private final boolean available;
  private final String reason;

  private TransportCapability(boolean available, String reason) {
    this.available = available;
    this.reason = reason;
  }

  public static TransportCapability available() {
    return AVAILABLE;
  }

  public static TransportCapability unavailable(String reason) {
    return new TransportCapability(false, reason);
  }

  public boolean isAvailable() {
    return available;
  }

  /** Why the transport is unavailable; {@code null} when available. */
  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return available ? "available" : "unavailable: " + reason;
  }
}
