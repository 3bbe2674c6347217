package com.phoenixgateway.client.dbclient.impl.common;

import com.phoenixgateway.client.config.IGatewayConfig;
import java.time.Duration;

/** Fixed attempt budget with a fixed delay between attempts of the protocol open sequence. */
public class ConnectRetryPolicy {

  private final int maxAttempts;
  private final Duration delay;
  private final Sleeper sleeper;

  public ConnectRetryPolicy(int maxAttempts, Duration delay, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.delay = delay;
    this.sleeper = sleeper;
  }

  public static ConnectRetryPolicy fromConfig(IGatewayConfig config) {
    return new ConnectRetryPolicy(
        config.getConnectMaxAttempts(),
        Duration.ofSeconds(config.getConnectRetryDelaySeconds()),
        Sleeper.SYSTEM);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getDelay() {
    return delay;
  }

  /** Waits the configured delay before the next attempt. */
  public void pause() throws InterruptedException {
    if (!delay.isZero() && !delay.isNegative()) {
      sleeper.sleep(delay);
    }
  }
}
