package com.phoenixgateway.client.dbclient.impl.common;

import java.time.Duration;

/** Blocks the calling thread between connection attempts. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
