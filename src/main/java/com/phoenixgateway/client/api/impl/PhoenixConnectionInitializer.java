package com.phoenixgateway.client.api.impl;

import com.phoenixgateway.client.api.IPhoenixConnectionManager;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens the connection once in the background after a grace period, so that the first caller does
 * not pay for the cluster start-up. Failures are logged and never propagated; the next caller of
 * {@link IPhoenixConnectionManager#open()} tries again.
 */
public class PhoenixConnectionInitializer implements AutoCloseable {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(PhoenixConnectionInitializer.class);

  private final IPhoenixConnectionManager connectionManager;
  private final Duration gracePeriod;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final CompletableFuture<Boolean> completion = new CompletableFuture<>();
  private volatile ScheduledFuture<?> warmupTask;

  private static ThreadFactory createWarmupThreadFactory() {
    return new ThreadFactory() {
      private final AtomicInteger threadNumber = new AtomicInteger(1);

      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "Phoenix-Warmup-" + threadNumber.getAndIncrement());
        thread.setDaemon(true);
        return thread;
      }
    };
  }

  public PhoenixConnectionInitializer(
      IPhoenixConnectionManager connectionManager, Duration gracePeriod) {
    this.connectionManager = connectionManager;
    this.gracePeriod = gracePeriod;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(createWarmupThreadFactory());
  }

  /** Schedules the warm-up. Calls after the first have no effect. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info(
        "Waiting {} seconds for the cluster to initialize before connecting",
        gracePeriod.getSeconds());
    warmupTask =
        scheduler.schedule(this::warmUp, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Completes with {@code true} once the warm-up opened the connection, or {@code false} if it
   * failed or was cancelled.
   */
  public CompletableFuture<Boolean> getCompletion() {
    return completion;
  }

  public boolean isStarted() {
    return started.get();
  }

  @Override
  public void close() {
    ScheduledFuture<?> task = warmupTask;
    if (task != null && task.cancel(false)) {
      LOGGER.info("Cancelled pending connection warm-up");
    }
    scheduler.shutdownNow();
    completion.complete(false);
  }

  private void warmUp() {
    LOGGER.info("Initializing the query server connection");
    try {
      connectionManager.open();
      LOGGER.info(
          "Query server connection initialized using the {} transport",
          connectionManager.getActiveTransportKind());
      completion.complete(true);
    } catch (PhoenixSQLException | RuntimeException e) {
      LOGGER.warn(
          "Failed to initialize the query server connection; it will be attempted on the first"
              + " request: {}",
          e.toString());
      completion.complete(false);
    }
  }
}
