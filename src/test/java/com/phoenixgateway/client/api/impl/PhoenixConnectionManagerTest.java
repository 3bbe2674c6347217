package com.phoenixgateway.client.api.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.phoenixgateway.client.common.ConnectionState;
import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.common.error.GatewayErrorCode;
import com.phoenixgateway.client.dbclient.IPhoenixTransport;
import com.phoenixgateway.client.dbclient.impl.common.ConnectRetryPolicy;
import com.phoenixgateway.client.dbclient.impl.common.TransportCapability;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixProtocolException;
import com.phoenixgateway.client.exception.PhoenixRemoteException;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.exception.PhoenixTransportUnavailableException;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class PhoenixConnectionManagerTest {

  private static final Duration DELAY = Duration.ofSeconds(15);
  private static final String TOKEN = "connection-token";

  @Mock IPhoenixTransport driverTransport;
  @Mock IPhoenixTransport protocolTransport;

  private final List<Duration> recordedDelays = Collections.synchronizedList(new ArrayList<>());
  private PhoenixConnectionManager manager;

  @BeforeEach
  public void setUp() {
    manager = newManager(10);
  }

  @Test
  public void testInitialState() {
    assertEquals(ConnectionState.CLOSED, manager.getState());
    assertEquals(TransportKind.NONE, manager.getActiveTransportKind());
    assertTrue(manager.getConnectionToken().isEmpty());
    assertTrue(manager.isDriverEligible());
  }

  @Test
  public void testDriverIsPreferredWhenAvailable() throws PhoenixSQLException {
    when(driverTransport.probe()).thenReturn(TransportCapability.available());
    when(driverTransport.open()).thenReturn(null);

    manager.open();

    assertEquals(ConnectionState.OPEN, manager.getState());
    assertEquals(TransportKind.DRIVER, manager.getActiveTransportKind());
    assertTrue(manager.getConnectionToken().isEmpty());
    verifyNoInteractions(protocolTransport);
  }

  @Test
  public void testOpenIsIdempotent() throws PhoenixSQLException {
    driverUnavailable();
    when(protocolTransport.open()).thenReturn(TOKEN);
    when(protocolTransport.isAlive(TOKEN)).thenReturn(true);

    manager.open();
    manager.open();

    verify(driverTransport, times(1)).probe();
    verify(protocolTransport, times(1)).open();
    assertEquals(ConnectionState.OPEN, manager.getState());
    assertEquals(TOKEN, manager.getConnectionToken().orElseThrow());
  }

  @Test
  public void testConcurrentOpenPerformsOneHandshake() throws Exception {
    driverUnavailable();
    CountDownLatch release = new CountDownLatch(1);
    when(protocolTransport.open())
        .thenAnswer(
            invocation -> {
              release.await(5, TimeUnit.SECONDS);
              return TOKEN;
            });
    when(protocolTransport.isAlive(TOKEN)).thenReturn(true);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(
            executor.submit(
                () -> {
                  manager.open();
                  return null;
                }));
      }
      release.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    verify(protocolTransport, times(1)).open();
    assertEquals(ConnectionState.OPEN, manager.getState());
  }

  @Test
  public void testFallbackIsPermanent() throws PhoenixSQLException {
    when(driverTransport.probe()).thenReturn(TransportCapability.available());
    when(driverTransport.open()).thenThrow(new PhoenixConnectException("handshake rejected"));
    when(protocolTransport.open()).thenReturn(TOKEN);

    manager.open();
    assertFalse(manager.isDriverEligible());
    assertEquals(TransportKind.PROTOCOL, manager.getActiveTransportKind());

    manager.close();
    manager.open();

    verify(driverTransport, times(1)).probe();
    verify(driverTransport, times(1)).open();
    verify(protocolTransport, times(2)).open();
    assertFalse(manager.isDriverEligible());
  }

  @Test
  public void testDroppedDriverConnectionIsReopened() throws PhoenixSQLException {
    AtomicBoolean alive = new AtomicBoolean();
    when(driverTransport.probe()).thenReturn(TransportCapability.available());
    when(driverTransport.open())
        .thenAnswer(
            invocation -> {
              alive.set(true);
              return null;
            });
    when(driverTransport.isAlive(null)).thenAnswer(invocation -> alive.get());
    when(driverTransport.execute(any(), any()))
        .thenAnswer(
            invocation -> {
              alive.set(false);
              throw new PhoenixConnectException("Connection reset");
            });
    manager.open();
    assertThrows(
        PhoenixConnectException.class, () -> manager.execute(StatementRequest.query("SELECT 1")));

    manager.open();
    manager.open();

    verify(driverTransport, times(2)).open();
    verify(driverTransport).close(null);
    assertEquals(ConnectionState.OPEN, manager.getState());
    assertEquals(TransportKind.DRIVER, manager.getActiveTransportKind());
    assertTrue(manager.isDriverEligible());
    verifyNoInteractions(protocolTransport);
  }

  @Test
  public void testDeadProtocolConnectionGetsNewToken() throws PhoenixSQLException {
    driverUnavailable();
    when(protocolTransport.open()).thenReturn(TOKEN, "second-token");
    when(protocolTransport.isAlive(TOKEN)).thenReturn(false);
    manager.open();

    manager.open();

    verify(protocolTransport, times(2)).open();
    verify(protocolTransport).close(TOKEN);
    verify(driverTransport, times(1)).probe();
    assertEquals("second-token", manager.getConnectionToken().orElseThrow());
    assertEquals(ConnectionState.OPEN, manager.getState());
  }

  @Test
  public void testFailedDriverReconnectFallsBackToProtocol() throws PhoenixSQLException {
    when(driverTransport.probe()).thenReturn(TransportCapability.available());
    when(driverTransport.open())
        .thenReturn(null)
        .thenThrow(new PhoenixConnectException("Connection refused"));
    when(driverTransport.isAlive(null)).thenReturn(false);
    when(protocolTransport.open()).thenReturn(TOKEN);
    manager.open();

    manager.open();

    verify(driverTransport).close(null);
    assertFalse(manager.isDriverEligible());
    assertEquals(TransportKind.PROTOCOL, manager.getActiveTransportKind());
    assertEquals(TOKEN, manager.getConnectionToken().orElseThrow());
  }

  @Test
  public void testDriverUnavailableExceptionFallsBack() throws PhoenixSQLException {
    when(driverTransport.probe()).thenReturn(TransportCapability.available());
    when(driverTransport.open())
        .thenThrow(new PhoenixTransportUnavailableException("No suitable driver"));
    when(protocolTransport.open()).thenReturn(TOKEN);

    manager.open();

    assertFalse(manager.isDriverEligible());
    assertEquals(TransportKind.PROTOCOL, manager.getActiveTransportKind());
  }

  @Test
  public void testRetryBudgetExhaustion() throws PhoenixSQLException {
    manager = newManager(4);
    driverUnavailable();
    when(protocolTransport.open()).thenThrow(new PhoenixConnectException("Connection refused"));

    PhoenixConnectException e = assertThrows(PhoenixConnectException.class, manager::open);

    verify(protocolTransport, times(4)).open();
    assertEquals(List.of(DELAY, DELAY, DELAY), recordedDelays);
    assertEquals(4, e.getAttempts());
    assertTrue(e.getMessage().contains("after 4 attempts"));
    assertTrue(e.getMessage().contains("Connection refused"));
    assertEquals(ConnectionState.FAILED, manager.getState());
    assertEquals(TransportKind.NONE, manager.getActiveTransportKind());
    assertTrue(manager.getConnectionToken().isEmpty());
  }

  @Test
  public void testExhaustionMentionsProtobufServer() throws PhoenixSQLException {
    manager = newManager(2);
    driverUnavailable();
    when(protocolTransport.open())
        .thenThrow(
            new PhoenixConnectException(
                "openConnection returned HTTP 500: InvalidProtocolBufferException"));

    PhoenixConnectException e = assertThrows(PhoenixConnectException.class, manager::open);

    assertTrue(e.getMessage().contains("Protobuf"));
  }

  @Test
  public void testDriverUnavailableThenProtocolSucceedsOnThirdAttempt()
      throws PhoenixSQLException {
    driverUnavailable();
    when(protocolTransport.open())
        .thenThrow(new PhoenixConnectException("warming up"))
        .thenThrow(new PhoenixRemoteException("server starting"))
        .thenReturn(TOKEN);

    manager.open();

    assertEquals(ConnectionState.OPEN, manager.getState());
    assertEquals(TransportKind.PROTOCOL, manager.getActiveTransportKind());
    assertEquals(TOKEN, manager.getConnectionToken().orElseThrow());
    verify(protocolTransport, times(3)).open();
    assertEquals(List.of(DELAY, DELAY), recordedDelays);
  }

  @Test
  public void testProtocolErrorIsNotRetried() throws PhoenixSQLException {
    driverUnavailable();
    when(protocolTransport.open()).thenThrow(new PhoenixProtocolException("not json"));

    assertThrows(PhoenixProtocolException.class, manager::open);

    verify(protocolTransport, times(1)).open();
    assertTrue(recordedDelays.isEmpty());
    assertEquals(ConnectionState.FAILED, manager.getState());
  }

  @Test
  public void testInterruptedRetryStops() throws PhoenixSQLException {
    manager =
        new PhoenixConnectionManager(
            driverTransport,
            protocolTransport,
            new ConnectRetryPolicy(
                3,
                DELAY,
                delay -> {
                  throw new InterruptedException("stop");
                }));
    driverUnavailable();
    when(protocolTransport.open()).thenThrow(new PhoenixConnectException("refused"));

    try {
      PhoenixConnectException e = assertThrows(PhoenixConnectException.class, manager::open);
      assertEquals(1, e.getAttempts());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
    verify(protocolTransport, times(1)).open();
  }

  @Test
  public void testExecuteBeforeOpenIsRejected() {
    PhoenixValidationException e =
        assertThrows(
            PhoenixValidationException.class,
            () -> manager.execute(StatementRequest.query("SELECT 1")));

    assertEquals(GatewayErrorCode.INVALID_STATE.name(), e.getSQLState());
    verifyNoInteractions(driverTransport, protocolTransport);
  }

  @Test
  public void testBlankStatementIsRejected() {
    assertThrows(
        PhoenixValidationException.class, () -> manager.execute(StatementRequest.query(" ; ")));
    assertThrows(PhoenixValidationException.class, () -> manager.execute(null));
  }

  @Test
  public void testExecuteRoutesToActiveTransportWithToken() throws PhoenixSQLException {
    driverUnavailable();
    when(protocolTransport.open()).thenReturn(TOKEN);
    TabularResult expected = TabularResult.ofUpdateCount(1);
    StatementRequest request = StatementRequest.execute("DELETE FROM T");
    when(protocolTransport.execute(TOKEN, request)).thenReturn(expected);
    manager.open();

    assertSame(expected, manager.execute(request));
  }

  @Test
  public void testExecuteFailureDoesNotFailOver() throws PhoenixSQLException {
    when(driverTransport.probe()).thenReturn(TransportCapability.available());
    when(driverTransport.open()).thenReturn(null);
    when(driverTransport.execute(any(), any()))
        .thenThrow(new PhoenixConnectException("connection reset"));
    manager.open();

    assertThrows(
        PhoenixConnectException.class, () -> manager.execute(StatementRequest.query("SELECT 1")));

    assertEquals(ConnectionState.OPEN, manager.getState());
    assertEquals(TransportKind.DRIVER, manager.getActiveTransportKind());
    assertTrue(manager.isDriverEligible());
    verifyNoInteractions(protocolTransport);
  }

  @Test
  public void testCloseReleasesActiveTransport() throws PhoenixSQLException {
    driverUnavailable();
    when(protocolTransport.open()).thenReturn(TOKEN);
    manager.open();

    manager.close();

    verify(protocolTransport).close(TOKEN);
    assertEquals(ConnectionState.CLOSED, manager.getState());
    assertEquals(TransportKind.NONE, manager.getActiveTransportKind());
    assertTrue(manager.getConnectionToken().isEmpty());
    assertFalse(manager.isDriverEligible());
    assertThrows(
        PhoenixValidationException.class,
        () -> manager.execute(StatementRequest.query("SELECT 1")));
  }

  @Test
  public void testCloseWhenNotOpenTouchesNoTransport() {
    manager.close();

    verifyNoInteractions(driverTransport, protocolTransport);
    assertEquals(ConnectionState.CLOSED, manager.getState());
  }

  private void driverUnavailable() {
    when(driverTransport.probe())
        .thenReturn(TransportCapability.unavailable("Driver class not found"));
  }

  private PhoenixConnectionManager newManager(int maxAttempts) {
    return new PhoenixConnectionManager(
        driverTransport,
        protocolTransport,
        new ConnectRetryPolicy(maxAttempts, DELAY, recordedDelays::add));
  }
}
