package com.phoenixgateway.client.dbclient.impl.avatica;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phoenixgateway.client.api.impl.converters.ResultNormalizer;
import com.phoenixgateway.client.common.TransportFailure;
import com.phoenixgateway.client.common.TransportKind;
import com.phoenixgateway.client.config.GatewayConfig;
import com.phoenixgateway.client.dbclient.impl.http.GatewayHttpClient;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixProtocolException;
import com.phoenixgateway.client.exception.PhoenixRemoteException;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.model.core.Cell;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import java.io.IOException;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@WireMockTest
public class AvaticaProtocolTransportTest {

  private static final String CONNECTION_ID = "conn-1";

  private GatewayHttpClient httpClient;
  private AvaticaProtocolTransport transport;

  @BeforeEach
  public void setUp(WireMockRuntimeInfo wireMock) throws PhoenixValidationException {
    Properties properties = new Properties();
    properties.setProperty(GatewayConfig.PHOENIX_URL, wireMock.getHttpBaseUrl());
    GatewayConfig config = new GatewayConfig(properties);
    httpClient = new GatewayHttpClient(5);
    transport =
        new AvaticaProtocolTransport(
            config,
            httpClient,
            new AvaticaProtocolCodec(),
            new ResultNormalizer(),
            () -> CONNECTION_ID);
  }

  @AfterEach
  public void tearDown() throws IOException {
    httpClient.close();
  }

  @Test
  public void testProbeAndKind() {
    assertEquals(TransportKind.PROTOCOL, transport.getKind());
    assertTrue(transport.probe().isAvailable());
  }

  @Test
  public void testOpenReturnsServerConnectionId() throws PhoenixSQLException {
    stubRequest(
        "openConnection",
        okJson("{\"response\":\"openConnection\",\"connectionId\":\"" + CONNECTION_ID + "\"}"));

    assertEquals(CONNECTION_ID, transport.open());

    verify(
        postRequestedFor(urlEqualTo("/json"))
            .withHeader("Content-Type", containing("application/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo("openConnection")))
            .withRequestBody(matchingJsonPath("$.connectionId", equalTo(CONNECTION_ID))));
  }

  @Test
  public void testOpenWithHttpFailureIsConnectFailed() {
    stubRequest(
        "openConnection",
        aResponse()
            .withStatus(500)
            .withBody("com.google.protobuf.InvalidProtocolBufferException: bad wire type"));

    PhoenixConnectException e = assertThrows(PhoenixConnectException.class, transport::open);

    assertTrue(e.isTransportFailure(TransportFailure.CONNECT_FAILED));
    assertTrue(e.getMessage().contains("HTTP 500"));
    assertTrue(e.getMessage().contains("InvalidProtocolBufferException"));
  }

  @Test
  public void testExecuteSelectOne() throws PhoenixSQLException {
    stubCreateStatement();
    stubRequest(
        "prepareAndExecute",
        okJson("{\"results\":[{\"columns\":[{\"name\":\"C1\"}],\"rows\":[[1]]}]}"));
    stubRequest("closeStatement", okJson("{\"response\":\"closeStatement\"}"));

    TabularResult result = transport.execute(CONNECTION_ID, StatementRequest.query("SELECT 1"));

    assertEquals(List.of("C1"), result.getColumnNames());
    assertEquals(1, result.getRowCount());
    assertEquals(Cell.ofInteger(1), result.getRows().get(0).get("C1"));
    assertEquals(1L, result.getRows().get(0).toValueMap().get("C1"));
    verify(
        postRequestedFor(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo("prepareAndExecute")))
            .withRequestBody(matchingJsonPath("$.connectionId", equalTo(CONNECTION_ID)))
            .withRequestBody(matchingJsonPath("$.statementId", equalTo("3")))
            .withRequestBody(matchingJsonPath("$.sql", equalTo("SELECT 1")))
            .withRequestBody(matchingJsonPath("$.maxRowCount", equalTo("10000"))));
    verify(
        1,
        postRequestedFor(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo("closeStatement"))));
  }

  @Test
  public void testExecuteSendsTrimmedStatement() throws PhoenixSQLException {
    stubCreateStatement();
    stubRequest("prepareAndExecute", okJson("{\"results\":[]}"));
    stubRequest("closeStatement", okJson("{}"));

    TabularResult result =
        transport.execute(CONNECTION_ID, StatementRequest.query("SELECT * FROM t;   "));

    assertEquals(0, result.getRowCount());
    verify(
        postRequestedFor(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.sql", equalTo("SELECT * FROM t"))));
  }

  @Test
  public void testExecuteStatementReportsUpdateCount() throws PhoenixSQLException {
    stubCreateStatement();
    stubRequest("prepareAndExecute", okJson("{\"results\":[{\"updateCount\":2}]}"));
    stubRequest("closeStatement", okJson("{}"));

    TabularResult result =
        transport.execute(
            CONNECTION_ID, StatementRequest.execute("UPSERT INTO t VALUES (1, 'a')"));

    assertEquals(2L, result.getUpdateCount());
    verify(
        postRequestedFor(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo("prepareAndExecute")))
            .withRequestBody(matchingJsonPath("$.maxRowCount", equalTo("0"))));
  }

  @Test
  public void testServerErrorIsRemoteErrorAndStatementIsClosed() {
    stubCreateStatement();
    stubRequest(
        "prepareAndExecute",
        aResponse()
            .withStatus(500)
            .withHeader("Content-Type", "application/json")
            .withBody(
                "{\"response\":\"error\",\"errorMessage\":\"ERROR 1012 (42M03): Table undefined."
                    + " tableName=MISSING\",\"errorCode\":1012,\"sqlState\":\"42M03\"}"));
    stubRequest("closeStatement", okJson("{}"));

    PhoenixRemoteException e =
        assertThrows(
            PhoenixRemoteException.class,
            () ->
                transport.execute(
                    CONNECTION_ID, StatementRequest.query("SELECT * FROM MISSING")));

    assertTrue(e.getMessage().contains("Table undefined"));
    verify(
        1,
        postRequestedFor(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo("closeStatement"))));
  }

  @Test
  public void testHttpFailureWithoutErrorBodyIsConnectFailed() {
    stubRequest("createStatement", aResponse().withStatus(502).withBody("Bad Gateway"));

    PhoenixConnectException e =
        assertThrows(
            PhoenixConnectException.class,
            () -> transport.execute(CONNECTION_ID, StatementRequest.query("SELECT 1")));
    assertTrue(e.getMessage().contains("HTTP 502"));
  }

  @Test
  public void testConnectFailureMarksTokenDeadUntilClosed() {
    stubRequest("createStatement", aResponse().withStatus(502).withBody("Bad Gateway"));
    stubRequest("closeConnection", okJson("{}"));
    assertTrue(transport.isAlive(CONNECTION_ID));

    assertThrows(
        PhoenixConnectException.class,
        () -> transport.execute(CONNECTION_ID, StatementRequest.query("SELECT 1")));
    assertFalse(transport.isAlive(CONNECTION_ID));

    transport.close(CONNECTION_ID);
    assertTrue(transport.isAlive(CONNECTION_ID));
    assertFalse(transport.isAlive(null));
  }

  @Test
  public void testRemoteErrorKeepsTokenAlive() {
    stubCreateStatement();
    stubRequest(
        "prepareAndExecute",
        aResponse()
            .withStatus(500)
            .withHeader("Content-Type", "application/json")
            .withBody(
                "{\"response\":\"error\",\"errorMessage\":\"ERROR 1012 (42M03): Table undefined."
                    + "\",\"errorCode\":1012,\"sqlState\":\"42M03\"}"));
    stubRequest("closeStatement", okJson("{}"));

    assertThrows(
        PhoenixRemoteException.class,
        () -> transport.execute(CONNECTION_ID, StatementRequest.query("SELECT * FROM MISSING")));
    assertTrue(transport.isAlive(CONNECTION_ID));
  }

  @Test
  public void testMalformedResponseIsProtocolError() {
    stubCreateStatement();
    stubRequest("prepareAndExecute", okJson("{\"results\": not-json"));
    stubRequest("closeStatement", okJson("{}"));

    assertThrows(
        PhoenixProtocolException.class,
        () -> transport.execute(CONNECTION_ID, StatementRequest.query("SELECT 1")));
  }

  @Test
  public void testExecuteWithoutTokenIsRejected() {
    assertThrows(
        PhoenixValidationException.class,
        () -> transport.execute(null, StatementRequest.query("SELECT 1")));
  }

  @Test
  public void testCloseIgnoresFailures() {
    stubRequest("closeConnection", aResponse().withStatus(500));

    transport.close(CONNECTION_ID);
    transport.close(null);

    verify(
        1,
        postRequestedFor(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo("closeConnection"))));
  }

  private static void stubCreateStatement() {
    stubRequest(
        "createStatement",
        okJson(
            "{\"response\":\"createStatement\",\"connectionId\":\""
                + CONNECTION_ID
                + "\",\"statementId\":3}"));
  }

  private static void stubRequest(String requestName, ResponseDefinitionBuilder response) {
    stubFor(
        post(urlEqualTo("/json"))
            .withRequestBody(matchingJsonPath("$.request", equalTo(requestName)))
            .willReturn(response));
  }
}
