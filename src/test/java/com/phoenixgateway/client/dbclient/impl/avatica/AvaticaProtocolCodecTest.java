package com.phoenixgateway.client.dbclient.impl.avatica;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenixgateway.client.common.TransportFailure;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixProtocolException;
import com.phoenixgateway.client.exception.PhoenixRemoteException;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.model.avatica.AvaticaResultFrame;
import org.junit.jupiter.api.Test;

public class AvaticaProtocolCodecTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final AvaticaProtocolCodec codec = new AvaticaProtocolCodec();

  @Test
  public void testEncodeOpenConnection() throws Exception {
    JsonNode request = MAPPER.readTree(codec.encodeOpenConnection("conn-1"));

    assertEquals("openConnection", request.get("request").asText());
    assertEquals("conn-1", request.get("connectionId").asText());
    assertTrue(request.get("info").isObject());
    assertFalse(request.has("sql"));
  }

  @Test
  public void testEncodePrepareAndExecuteTrimsStatement() throws Exception {
    String padded = codec.encodePrepareAndExecute("c", 1, "SELECT * FROM t;   ", 10000);
    String plain = codec.encodePrepareAndExecute("c", 1, "SELECT * FROM t", 10000);

    assertEquals(plain, padded);
    JsonNode request = MAPPER.readTree(padded);
    assertEquals("prepareAndExecute", request.get("request").asText());
    assertEquals("SELECT * FROM t", request.get("sql").asText());
    assertEquals(1, request.get("statementId").asInt());
    assertEquals(10000, request.get("maxRowCount").asLong());
  }

  @Test
  public void testEncodeCloseRequests() throws Exception {
    JsonNode closeStatement = MAPPER.readTree(codec.encodeCloseStatement("c", 4));
    assertEquals("closeStatement", closeStatement.get("request").asText());
    assertEquals(4, closeStatement.get("statementId").asInt());

    JsonNode closeConnection = MAPPER.readTree(codec.encodeCloseConnection("c"));
    assertEquals("closeConnection", closeConnection.get("request").asText());
    assertEquals("c", closeConnection.get("connectionId").asText());
    assertFalse(closeConnection.has("statementId"));
  }

  @Test
  public void testDecodeOpenConnection() throws PhoenixSQLException {
    assertEquals(
        "server-id",
        codec.decodeOpenConnection(
            "{\"response\":\"openConnection\",\"connectionId\":\"server-id\"}", "requested"));
    assertEquals(
        "requested", codec.decodeOpenConnection("{\"response\":\"openConnection\"}", "requested"));
  }

  @Test
  public void testDecodeCreateStatement() throws PhoenixSQLException {
    assertEquals(
        7,
        codec.decodeCreateStatement(
            "{\"response\":\"createStatement\",\"connectionId\":\"c\",\"statementId\":7}"));
    assertThrows(
        PhoenixProtocolException.class,
        () -> codec.decodeCreateStatement("{\"response\":\"createStatement\"}"));
  }

  @Test
  public void testDecodeCompactShape() throws PhoenixSQLException {
    AvaticaResultFrame frame =
        codec.decodeExecute("{\"results\":[{\"columns\":[{\"name\":\"C1\"}],\"rows\":[[1]]}]}");

    assertEquals(1, frame.getColumns().size());
    assertEquals("C1", frame.getColumns().get(0).getName());
    assertNull(frame.getColumns().get(0).getTypeName());
    assertEquals(1, frame.getRows().size());
    assertEquals(1, frame.getRows().get(0).get(0).asInt());
  }

  @Test
  public void testDecodeServerShape() throws PhoenixSQLException {
    String body =
        "{\"response\":\"executeResults\",\"missingStatement\":false,\"results\":[{"
            + "\"response\":\"resultSet\",\"connectionId\":\"c\",\"statementId\":1,"
            + "\"ownStatement\":true,\"signature\":{\"columns\":["
            + "{\"ordinal\":0,\"columnName\":\"ID\",\"label\":\"ID\","
            + "\"type\":{\"type\":\"scalar\",\"id\":4,\"name\":\"INTEGER\"}},"
            + "{\"ordinal\":1,\"label\":\"NAME\",\"columnClassName\":\"java.lang.String\"}]},"
            + "\"firstFrame\":{\"offset\":0,\"done\":true,\"rows\":[[1,\"a\"],[2,null]]},"
            + "\"updateCount\":-1}]}";

    AvaticaResultFrame frame = codec.decodeExecute(body);

    assertEquals("ID", frame.getColumns().get(0).getName());
    assertEquals("INTEGER", frame.getColumns().get(0).getTypeName());
    assertEquals("NAME", frame.getColumns().get(1).getName());
    assertEquals("VARCHAR", frame.getColumns().get(1).getTypeName());
    assertEquals(2, frame.getRows().size());
    assertTrue(frame.getRows().get(1).get(1).isNull());
    assertEquals(-1L, frame.getUpdateCount());
  }

  @Test
  public void testEmptyResultsIsSuccess() throws PhoenixSQLException {
    AvaticaResultFrame frame = codec.decodeExecute("{\"results\":[]}");

    assertTrue(frame.getColumns().isEmpty());
    assertTrue(frame.getRows().isEmpty());
  }

  @Test
  public void testColumnsWithoutRowsIsZeroRowSuccess() throws PhoenixSQLException {
    AvaticaResultFrame frame =
        codec.decodeExecute("{\"results\":[{\"columns\":[{\"name\":\"ID\"}],\"rows\":[]}]}");

    assertEquals(1, frame.getColumns().size());
    assertTrue(frame.getRows().isEmpty());
  }

  @Test
  public void testErrorFieldIsRemoteError() {
    PhoenixRemoteException e =
        assertThrows(
            PhoenixRemoteException.class,
            () ->
                codec.decodeExecute(
                    "{\"error\":\"Table undefined. tableName=T\",\"results\":[]}"));

    assertEquals("Table undefined. tableName=T", e.getMessage());
    assertTrue(e.isTransportFailure(TransportFailure.REMOTE_ERROR));
  }

  @Test
  public void testServerErrorResponseIsRemoteError() {
    String body =
        "{\"response\":\"error\","
            + "\"exceptions\":[\"org.apache.phoenix.schema.TableNotFoundException\"],"
            + "\"errorMessage\":\"ERROR 1012 (42M03): Table undefined.\",\"errorCode\":1012,"
            + "\"sqlState\":\"42M03\",\"severity\":\"ERROR\"}";

    PhoenixRemoteException e =
        assertThrows(PhoenixRemoteException.class, () -> codec.decodeExecute(body));

    assertEquals("ERROR 1012 (42M03): Table undefined.", e.getMessage());
    assertEquals("42M03", e.getRemoteSqlState());
    assertEquals(1012, e.getErrorCode());
  }

  @Test
  public void testExceptionFieldIsRemoteError() {
    assertThrows(
        PhoenixRemoteException.class,
        () -> codec.decodeOpenConnection("{\"exception\":\"boom\"}", "requested"));
    assertThrows(
        PhoenixRemoteException.class,
        () -> codec.decodeExecute("{\"results\":[{\"exception\":\"boom\"}]}"));
  }

  @Test
  public void testMissingStatementIsConnectionFailure() {
    PhoenixConnectException e =
        assertThrows(
            PhoenixConnectException.class,
            () -> codec.decodeExecute("{\"missingStatement\":true,\"results\":[]}"));
    assertTrue(e.isTransportFailure(TransportFailure.CONNECT_FAILED));
  }

  @Test
  public void testMalformedBodiesAreProtocolErrors() {
    assertThrows(PhoenixProtocolException.class, () -> codec.decodeExecute("not json"));
    assertThrows(PhoenixProtocolException.class, () -> codec.decodeExecute(""));
    assertThrows(PhoenixProtocolException.class, () -> codec.decodeExecute("[1,2]"));
    assertThrows(PhoenixProtocolException.class, () -> codec.decodeExecute("{}"));
    assertThrows(
        PhoenixProtocolException.class, () -> codec.decodeExecute("{\"results\":{\"rows\":1}}"));
    assertThrows(
        PhoenixProtocolException.class,
        () -> codec.decodeExecute("{\"results\":[{\"columns\":[],\"rows\":[1]}]}"));
  }
}
