package com.phoenixgateway.client.dbclient.impl.avatica;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.annotations.VisibleForTesting;
import com.phoenixgateway.client.common.GatewayConstants;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixProtocolException;
import com.phoenixgateway.client.exception.PhoenixRemoteException;
import com.phoenixgateway.client.model.avatica.AvaticaColumn;
import com.phoenixgateway.client.model.avatica.AvaticaRequest;
import com.phoenixgateway.client.model.avatica.AvaticaResultFrame;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encodes requests for the query server's JSON endpoint and decodes its responses. Decoding always
 * checks for an error object first, so an error response is never mistaken for an empty result.
 */
public class AvaticaProtocolCodec {

  private static final String MISSING_STATEMENT = "missingStatement";

  private final ObjectMapper objectMapper;

  public AvaticaProtocolCodec() {
    this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
  }

  public AvaticaProtocolCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encodeOpenConnection(String connectionId) throws PhoenixProtocolException {
    return write(
        new AvaticaRequest(AvaticaRequest.OPEN_CONNECTION)
            .setConnectionId(connectionId)
            .setInfo(Collections.emptyMap()));
  }

  public String encodeCreateStatement(String connectionId) throws PhoenixProtocolException {
    return write(
        new AvaticaRequest(AvaticaRequest.CREATE_STATEMENT).setConnectionId(connectionId));
  }

  /** The statement text is sent without surrounding whitespace or trailing {@code ;}. */
  public String encodePrepareAndExecute(
      String connectionId, int statementId, String sql, long maxRowCount)
      throws PhoenixProtocolException {
    return write(
        new AvaticaRequest(AvaticaRequest.PREPARE_AND_EXECUTE)
            .setConnectionId(connectionId)
            .setStatementId(statementId)
            .setSql(SqlTextUtil.trimStatement(sql))
            .setMaxRowCount(maxRowCount));
  }

  public String encodeCloseStatement(String connectionId, int statementId)
      throws PhoenixProtocolException {
    return write(
        new AvaticaRequest(AvaticaRequest.CLOSE_STATEMENT)
            .setConnectionId(connectionId)
            .setStatementId(statementId));
  }

  public String encodeCloseConnection(String connectionId) throws PhoenixProtocolException {
    return write(
        new AvaticaRequest(AvaticaRequest.CLOSE_CONNECTION).setConnectionId(connectionId));
  }

  /**
   * @param requestedId the id sent in the open request, used when the server does not echo one
   * @return the connection token to use for subsequent calls
   */
  public String decodeOpenConnection(String body, String requestedId)
      throws PhoenixProtocolException, PhoenixRemoteException {
    JsonNode root = parse(body);
    checkForError(root);
    String connectionId = text(root, "connectionId");
    if (connectionId != null) {
      return connectionId;
    }
    if (requestedId == null) {
      throw new PhoenixProtocolException(
          "openConnection response carried no connectionId: " + abbreviate(body));
    }
    return requestedId;
  }

  public int decodeCreateStatement(String body)
      throws PhoenixProtocolException, PhoenixRemoteException {
    JsonNode root = parse(body);
    checkForError(root);
    JsonNode statementId = root.get("statementId");
    if (statementId == null || !statementId.canConvertToInt()) {
      throw new PhoenixProtocolException(
          "createStatement response carried no statementId: " + abbreviate(body));
    }
    return statementId.asInt();
  }

  /**
   * Decodes the first result of an execute response. Both the compact {@code columns}/{@code rows}
   * shape and the server's {@code signature}/{@code firstFrame} shape are accepted. An empty
   * results array decodes to an empty frame.
   */
  public AvaticaResultFrame decodeExecute(String body)
      throws PhoenixProtocolException, PhoenixRemoteException, PhoenixConnectException {
    JsonNode root = parse(body);
    checkForError(root);
    if (MISSING_STATEMENT.equals(text(root, "response"))
        || root.path("missingStatement").asBoolean(false)) {
      throw new PhoenixConnectException("Statement is no longer known to the query server");
    }
    JsonNode results = root.get("results");
    if (results == null || results.isNull()) {
      throw new PhoenixProtocolException(
          "Execute response carried no results: " + abbreviate(body));
    }
    if (!results.isArray()) {
      throw new PhoenixProtocolException("Execute response results is not an array");
    }
    if (results.size() == 0) {
      return AvaticaResultFrame.empty();
    }
    JsonNode result = results.get(0);
    checkForError(result);

    JsonNode columnsNode = result.get("columns");
    if (columnsNode == null || columnsNode.isNull()) {
      columnsNode = result.path("signature").get("columns");
    }
    JsonNode rowsNode = result.get("rows");
    if (rowsNode == null || rowsNode.isNull()) {
      rowsNode = result.path("firstFrame").get("rows");
    }
    long updateCount = result.path("updateCount").asLong(-1L);
    return new AvaticaResultFrame(decodeColumns(columnsNode), decodeRows(rowsNode), updateCount);
  }

  @VisibleForTesting
  JsonNode parse(String body) throws PhoenixProtocolException {
    if (body == null || body.isBlank()) {
      throw new PhoenixProtocolException("Empty response from the query server");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new PhoenixProtocolException(
          "Malformed JSON response from the query server: " + abbreviate(body), e);
    }
    if (root == null || !root.isObject()) {
      throw new PhoenixProtocolException(
          "Expected a JSON object from the query server but got: " + abbreviate(body));
    }
    return root;
  }

  /** Throws if {@code node} is an error object, in any of the forms the server produces. */
  @VisibleForTesting
  void checkForError(JsonNode node) throws PhoenixRemoteException {
    if (node == null || !node.isObject()) {
      return;
    }
    boolean isError =
        "error".equals(text(node, "response"))
            || node.hasNonNull("error")
            || node.hasNonNull("exception")
            || node.path("exceptions").isArray() && node.path("exceptions").size() > 0
            || node.hasNonNull("errorMessage");
    if (!isError) {
      return;
    }
    String sqlState = text(node, "sqlState");
    int errorCode = node.path("errorCode").asInt(0);
    throw new PhoenixRemoteException(errorMessage(node), sqlState, errorCode, null);
  }

  private String errorMessage(JsonNode node) {
    String message = text(node, "errorMessage");
    if (message != null) {
      return message;
    }
    JsonNode error = node.get("error");
    if (error != null && !error.isNull()) {
      return error.isTextual() ? error.asText() : error.toString();
    }
    String exception = text(node, "exception");
    if (exception != null) {
      return exception;
    }
    JsonNode exceptions = node.path("exceptions");
    if (exceptions.isArray() && exceptions.size() > 0) {
      JsonNode first = exceptions.get(0);
      return first.isTextual() ? first.asText() : first.toString();
    }
    return "Query server returned an error: " + abbreviate(node.toString());
  }

  private List<AvaticaColumn> decodeColumns(JsonNode columnsNode)
      throws PhoenixProtocolException {
    if (columnsNode == null || columnsNode.isNull()) {
      return Collections.emptyList();
    }
    if (!columnsNode.isArray()) {
      throw new PhoenixProtocolException("Result columns is not an array");
    }
    List<AvaticaColumn> columns = new ArrayList<>(columnsNode.size());
    for (JsonNode column : columnsNode) {
      if (column.isTextual()) {
        columns.add(new AvaticaColumn(column.asText(), null));
        continue;
      }
      String name = text(column, "columnName");
      if (name == null) {
        name = text(column, "label");
      }
      if (name == null) {
        name = text(column, "name");
      }
      String typeName = text(column.path("type"), "name");
      if (typeName == null && column.path("type").isTextual()) {
        typeName = column.path("type").asText();
      }
      if (typeName == null) {
        typeName = typeForClassName(text(column, "columnClassName"));
      }
      columns.add(new AvaticaColumn(name, typeName));
    }
    return columns;
  }

  private List<List<JsonNode>> decodeRows(JsonNode rowsNode) throws PhoenixProtocolException {
    if (rowsNode == null || rowsNode.isNull()) {
      return Collections.emptyList();
    }
    if (!rowsNode.isArray()) {
      throw new PhoenixProtocolException("Result rows is not an array");
    }
    List<List<JsonNode>> rows = new ArrayList<>(rowsNode.size());
    for (JsonNode row : rowsNode) {
      if (!row.isArray()) {
        throw new PhoenixProtocolException(
            "Result row is not an array: " + abbreviate(row.toString()));
      }
      List<JsonNode> values = new ArrayList<>(row.size());
      for (JsonNode value : row) {
        values.add(value == null ? NullNode.getInstance() : value);
      }
      rows.add(values);
    }
    return rows;
  }

  private static String typeForClassName(String className) {
    if (className == null) {
      return null;
    }
    switch (className) {
      case "java.lang.Byte":
        return "TINYINT";
      case "java.lang.Short":
        return "SMALLINT";
      case "java.lang.Integer":
        return "INTEGER";
      case "java.lang.Long":
        return "BIGINT";
      case "java.lang.Float":
        return "FLOAT";
      case "java.lang.Double":
        return "DOUBLE";
      case "java.lang.Boolean":
        return "BOOLEAN";
      case "java.math.BigDecimal":
        return "DECIMAL";
      case "java.sql.Date":
        return "DATE";
      case "java.sql.Time":
        return "TIME";
      case "java.sql.Timestamp":
        return "TIMESTAMP";
      case "[B":
        return "VARBINARY";
      default:
        return "VARCHAR";
    }
  }

  private String write(AvaticaRequest request) throws PhoenixProtocolException {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new PhoenixProtocolException(
          "Failed to encode " + request.getRequest() + " request", e);
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }

  private static String abbreviate(String body) {
    return SqlTextUtil.truncate(body, GatewayConstants.MAX_ERROR_RESPONSE_LENGTH);
  }
}
