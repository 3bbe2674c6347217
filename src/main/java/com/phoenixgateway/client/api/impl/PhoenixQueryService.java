package com.phoenixgateway.client.api.impl;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.phoenixgateway.client.api.IPhoenixConnectionManager;
import com.phoenixgateway.client.common.GatewayConstants;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import com.phoenixgateway.client.dbclient.IHBaseRestClient;
import com.phoenixgateway.client.exception.PhoenixSQLException;
import com.phoenixgateway.client.exception.PhoenixValidationException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import com.phoenixgateway.client.model.core.StatementRequest;
import com.phoenixgateway.client.model.core.TabularResult;
import com.phoenixgateway.client.model.core.TabularRow;
import com.phoenixgateway.client.model.request.CreateViewRequest;
import com.phoenixgateway.client.model.request.ViewColumnDefinition;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Operations behind the gateway's HTTP endpoints. Each call makes sure the connection is open, runs
 * its statements and maps the outcome to a {@link GatewayResponse}; no call throws.
 */
public class PhoenixQueryService {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(PhoenixQueryService.class);

  @VisibleForTesting
  static final String USER_TABLES_SQL =
      "SELECT TABLE_NAME, TABLE_TYPE, TABLE_SCHEM FROM SYSTEM.CATALOG"
          + " WHERE TABLE_TYPE = 'u' ORDER BY TABLE_NAME";

  @VisibleForTesting
  static final String UNSCHEMED_TABLES_SQL =
      "SELECT TABLE_NAME, TABLE_TYPE, TABLE_SCHEM FROM SYSTEM.CATALOG"
          + " WHERE TABLE_SCHEM IS NULL ORDER BY TABLE_NAME";

  @VisibleForTesting
  static final String ALL_TABLES_SQL =
      "SELECT TABLE_NAME, TABLE_TYPE, TABLE_SCHEM FROM SYSTEM.CATALOG"
          + " ORDER BY TABLE_NAME LIMIT 100";

  @VisibleForTesting
  static final String VIEWS_SQL =
      "SELECT TABLE_NAME, TABLE_SCHEM, TABLE_TYPE FROM SYSTEM.CATALOG"
          + " WHERE TABLE_TYPE = 'v' ORDER BY TABLE_NAME";

  private static final String COLUMNS_SQL_TEMPLATE =
      "SELECT COLUMN_NAME, DATA_TYPE, COLUMN_SIZE, IS_NULLABLE FROM SYSTEM.CATALOG"
          + " WHERE TABLE_NAME = '%s' ORDER BY ORDINAL_POSITION";
  private static final String VIEW_EXISTS_SQL_TEMPLATE =
      "SELECT TABLE_NAME FROM SYSTEM.CATALOG WHERE TABLE_TYPE = 'v' AND TABLE_NAME = '%s'";

  private static final Pattern COLUMN_TYPE =
      Pattern.compile("[A-Za-z][A-Za-z0-9_ ]*(\\(\\d+(,\\s*\\d+)?\\))?");
  private static final String[] TABLE_NOT_FOUND_MARKERS = {
    "Table undefined", "TableNotFoundException", "Table not found"
  };
  private static final String QUERY_TABLE_SUGGESTION =
      "The table does not exist. Create it using: POST /api/phoenix/execute with SQL: CREATE TABLE"
          + " ... Example: CREATE TABLE IF NOT EXISTS users (id INTEGER PRIMARY KEY,"
          + " username VARCHAR(50), email VARCHAR(100))";
  private static final String EXECUTE_TABLE_SUGGESTION =
      "The table does not exist. Create it first using CREATE TABLE statement.";
  private static final String VIEW_LIST_SUGGESTION = "List all views using: GET /api/phoenix/views";
  private static final String EMPTY_RESULT_MESSAGE =
      "Query executed successfully but returned no results. This may indicate no data exists"
          + " matching the query criteria.";

  private final IPhoenixConnectionManager connectionManager;
  private final IHBaseRestClient hbaseClient;
  private final Clock clock;

  public PhoenixQueryService(
      IPhoenixConnectionManager connectionManager, IHBaseRestClient hbaseClient) {
    this(connectionManager, hbaseClient, Clock.systemUTC());
  }

  @VisibleForTesting
  PhoenixQueryService(
      IPhoenixConnectionManager connectionManager, IHBaseRestClient hbaseClient, Clock clock) {
    this.connectionManager = connectionManager;
    this.hbaseClient = hbaseClient;
    this.clock = clock;
  }

  /** Runs a query and returns its columns and rows. */
  public GatewayResponse query(String sql) {
    if (SqlTextUtil.isBlank(sql)) {
      return GatewayResponse.error(400, "SQL query is required");
    }
    try {
      return GatewayResponse.ok(toBody(runQuery(sql)));
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Query failed: {}", truncateSql(sql));
      return GatewayResponse.error(500, e.getMessage(), suggestionFor(e, QUERY_TABLE_SUGGESTION));
    }
  }

  /** Runs a DDL or DML statement. */
  public GatewayResponse execute(String sql) {
    if (SqlTextUtil.isBlank(sql)) {
      return GatewayResponse.error(400, "SQL statement is required");
    }
    try {
      TabularResult result = runStatement(StatementRequest.execute(sql));
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("message", "Command executed successfully");
      body.put("updateCount", result.getUpdateCount());
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Statement failed: {}", truncateSql(sql));
      return GatewayResponse.error(
          500, e.getMessage(), suggestionFor(e, EXECUTE_TABLE_SUGGESTION));
    }
  }

  /**
   * Lists user tables from the catalog. When the catalog reports no user tables, falls back to
   * tables without a schema and then to the first 100 catalog entries.
   */
  public GatewayResponse listTables() {
    try {
      TabularResult tables = runQuery(USER_TABLES_SQL);
      if (tables.getRowCount() == 0) {
        tables = runQuery(UNSCHEMED_TABLES_SQL);
      }
      if (tables.getRowCount() == 0) {
        tables = runQuery(ALL_TABLES_SQL);
      }
      Map<String, Object> body = toBody(tables);
      if (tables.getRowCount() == 0) {
        body.put(
            "message",
            "No tables found in Phoenix. Create a table using: POST /api/phoenix/execute with SQL:"
                + " CREATE TABLE ...");
      }
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Listing tables failed");
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse listColumns(String tableName) {
    if (!SqlTextUtil.isValidIdentifier(tableName)) {
      return GatewayResponse.error(400, "Invalid table name: " + tableName);
    }
    try {
      return GatewayResponse.ok(toBody(runQuery(String.format(COLUMNS_SQL_TEMPLATE, tableName))));
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Listing columns of {} failed", tableName);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  /**
   * Creates a view over an existing storage table. The first column flagged as primary key, or the
   * first column when none is flagged, becomes the view's primary key.
   */
  public GatewayResponse createView(CreateViewRequest request) {
    if (request == null) {
      return GatewayResponse.error(400, "Request body is required");
    }
    if (Strings.isNullOrEmpty(request.getViewName())) {
      return GatewayResponse.error(400, "ViewName is required");
    }
    if (Strings.isNullOrEmpty(request.getHbaseTableName())) {
      return GatewayResponse.error(400, "HBaseTableName is required");
    }
    if (request.getColumns() == null || request.getColumns().isEmpty()) {
      return GatewayResponse.error(400, "At least one column definition is required");
    }
    String namespace =
        Strings.isNullOrEmpty(request.getNamespace())
            ? GatewayConstants.DEFAULT_HBASE_NAMESPACE
            : request.getNamespace();
    String qualifiedTable = namespace + ":" + request.getHbaseTableName();
    try {
      String createViewSql = buildCreateViewSql(request, qualifiedTable);
      if (!hbaseClient.tableExists(namespace, request.getHbaseTableName())) {
        return GatewayResponse.error(
            400,
            "HBase table '" + qualifiedTable + "' does not exist",
            "Create the table first using: POST /api/phoenix/hbase/tables/sensor or POST"
                + " /api/phoenix/hbase/tables/"
                + request.getHbaseTableName());
      }
      runStatement(StatementRequest.execute(createViewSql));
      Map<String, Object> body = new LinkedHashMap<>();
      body.put(
          "message",
          "Phoenix view '"
              + request.getViewName()
              + "' created successfully on HBase table '"
              + qualifiedTable
              + "'");
      body.put("viewName", request.getViewName());
      body.put("hbaseTable", qualifiedTable);
      body.put("sql", createViewSql);
      return GatewayResponse.ok(body);
    } catch (PhoenixValidationException e) {
      return GatewayResponse.error(400, e.getMessage());
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Creating view {} failed", request.getViewName());
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse listViews() {
    try {
      TabularResult views = runQuery(VIEWS_SQL);
      Map<String, Object> body = toBody(views);
      if (views.getRowCount() == 0) {
        body.put(
            "message", "No views found in Phoenix. Create a view using: POST /api/phoenix/views");
      }
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Listing views failed");
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  /** Returns the columns of a view, or 404 when the catalog has no view of that name. */
  public GatewayResponse getView(String viewName) {
    if (!SqlTextUtil.isValidIdentifier(viewName)) {
      return GatewayResponse.error(400, "Invalid view name: " + viewName);
    }
    try {
      if (!viewExists(viewName)) {
        return viewNotFound(viewName);
      }
      TabularResult columns = runQuery(String.format(COLUMNS_SQL_TEMPLATE, viewName));
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("viewName", viewName);
      body.putAll(toBody(columns));
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Reading view {} failed", viewName);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse dropView(String viewName) {
    if (!SqlTextUtil.isValidIdentifier(viewName)) {
      return GatewayResponse.error(400, "Invalid view name: " + viewName);
    }
    try {
      if (!viewExists(viewName)) {
        return viewNotFound(viewName);
      }
      runStatement(StatementRequest.execute("DROP VIEW IF EXISTS " + viewName));
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("message", "View '" + viewName + "' dropped successfully");
      body.put("viewName", viewName);
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Dropping view {} failed", viewName);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("timestamp", clock.instant().toString());
    return GatewayResponse.ok(body);
  }

  /** Creates the sensor table; 409 when it already exists. */
  public GatewayResponse createSensorTable(String namespace, String tableName) {
    String ns =
        Strings.isNullOrEmpty(namespace) ? GatewayConstants.DEFAULT_HBASE_NAMESPACE : namespace;
    String table =
        Strings.isNullOrEmpty(tableName) ? GatewayConstants.DEFAULT_SENSOR_TABLE : tableName;
    try {
      boolean created = hbaseClient.createSensorTable(ns, table);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put(
          "message",
          "Sensor table '"
              + ns
              + ":"
              + table
              + (created ? "' created successfully" : "' already exists"));
      body.put("tableName", table);
      body.put("namespace", ns);
      return GatewayResponse.of(created ? 200 : 409, body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Creating sensor table {}:{} failed", ns, table);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse tableExists(String namespace, String tableName) {
    try {
      boolean exists = hbaseClient.tableExists(namespace, tableName);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("tableName", tableName);
      body.put("namespace", namespaceOrDefault(namespace));
      body.put("exists", exists);
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Checking table {} failed", tableName);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse getTableSchema(String namespace, String tableName) {
    try {
      String schema = hbaseClient.getTableSchema(namespace, tableName);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("tableName", tableName);
      body.put("namespace", namespaceOrDefault(namespace));
      body.put("schema", schema);
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Reading schema of table {} failed", tableName);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  public GatewayResponse putCell(
      String namespace,
      String tableName,
      String rowKey,
      String columnFamily,
      String column,
      String value) {
    if (Strings.isNullOrEmpty(rowKey)
        || Strings.isNullOrEmpty(columnFamily)
        || Strings.isNullOrEmpty(column)) {
      return GatewayResponse.error(400, "RowKey, ColumnFamily and Column are required");
    }
    try {
      hbaseClient.putCell(
          namespace, tableName, rowKey, columnFamily, column, Strings.nullToEmpty(value));
      Map<String, Object> body = new LinkedHashMap<>();
      body.put(
          "message",
          "Data inserted successfully into " + namespaceOrDefault(namespace) + ":" + tableName);
      body.put("rowKey", rowKey);
      body.put("column", columnFamily + ":" + column);
      return GatewayResponse.ok(body);
    } catch (PhoenixSQLException e) {
      LOGGER.error(e, "Writing row {} to table {} failed", rowKey, tableName);
      return GatewayResponse.error(500, e.getMessage());
    }
  }

  @VisibleForTesting
  static String buildCreateViewSql(CreateViewRequest request, String qualifiedTable)
      throws PhoenixValidationException {
    if (!SqlTextUtil.isValidIdentifier(request.getViewName())) {
      throw new PhoenixValidationException("Invalid view name: " + request.getViewName());
    }
    List<ViewColumnDefinition> columns = request.getColumns();
    ViewColumnDefinition primaryKey =
        columns.stream()
            .filter(ViewColumnDefinition::isPrimaryKey)
            .findFirst()
            .orElse(columns.get(0));
    StringBuilder definitions = new StringBuilder();
    for (ViewColumnDefinition column : columns) {
      if (!SqlTextUtil.isValidIdentifier(column.getName())) {
        throw new PhoenixValidationException("Invalid column name: " + column.getName());
      }
      if (column.getType() == null || !COLUMN_TYPE.matcher(column.getType().strip()).matches()) {
        throw new PhoenixValidationException(
            "Invalid type for column " + column.getName() + ": " + column.getType());
      }
      if (definitions.length() > 0) {
        definitions.append(", ");
      }
      definitions.append(column.getName()).append(' ').append(column.getType().strip());
      if (column == primaryKey) {
        definitions.append(" PRIMARY KEY");
      }
    }
    return String.format(
        "CREATE VIEW IF NOT EXISTS %s (%s) AS SELECT * FROM \"%s\"",
        request.getViewName(), definitions, qualifiedTable);
  }

  private TabularResult runQuery(String sql) throws PhoenixSQLException {
    return runStatement(StatementRequest.query(sql));
  }

  private TabularResult runStatement(StatementRequest request) throws PhoenixSQLException {
    connectionManager.open();
    return connectionManager.execute(request);
  }

  private boolean viewExists(String viewName) throws PhoenixSQLException {
    return runQuery(String.format(VIEW_EXISTS_SQL_TEMPLATE, viewName.toUpperCase(Locale.ROOT)))
            .getRowCount()
        > 0;
  }

  private static GatewayResponse viewNotFound(String viewName) {
    return GatewayResponse.error(404, "View '" + viewName + "' not found", VIEW_LIST_SUGGESTION);
  }

  private static Map<String, Object> toBody(TabularResult result) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("columns", result.getColumns());
    body.put(
        "rows", result.getRows().stream().map(TabularRow::toValueMap).collect(Collectors.toList()));
    body.put("rowCount", result.getRowCount());
    if (result.getRowCount() == 0 && !result.getColumns().isEmpty()) {
      body.put("message", EMPTY_RESULT_MESSAGE);
    }
    return body;
  }

  private static String suggestionFor(PhoenixSQLException e, String suggestion) {
    String message = Strings.nullToEmpty(e.getMessage());
    for (String marker : TABLE_NOT_FOUND_MARKERS) {
      if (message.contains(marker)) {
        return suggestion;
      }
    }
    return null;
  }

  private static String namespaceOrDefault(String namespace) {
    return Strings.isNullOrEmpty(namespace) ? GatewayConstants.DEFAULT_HBASE_NAMESPACE : namespace;
  }

  private static String truncateSql(String sql) {
    return SqlTextUtil.truncate(
        SqlTextUtil.trimStatement(sql), GatewayConstants.MAX_LOGGED_SQL_LENGTH);
  }
}
