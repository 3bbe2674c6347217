package com.phoenixgateway.client.dbclient.impl.hbase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import com.phoenixgateway.client.common.GatewayConstants;
import com.phoenixgateway.client.common.util.HttpUtil;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import com.phoenixgateway.client.config.IGatewayConfig;
import com.phoenixgateway.client.dbclient.IGatewayHttpClient;
import com.phoenixgateway.client.dbclient.IHBaseRestClient;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import com.phoenixgateway.client.exception.PhoenixStorageException;
import com.phoenixgateway.client.log.GatewayLogger;
import com.phoenixgateway.client.log.GatewayLoggerFactory;
import com.phoenixgateway.client.model.hbase.CellSet;
import com.phoenixgateway.client.model.hbase.ColumnFamilySchema;
import com.phoenixgateway.client.model.hbase.TableSchema;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

/** Implementation of {@link IHBaseRestClient} over the HBase REST server. */
public class HBaseRestClient implements IHBaseRestClient {

  private static final GatewayLogger LOGGER =
      GatewayLoggerFactory.getLogger(HBaseRestClient.class);
  private static final Escaper PATH_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

  @VisibleForTesting
  static final List<String> SENSOR_COLUMN_FAMILIES = List.of("metadata", "readings", "status");

  private final String baseUrl;
  private final IGatewayHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public HBaseRestClient(IGatewayConfig config, IGatewayHttpClient httpClient) {
    this(config, httpClient, new ObjectMapper());
  }

  @VisibleForTesting
  HBaseRestClient(IGatewayConfig config, IGatewayHttpClient httpClient, ObjectMapper objectMapper) {
    this.baseUrl = stripTrailingSlash(config.getHBaseUrl());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean createTable(String namespace, String tableName, List<String> columnFamilies)
      throws PhoenixStorageException {
    if (columnFamilies == null || columnFamilies.isEmpty()) {
      throw new PhoenixStorageException("At least one column family is required", 400);
    }
    if (tableExists(namespace, tableName)) {
      LOGGER.info("Table {} already exists", qualifiedName(namespace, tableName));
      return false;
    }
    TableSchema schema =
        new TableSchema(
            columnFamilies.stream().map(ColumnFamilySchema::new).collect(Collectors.toList()));
    HttpPost post = new HttpPost(schemaUrl(namespace, tableName));
    post.setEntity(jsonEntity(schema));
    StorageResponse response = send(post);
    if (!response.isSuccessful()) {
      throw failure("Failed to create table " + qualifiedName(namespace, tableName), response);
    }
    LOGGER.info(
        "Created table {} with column families {}",
        qualifiedName(namespace, tableName),
        columnFamilies);
    return true;
  }

  @Override
  public boolean createSensorTable(String namespace, String tableName)
      throws PhoenixStorageException {
    return createTable(
        Strings.isNullOrEmpty(namespace) ? GatewayConstants.DEFAULT_HBASE_NAMESPACE : namespace,
        Strings.isNullOrEmpty(tableName) ? GatewayConstants.DEFAULT_SENSOR_TABLE : tableName,
        SENSOR_COLUMN_FAMILIES);
  }

  @Override
  public boolean tableExists(String namespace, String tableName) throws PhoenixStorageException {
    StorageResponse response = send(new HttpGet(schemaUrl(namespace, tableName)));
    if (response.statusCode == HttpStatus.SC_NOT_FOUND) {
      return false;
    }
    if (!response.isSuccessful()) {
      throw failure(
          "Failed to check existence of table " + qualifiedName(namespace, tableName), response);
    }
    return true;
  }

  @Override
  public String getTableSchema(String namespace, String tableName)
      throws PhoenixStorageException {
    StorageResponse response = send(new HttpGet(schemaUrl(namespace, tableName)));
    if (!response.isSuccessful()) {
      throw failure(
          "Failed to get schema for table " + qualifiedName(namespace, tableName), response);
    }
    return response.body;
  }

  @Override
  public void putCell(
      String namespace,
      String tableName,
      String rowKey,
      String columnFamily,
      String column,
      String value)
      throws PhoenixStorageException {
    HttpPut put =
        new HttpPut(
            baseUrl
                + "/"
                + PATH_ESCAPER.escape(qualifiedName(namespace, tableName))
                + "/"
                + PATH_ESCAPER.escape(rowKey));
    put.setEntity(jsonEntity(CellSet.ofCell(rowKey, columnFamily, column, value)));
    StorageResponse response = send(put);
    if (!response.isSuccessful()) {
      throw failure(
          String.format(
              "Failed to put %s:%s for row %s in table %s",
              columnFamily, column, rowKey, qualifiedName(namespace, tableName)),
          response);
    }
    LOGGER.debug(
        "Put {}:{} for row {} in table {}",
        columnFamily,
        column,
        rowKey,
        qualifiedName(namespace, tableName));
  }

  private String schemaUrl(String namespace, String tableName) {
    return baseUrl + "/" + PATH_ESCAPER.escape(qualifiedName(namespace, tableName)) + "/schema";
  }

  private StringEntity jsonEntity(Object body) throws PhoenixStorageException {
    try {
      return new StringEntity(
          objectMapper.writeValueAsString(body),
          ContentType.create("application/json", StandardCharsets.UTF_8));
    } catch (JsonProcessingException e) {
      throw new PhoenixStorageException("Failed to serialize request body", e);
    }
  }

  private StorageResponse send(HttpRequestBase request) throws PhoenixStorageException {
    GatewayConstants.JSON_HTTP_HEADERS.forEach(request::addHeader);
    try (CloseableHttpResponse response = httpClient.execute(request)) {
      return new StorageResponse(
          response.getStatusLine().getStatusCode(), HttpUtil.readBody(response));
    } catch (PhoenixConnectException | IOException e) {
      throw new PhoenixStorageException(
          "HBase REST request " + request.getMethod() + " " + request.getURI() + " failed", e);
    }
  }

  private static PhoenixStorageException failure(String message, StorageResponse response) {
    return new PhoenixStorageException(
        String.format(
            "%s. Status: %d, Response: %s",
            message,
            response.statusCode,
            SqlTextUtil.truncate(response.body, GatewayConstants.MAX_ERROR_RESPONSE_LENGTH)),
        response.statusCode);
  }

  private static String qualifiedName(String namespace, String tableName) {
    String ns =
        Strings.isNullOrEmpty(namespace) ? GatewayConstants.DEFAULT_HBASE_NAMESPACE : namespace;
    return ns + ":" + tableName;
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static final class StorageResponse {
    private final int statusCode;
    private final String body;

    private StorageResponse(int statusCode, String body) {
      this.statusCode = statusCode;
      this.body = body;
    }

    private boolean isSuccessful() {
      return HttpUtil.isSuccessfulStatus(statusCode);
    }
  }
}
