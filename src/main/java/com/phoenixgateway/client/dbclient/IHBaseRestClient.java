package com.phoenixgateway.client.dbclient;

import com.phoenixgateway.client.exception.PhoenixStorageException;
import java.util.List;

/** Table administration against the HBase REST server. */
public interface IHBaseRestClient {

  /**
   * Creates a table with the given column families.
   *
   * @return {@code true} if created, {@code false} if the table already existed
   */
  boolean createTable(String namespace, String tableName, List<String> columnFamilies)
      throws PhoenixStorageException;

  /** Creates a table with the {@code metadata}, {@code readings} and {@code status} families. */
  boolean createSensorTable(String namespace, String tableName) throws PhoenixStorageException;

  boolean tableExists(String namespace, String tableName) throws PhoenixStorageException;

  /** Returns the schema document as served by the REST server. */
  String getTableSchema(String namespace, String tableName) throws PhoenixStorageException;

  /** Writes one cell value, creating the row if needed. */
  void putCell(
      String namespace,
      String tableName,
      String rowKey,
      String columnFamily,
      String column,
      String value)
      throws PhoenixStorageException;
}
