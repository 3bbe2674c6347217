package com.phoenixgateway.client.model.hbase;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Body of a create-table request to the HBase REST server. */
public class TableSchema {

  @JsonProperty("ColumnSchema")
  private final List<ColumnFamilySchema> columnSchema;

  public TableSchema(List<ColumnFamilySchema> columnSchema) {
    this.columnSchema = columnSchema;
  }

  public List<ColumnFamilySchema> getColumnSchema() {
    return columnSchema;
  }
}
