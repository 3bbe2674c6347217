package com.phoenixgateway.client.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phoenixgateway.client.common.GatewayConstants;
import java.util.ArrayList;
import java.util.List;

/** Request to create a SQL view over an existing storage table. */
public class CreateViewRequest {

  @JsonProperty("viewName")
  private String viewName;

  @JsonProperty("hbaseTableName")
  private String hbaseTableName;

  @JsonProperty("namespace")
  private String namespace = GatewayConstants.DEFAULT_HBASE_NAMESPACE;

  @JsonProperty("columns")
  private List<ViewColumnDefinition> columns = new ArrayList<>();

  public String getViewName() {
    return viewName;
  }

  public CreateViewRequest setViewName(String viewName) {
    this.viewName = viewName;
    return this;
  }

  public String getHbaseTableName() {
    return hbaseTableName;
  }

  public CreateViewRequest setHbaseTableName(String hbaseTableName) {
    this.hbaseTableName = hbaseTableName;
    return this;
  }

  public String getNamespace() {
    return namespace;
  }

  public CreateViewRequest setNamespace(String namespace) {
    this.namespace = namespace;
    return this;
  }

  public List<ViewColumnDefinition> getColumns() {
    return columns;
  }

  public CreateViewRequest setColumns(List<ViewColumnDefinition> columns) {
    this.columns = columns;
    return this;
  }
}
