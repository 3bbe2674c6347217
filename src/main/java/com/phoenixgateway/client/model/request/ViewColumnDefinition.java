package com.phoenixgateway.client.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One column of a view to be created over a storage table. */
public class ViewColumnDefinition {

  @JsonProperty("name")
  private String name;

  @JsonProperty("type")
  private String type;

  @JsonProperty("isPrimaryKey")
  private boolean primaryKey;

  public ViewColumnDefinition() {}

  public ViewColumnDefinition(String name, String type, boolean primaryKey) {
    this.name = name;
    this.type = type;
    this.primaryKey = primaryKey;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public boolean isPrimaryKey() {
    return primaryKey;
  }
}
