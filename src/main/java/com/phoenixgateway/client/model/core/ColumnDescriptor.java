package com.phoenixgateway.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phoenixgateway.client.common.CellKind;
import java.util.Objects;

/** Name and logical type of a result column. */
public final class ColumnDescriptor {

  @JsonProperty("name")
  private final String name;

  @JsonProperty("type")
  private final String logicalType;

  @JsonIgnore private final CellKind cellKind;

  public ColumnDescriptor(String name, String logicalType, CellKind cellKind) {
    this.name = Objects.requireNonNull(name, "name");
    this.logicalType = logicalType;
    this.cellKind = cellKind;
  }

  public String getName() {
    return name;
  }

  /** Engine type name, e.g. {@code VARCHAR} or {@code BIGINT}. */
  public String getLogicalType() {
    return logicalType;
  }

  /** Kind of the non-null cells of this column. */
  public CellKind getCellKind() {
    return cellKind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnDescriptor that = (ColumnDescriptor) o;
    return name.equals(that.name)
        && Objects.equals(logicalType, that.logicalType)
        && cellKind == that.cellKind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, logicalType, cellKind);
  }

  @Override
  public String toString() {
    return name + " " + logicalType;
  }
}
