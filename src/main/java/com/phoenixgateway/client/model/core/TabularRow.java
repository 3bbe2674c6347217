package com.phoenixgateway.client.model.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One result row keyed by column name, in column order. */
public final class TabularRow {

  private final Map<String, Cell> cells;

  public TabularRow(LinkedHashMap<String, Cell> cells) {
    this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
  }

  public Cell get(String columnName) {
    return cells.get(columnName);
  }

  public Map<String, Cell> getCells() {
    return cells;
  }

  public int size() {
    return cells.size();
  }

  /** Column name to JSON value, nulls included. */
  public Map<String, Object> toValueMap() {
    Map<String, Object> values = new LinkedHashMap<>();
    cells.forEach((name, cell) -> values.put(name, cell.toJsonValue()));
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TabularRow && cells.equals(((TabularRow) o).cells));
  }

  @Override
  public int hashCode() {
    return cells.hashCode();
  }

  @Override
  public String toString() {
    return cells.toString();
  }
}
