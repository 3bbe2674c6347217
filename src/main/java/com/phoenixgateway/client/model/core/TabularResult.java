package com.phoenixgateway.client.model.core;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one statement, independent of the transport that produced it. Every row holds exactly
 * one cell per declared column. A query that matched nothing has columns and an empty row list.
 */
public final class TabularResult {

  /** Update count reported when the statement was not a data modification. */
  public static final long NO_UPDATE_COUNT = -1L;

  private final List<ColumnDescriptor> columns;
  private final List<TabularRow> rows;
  private final long updateCount;

  public TabularResult(List<ColumnDescriptor> columns, List<TabularRow> rows) {
    this(columns, rows, NO_UPDATE_COUNT);
  }

  public TabularResult(List<ColumnDescriptor> columns, List<TabularRow> rows, long updateCount) {
    List<String> names =
        columns.stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
    for (TabularRow row : rows) {
      if (row.size() != names.size() || !names.containsAll(row.getCells().keySet())) {
        throw new IllegalArgumentException(
            "Row " + row + " does not match columns " + names);
      }
    }
    this.columns = List.copyOf(columns);
    this.rows = List.copyOf(rows);
    this.updateCount = updateCount;
  }

  public static TabularResult ofUpdateCount(long updateCount) {
    return new TabularResult(Collections.emptyList(), Collections.emptyList(), updateCount);
  }

  public List<ColumnDescriptor> getColumns() {
    return columns;
  }

  public List<TabularRow> getRows() {
    return rows;
  }

  public int getRowCount() {
    return rows.size();
  }

  /** Rows affected by a data modification, or {@link #NO_UPDATE_COUNT}. */
  public long getUpdateCount() {
    return updateCount;
  }

  public List<String> getColumnNames() {
    return columns.stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return "TabularResult{columns="
        + columns
        + ", rowCount="
        + rows.size()
        + ", updateCount="
        + updateCount
        + "}";
  }
}
