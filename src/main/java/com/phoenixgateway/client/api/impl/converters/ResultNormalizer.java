package com.phoenixgateway.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.phoenixgateway.client.common.CellKind;
import com.phoenixgateway.client.model.avatica.AvaticaColumn;
import com.phoenixgateway.client.model.avatica.AvaticaResultFrame;
import com.phoenixgateway.client.model.core.Cell;
import com.phoenixgateway.client.model.core.ColumnDescriptor;
import com.phoenixgateway.client.model.core.TabularResult;
import com.phoenixgateway.client.model.core.TabularRow;
import java.sql.JDBCType;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link TabularResult} from either a driver {@link ResultSet} or a decoded protocol
 * frame. Column order follows the source. Rows shorter than the column list are padded with null
 * cells and surplus values are dropped.
 */
public class ResultNormalizer {

  private final CellConverter cellConverter;

  public ResultNormalizer() {
    this(new CellConverter());
  }

  public ResultNormalizer(CellConverter cellConverter) {
    this.cellConverter = cellConverter;
  }

  public TabularResult normalize(AvaticaResultFrame frame) {
    List<ColumnDescriptor> columns = new ArrayList<>();
    Set<String> usedNames = new HashSet<>();
    for (AvaticaColumn column : frame.getColumns()) {
      String typeName =
          Strings.isNullOrEmpty(column.getTypeName())
              ? inferTypeName(frame.getRows(), columns.size())
              : column.getTypeName();
      columns.add(
          new ColumnDescriptor(
              uniqueName(column.getName(), usedNames, columns.size()),
              typeName,
              cellConverter.kindForType(typeName)));
    }

    List<TabularRow> rows = new ArrayList<>(frame.getRows().size());
    for (List<JsonNode> values : frame.getRows()) {
      LinkedHashMap<String, Cell> cells = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        ColumnDescriptor column = columns.get(i);
        JsonNode value = i < values.size() ? values.get(i) : null;
        cells.put(
            column.getName(),
            cellConverter.fromWire(value, column.getCellKind(), column.getLogicalType()));
      }
      rows.add(new TabularRow(cells));
    }
    return new TabularResult(columns, rows, frame.getUpdateCount());
  }

  /**
   * Reads every remaining row of {@code resultSet}. The result set is not closed.
   *
   * @param maxRows upper bound on rows read, 0 for no bound
   */
  public TabularResult normalize(ResultSet resultSet, int maxRows) throws SQLException {
    ResultSetMetaData metaData = resultSet.getMetaData();
    int columnCount = metaData.getColumnCount();
    List<ColumnDescriptor> columns = new ArrayList<>(columnCount);
    int[] jdbcTypes = new int[columnCount];
    Set<String> usedNames = new HashSet<>();
    for (int i = 1; i <= columnCount; i++) {
      String label = metaData.getColumnLabel(i);
      if (Strings.isNullOrEmpty(label)) {
        label = metaData.getColumnName(i);
      }
      jdbcTypes[i - 1] = metaData.getColumnType(i);
      String typeName = metaData.getColumnTypeName(i);
      CellKind kind = cellConverter.kindForJdbcType(jdbcTypes[i - 1]);
      if (Strings.isNullOrEmpty(typeName)) {
        typeName = jdbcTypeName(jdbcTypes[i - 1]);
      }
      columns.add(new ColumnDescriptor(uniqueName(label, usedNames, i - 1), typeName, kind));
    }

    List<TabularRow> rows = new ArrayList<>();
    while ((maxRows <= 0 || rows.size() < maxRows) && resultSet.next()) {
      LinkedHashMap<String, Cell> cells = new LinkedHashMap<>();
      for (int i = 1; i <= columnCount; i++) {
        ColumnDescriptor column = columns.get(i - 1);
        cells.put(
            column.getName(),
            cellConverter.fromResultSet(resultSet, i, column.getCellKind(), jdbcTypes[i - 1]));
      }
      rows.add(new TabularRow(cells));
    }
    return new TabularResult(columns, rows);
  }

  /** Type of an undeclared column, taken from its first non-null value. */
  private static String inferTypeName(List<List<JsonNode>> rows, int index) {
    for (List<JsonNode> row : rows) {
      JsonNode value = index < row.size() ? row.get(index) : null;
      if (value == null || value.isNull()) {
        continue;
      }
      if (value.isIntegralNumber()) {
        return "BIGINT";
      }
      if (value.isNumber()) {
        return "DOUBLE";
      }
      if (value.isBoolean()) {
        return "BOOLEAN";
      }
      return "VARCHAR";
    }
    return "VARCHAR";
  }

  private static String uniqueName(String candidate, Set<String> usedNames, int position) {
    String name = Strings.isNullOrEmpty(candidate) ? "COLUMN" + (position + 1) : candidate;
    if (usedNames.contains(name)) {
      String base = name;
      int suffix = position + 1;
      name = base + "_" + suffix;
      while (usedNames.contains(name)) {
        suffix++;
        name = base + "_" + suffix;
      }
    }
    usedNames.add(name);
    return name;
  }

  private static String jdbcTypeName(int jdbcType) {
    try {
      return JDBCType.valueOf(jdbcType).getName();
    } catch (IllegalArgumentException e) {
      return "OTHER";
    }
  }
}
