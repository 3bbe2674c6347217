package com.phoenixgateway.client.model.hbase;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

/**
 * Row payload accepted by the HBase REST server. Row keys, column names and values are base64
 * encoded UTF-8.
 */
public class CellSet {

  @JsonProperty("Row")
  private final List<RowEntry> rows;

  public CellSet(List<RowEntry> rows) {
    this.rows = rows;
  }

  /** A single-cell cell set. */
  public static CellSet ofCell(String rowKey, String columnFamily, String column, String value) {
    return new CellSet(
        List.of(
            new RowEntry(
                encode(rowKey),
                List.of(new CellEntry(encode(columnFamily + ":" + column), encode(value))))));
  }

  public List<RowEntry> getRows() {
    return rows;
  }

  static String encode(String text) {
    return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
  }

  public static class RowEntry {

    @JsonProperty("key")
    private final String key;

    @JsonProperty("Cell")
    private final List<CellEntry> cells;

    public RowEntry(String key, List<CellEntry> cells) {
      this.key = key;
      this.cells = cells;
    }

    public String getKey() {
      return key;
    }

    public List<CellEntry> getCells() {
      return cells;
    }
  }

  public static class CellEntry {

    @JsonProperty("column")
    private final String column;

    @JsonProperty("$")
    private final String value;

    public CellEntry(String column, String value) {
      this.column = column;
      this.value = value;
    }

    public String getColumn() {
      return column;
    }

    public String getValue() {
      return value;
    }
  }
}
