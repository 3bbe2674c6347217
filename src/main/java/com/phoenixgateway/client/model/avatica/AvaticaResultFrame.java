package com.phoenixgateway.client.model.avatica;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.List;

/**
 * First result of an execute response: column metadata plus positional row values as they appeared
 * on the wire. Values stay as {@link JsonNode} so that numeric precision survives until
 * normalization.
 */
public class AvaticaResultFrame {

  private final List<AvaticaColumn> columns;
  private final List<List<JsonNode>> rows;
  private final long updateCount;

  public AvaticaResultFrame(
      List<AvaticaColumn> columns, List<List<JsonNode>> rows, long updateCount) {
    this.columns = columns == null ? Collections.emptyList() : List.copyOf(columns);
    this.rows = rows == null ? Collections.emptyList() : List.copyOf(rows);
    this.updateCount = updateCount;
  }

  /** Frame for a response whose results array was empty. */
  public static AvaticaResultFrame empty() {
    return new AvaticaResultFrame(Collections.emptyList(), Collections.emptyList(), -1L);
  }

  public List<AvaticaColumn> getColumns() {
    return columns;
  }

  public List<List<JsonNode>> getRows() {
    return rows;
  }

  public long getUpdateCount() {
    return updateCount;
  }
}
