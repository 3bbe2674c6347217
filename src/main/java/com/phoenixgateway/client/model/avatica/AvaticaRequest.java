package com.phoenixgateway.client.model.avatica;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/** Request body sent to the query server's JSON endpoint. Unset fields are omitted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"request", "connectionId", "statementId", "sql", "maxRowCount", "info"})
public class AvaticaRequest {

  public static final String OPEN_CONNECTION = "openConnection";
  public static final String CREATE_STATEMENT = "createStatement";
  public static final String PREPARE_AND_EXECUTE = "prepareAndExecute";
  public static final String CLOSE_STATEMENT = "closeStatement";
  public static final String CLOSE_CONNECTION = "closeConnection";

  @JsonProperty("request")
  private String request;

  @JsonProperty("connectionId")
  private String connectionId;

  @JsonProperty("statementId")
  private Integer statementId;

  @JsonProperty("sql")
  private String sql;

  @JsonProperty("maxRowCount")
  private Long maxRowCount;

  @JsonProperty("info")
  private Map<String, String> info;

  public AvaticaRequest(String request) {
    this.request = request;
  }

  public String getRequest() {
    return request;
  }

  public AvaticaRequest setConnectionId(String connectionId) {
    this.connectionId = connectionId;
    return this;
  }

  public String getConnectionId() {
    return connectionId;
  }

  public AvaticaRequest setStatementId(Integer statementId) {
    this.statementId = statementId;
    return this;
  }

  public Integer getStatementId() {
    return statementId;
  }

  public AvaticaRequest setSql(String sql) {
    this.sql = sql;
    return this;
  }

  public String getSql() {
    return sql;
  }

  public AvaticaRequest setMaxRowCount(Long maxRowCount) {
    this.maxRowCount = maxRowCount;
    return this;
  }

  public Long getMaxRowCount() {
    return maxRowCount;
  }

  public AvaticaRequest setInfo(Map<String, String> info) {
    this.info = info;
    return this;
  }

  public Map<String, String> getInfo() {
    return info;
  }
}
