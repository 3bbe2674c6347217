package com.phoenixgateway.client.model.core;

import com.phoenixgateway.client.common.StatementKind;
import com.phoenixgateway.client.common.util.SqlTextUtil;
import java.util.Objects;

/** SQL text with its operation kind. The text is stored already trimmed of terminators. */
public final class StatementRequest {

  private final String sql;
  private final StatementKind kind;

  private StatementRequest(String sql, StatementKind kind) {
    this.sql = SqlTextUtil.trimStatement(sql);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public static StatementRequest query(String sql) {
    return new StatementRequest(sql, StatementKind.QUERY);
  }

  public static StatementRequest execute(String sql) {
    return new StatementRequest(sql, StatementKind.EXECUTE);
  }

  public static StatementRequest of(String sql, StatementKind kind) {
    return new StatementRequest(sql, kind);
  }

  public String getSql() {
    return sql;
  }

  public StatementKind getKind() {
    return kind;
  }

  public boolean isQuery() {
    return kind == StatementKind.QUERY;
  }

  @Override
  public String toString() {
    return kind + ": " + sql;
  }
}
