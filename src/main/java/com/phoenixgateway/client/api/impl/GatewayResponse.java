package com.phoenixgateway.client.api.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/** Status code and JSON-serializable body for one gateway endpoint call. */
public final class GatewayResponse {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final int statusCode;
  private final Map<String, Object> body;

  private GatewayResponse(int statusCode, Map<String, Object> body) {
    this.statusCode = statusCode;
    this.body = body;
  }

  static GatewayResponse of(int statusCode, Map<String, Object> body) {
    return new GatewayResponse(statusCode, new LinkedHashMap<>(body));
  }

  static GatewayResponse ok(Map<String, Object> body) {
    return of(200, body);
  }

  static GatewayResponse error(int statusCode, String error) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    return of(statusCode, body);
  }

  /** Error body that always carries a {@code suggestion} key, possibly {@code null}. */
  static GatewayResponse error(int statusCode, String error, String suggestion) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("suggestion", suggestion);
    return of(statusCode, body);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Map<String, Object> getBody() {
    return body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** Body serialized with Jackson. */
  public String toJson() throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(body);
  }

  @Override
  public String toString() {
    return "GatewayResponse{statusCode=" + statusCode + ", body=" + body + "}";
  }
}
