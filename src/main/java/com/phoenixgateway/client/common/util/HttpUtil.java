package com.phoenixgateway.client.common.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.util.EntityUtils;

/** Status and body helpers shared by the HTTP clients. */
public class HttpUtil {

  private HttpUtil() {}

  /** Check if the HTTP status code is a successful one */
  public static boolean isSuccessfulStatus(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  /** Reads the response body as UTF-8 text; an absent entity yields an empty string. */
  public static String readBody(HttpResponse response) throws IOException {
    HttpEntity entity = response.getEntity();
    if (entity == null) {
      return "";
    }
    return EntityUtils.toString(entity, StandardCharsets.UTF_8);
  }
}
