package com.phoenixgateway.client.common.util;

import java.util.regex.Pattern;

/** Helpers for preparing statement text before it is sent to the query server. */
public class SqlTextUtil {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

  private SqlTextUtil() {}

  /**
   * Strips surrounding whitespace and any trailing statement terminators. The query server rejects
   * statements that end with {@code ;}.
   *
   * @param sql raw statement text, may be null
   * @return trimmed statement, or an empty string for null input
   */
  public static String trimStatement(String sql) {
    if (sql == null) {
      return "";
    }
    String trimmed = sql.strip();
    while (trimmed.endsWith(";")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
    }
    return trimmed;
  }

  public static boolean isBlank(String sql) {
    return trimStatement(sql).isEmpty();
  }

  /** Shortens text for log and error messages. */
  public static String truncate(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    return text.length() <= maxLength ? text : text.substring(0, maxLength);
  }

  /** Whether the given name can be embedded as an unquoted SQL identifier. */
  public static boolean isValidIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }
}
