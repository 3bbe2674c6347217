package com.phoenixgateway.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.phoenixgateway.client.common.CellKind;
import com.phoenixgateway.client.model.core.Cell;
import java.io.IOException;
import java.math.BigDecimal;
import java.sql.JDBCType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Base64;
import java.util.Calendar;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Converts engine values into {@link Cell}s. Values that do not fit the expected kind are kept as
 * text rather than rejected.
 *
 * <p>DATE, TIME and TIMESTAMP values render the same way whichever transport produced them: the UTC
 * instant as {@code yyyy-MM-dd HH:mm:ss.fff}, with at least millisecond and at most nanosecond
 * fraction digits.
 */
public class CellConverter {

  private static final TimeZone UTC = TimeZone.getTimeZone(ZoneOffset.UTC);
  private static final DateTimeFormatter TEMPORAL_FORMAT =
      new DateTimeFormatterBuilder()
          .appendPattern("yyyy-MM-dd HH:mm:ss")
          .appendFraction(ChronoField.NANO_OF_SECOND, 3, 9, true)
          .toFormatter(Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  /** Maps an engine type name such as {@code UNSIGNED_INT} or {@code VARCHAR(50)} to a kind. */
  public CellKind kindForType(String typeName) {
    String base = baseTypeName(typeName);
    switch (base) {
      case "TINYINT":
      case "SMALLINT":
      case "INT":
      case "INTEGER":
      case "BIGINT":
      case "LONG":
        return CellKind.INTEGER;
      case "FLOAT":
      case "REAL":
      case "DOUBLE":
        return CellKind.FLOAT;
      case "BOOLEAN":
      case "BIT":
        return CellKind.BOOLEAN;
      case "BINARY":
      case "VARBINARY":
      case "LONGVARBINARY":
      case "BLOB":
        return CellKind.BYTES;
      default:
        return CellKind.STRING;
    }
  }

  /** Maps a {@link java.sql.Types} code to a cell kind. */
  public CellKind kindForJdbcType(int jdbcType) {
    try {
      return kindForType(JDBCType.valueOf(jdbcType).getName());
    } catch (IllegalArgumentException e) {
      return CellKind.STRING;
    }
  }

  /** Converts a JSON wire value of a column declared with {@code typeName}. */
  public Cell fromWire(JsonNode node, CellKind kind, String typeName) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return Cell.ofNull();
    }
    switch (kind) {
      case INTEGER:
        if (node.isIntegralNumber() && node.canConvertToLong()) {
          return Cell.ofInteger(node.longValue());
        }
        if (node.isTextual()) {
          try {
            return Cell.ofInteger(Long.parseLong(node.textValue().strip()));
          } catch (NumberFormatException e) {
            return Cell.ofString(node.textValue());
          }
        }
        return Cell.ofString(node.asText());
      case FLOAT:
        if (node.isNumber()) {
          return Cell.ofFloat(node.doubleValue());
        }
        if (node.isTextual()) {
          try {
            return Cell.ofFloat(Double.parseDouble(node.textValue().strip()));
          } catch (NumberFormatException e) {
            return Cell.ofString(node.textValue());
          }
        }
        return Cell.ofString(node.asText());
      case BOOLEAN:
        if (node.isBoolean()) {
          return Cell.ofBoolean(node.booleanValue());
        }
        if (node.isTextual() && isBooleanText(node.textValue())) {
          return Cell.ofBoolean(Boolean.parseBoolean(node.textValue().strip()));
        }
        return Cell.ofString(node.asText());
      case BYTES:
        if (node.isBinary()) {
          try {
            return Cell.ofBytes(node.binaryValue());
          } catch (IOException e) {
            return Cell.ofString(node.asText());
          }
        }
        if (node.isTextual()) {
          try {
            return Cell.ofBytes(Base64.getDecoder().decode(node.textValue()));
          } catch (IllegalArgumentException e) {
            return Cell.ofString(node.textValue());
          }
        }
        return Cell.ofString(node.toString());
      default:
        return Cell.ofString(wireText(node, typeName));
    }
  }

  /** Reads column {@code index} (1-based) of the current row of a driver result set. */
  public Cell fromResultSet(ResultSet resultSet, int index, CellKind kind, int jdbcType)
      throws SQLException {
    Object value;
    switch (kind) {
      case INTEGER:
        long longValue = resultSet.getLong(index);
        return resultSet.wasNull() ? Cell.ofNull() : Cell.ofInteger(longValue);
      case FLOAT:
        double doubleValue = resultSet.getDouble(index);
        return resultSet.wasNull() ? Cell.ofNull() : Cell.ofFloat(doubleValue);
      case BOOLEAN:
        boolean booleanValue = resultSet.getBoolean(index);
        return resultSet.wasNull() ? Cell.ofNull() : Cell.ofBoolean(booleanValue);
      case BYTES:
        return Cell.ofBytes(resultSet.getBytes(index));
      default:
        if (isTemporal(jdbcType)) {
          // read against a UTC calendar so the driver does not shift into the JVM zone
          Timestamp timestamp = resultSet.getTimestamp(index, Calendar.getInstance(UTC));
          return timestamp == null ? Cell.ofNull() : Cell.ofString(formatInstant(timestamp));
        }
        value = resultSet.getObject(index);
    }
    if (value == null) {
      return Cell.ofNull();
    }
    if (value instanceof BigDecimal) {
      return Cell.ofString(((BigDecimal) value).toPlainString());
    }
    if (value instanceof java.util.Date) {
      return Cell.ofString(formatInstant((java.util.Date) value));
    }
    return Cell.ofString(value.toString());
  }

  /** Renders a temporal value as UTC text; {@link Timestamp} nanoseconds are kept. */
  private static String formatInstant(java.util.Date value) {
    Instant instant =
        value instanceof Timestamp
            ? ((Timestamp) value).toInstant()
            : Instant.ofEpochMilli(value.getTime());
    return TEMPORAL_FORMAT.format(instant);
  }

  private static String formatEpochMillis(long epochMillis) {
    return TEMPORAL_FORMAT.format(Instant.ofEpochMilli(epochMillis));
  }

  private String wireText(JsonNode node, String typeName) {
    String base = baseTypeName(typeName);
    if (node.isNumber()) {
      switch (base) {
        case "DECIMAL":
        case "NUMERIC":
          return node.decimalValue().toPlainString();
        case "DATE":
        case "TIME":
        case "TIMESTAMP":
          return formatEpochMillis(node.longValue());
        default:
          return node.asText();
      }
    }
    if (node.isValueNode()) {
      return node.asText();
    }
    // arrays and structured values keep their JSON text
    return node.toString();
  }

  private static boolean isTemporal(int jdbcType) {
    return jdbcType == Types.DATE || jdbcType == Types.TIME || jdbcType == Types.TIMESTAMP;
  }

  private static boolean isBooleanText(String text) {
    String normalized = text.strip().toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("false");
  }

  static String baseTypeName(String typeName) {
    if (typeName == null) {
      return "VARCHAR";
    }
    String base = typeName.strip().toUpperCase(Locale.ROOT);
    int paren = base.indexOf('(');
    if (paren >= 0) {
      base = base.substring(0, paren).strip();
    }
    if (base.endsWith(" ARRAY")) {
      return "ARRAY";
    }
    if (base.startsWith("UNSIGNED_")) {
      base = base.substring("UNSIGNED_".length());
    }
    return base;
  }
}
