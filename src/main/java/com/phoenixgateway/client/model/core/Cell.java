package com.phoenixgateway.client.model.core;

import com.phoenixgateway.client.common.CellKind;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/** A single tagged value of a normalized result row. Nulls are explicit cells of kind NULL. */
public final class Cell {

  private static final Cell NULL_CELL = new Cell(CellKind.NULL, null);

  private final CellKind kind;
  private final Object value;

  private Cell(CellKind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static Cell ofNull() {
    return NULL_CELL;
  }

  public static Cell ofString(String value) {
    return value == null ? NULL_CELL : new Cell(CellKind.STRING, value);
  }

  public static Cell ofInteger(long value) {
    return new Cell(CellKind.INTEGER, value);
  }

  public static Cell ofFloat(double value) {
    return new Cell(CellKind.FLOAT, value);
  }

  public static Cell ofBoolean(boolean value) {
    return new Cell(CellKind.BOOLEAN, value);
  }

  public static Cell ofBytes(byte[] value) {
    return value == null ? NULL_CELL : new Cell(CellKind.BYTES, value.clone());
  }

  public CellKind getKind() {
    return kind;
  }

  public boolean isNull() {
    return kind == CellKind.NULL;
  }

  public String getString() {
    return kind == CellKind.STRING ? (String) value : null;
  }

  public Long getInteger() {
    return kind == CellKind.INTEGER ? (Long) value : null;
  }

  public Double getFloat() {
    return kind == CellKind.FLOAT ? (Double) value : null;
  }

  public Boolean getBoolean() {
    return kind == CellKind.BOOLEAN ? (Boolean) value : null;
  }

  public byte[] getBytes() {
    return kind == CellKind.BYTES ? ((byte[]) value).clone() : null;
  }

  /**
   * Value suitable for JSON serialization: {@code null}, String, Long, Double, Boolean, or base64
   * text for bytes.
   */
  public Object toJsonValue() {
    if (kind == CellKind.BYTES) {
      return Base64.getEncoder().encodeToString((byte[]) value);
    }
    return value;
  }

  /** Text rendering of the value; {@code null} for the null cell. */
  public String asText() {
    Object json = toJsonValue();
    return json == null ? null : json.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Cell that = (Cell) o;
    if (kind != that.kind) {
      return false;
    }
    if (kind == CellKind.BYTES) {
      return Arrays.equals((byte[]) value, (byte[]) that.value);
    }
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return kind == CellKind.BYTES
        ? Objects.hash(kind, Arrays.hashCode((byte[]) value))
        : Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return kind + "(" + asText() + ")";
  }
}
