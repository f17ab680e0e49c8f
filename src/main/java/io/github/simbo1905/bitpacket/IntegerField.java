// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

/// Fixed width integer of 8, 16, 32 or 64 bits, signed or unsigned, in either byte order.
/// The plain factories are big-endian (network order) and the `le` ones little-endian.
public class IntegerField extends Value<Long> {

  public IntegerField(@NotNull String name, @NotNull NumericFormat format) {
    this(name, format, 0L);
  }

  public IntegerField(@NotNull String name, @NotNull NumericFormat format, long value) {
    super(name, requireInteger(format), value);
  }

  public static IntegerField of(String name, NumericFormat format, long value) {
    return new IntegerField(name, format, value);
  }

  public static IntegerField int8(String name) {
    return new IntegerField(name, NumericFormat.INT8);
  }

  public static IntegerField uint8(String name) {
    return new IntegerField(name, NumericFormat.UINT8);
  }

  public static IntegerField int16(String name) {
    return new IntegerField(name, NumericFormat.INT16);
  }

  public static IntegerField uint16(String name) {
    return new IntegerField(name, NumericFormat.UINT16);
  }

  public static IntegerField int32(String name) {
    return new IntegerField(name, NumericFormat.INT32);
  }

  public static IntegerField uint32(String name) {
    return new IntegerField(name, NumericFormat.UINT32);
  }

  public static IntegerField int64(String name) {
    return new IntegerField(name, NumericFormat.INT64);
  }

  public static IntegerField uint64(String name) {
    return new IntegerField(name, NumericFormat.UINT64);
  }

  public static IntegerField int16le(String name) {
    return new IntegerField(name, NumericFormat.INT16_LE);
  }

  public static IntegerField uint16le(String name) {
    return new IntegerField(name, NumericFormat.UINT16_LE);
  }

  public static IntegerField int32le(String name) {
    return new IntegerField(name, NumericFormat.INT32_LE);
  }

  public static IntegerField uint32le(String name) {
    return new IntegerField(name, NumericFormat.UINT32_LE);
  }

  public static IntegerField int64le(String name) {
    return new IntegerField(name, NumericFormat.INT64_LE);
  }

  public static IntegerField uint64le(String name) {
    return new IntegerField(name, NumericFormat.UINT64_LE);
  }

  @Override
  public Long value() {
    return format().decodeLong(raw());
  }

  @Override
  protected Long coerce(Object value) {
    if (value instanceof Number number) {
      return format().toLong(number, name());
    }
    if (value instanceof Boolean bool) {
      return bool ? 1L : 0L;
    }
    throw new FieldTypeException("Integer field '" + name() + "' cannot hold " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  @Override
  public String strValue() {
    return format().toString(value());
  }

  private static NumericFormat requireInteger(NumericFormat format) {
    if (format.kind() != NumericFormat.Kind.INTEGER) {
      throw new IllegalArgumentException("Integer field needs an integer format, got: " + format);
    }
    return format;
  }
}
