// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/// Wire format of a fixed width number: integer or IEEE-754 real, its width in bytes, its signedness and its byte
/// order. One codec covers every numeric leaf.
///
/// Unsigned 64-bit integers are carried in the bit pattern of a Java `long`, so a decoded `0xFFFFFFFFFFFFFFFF` is
/// `-1L` and prints as `18446744073709551615`.
public record NumericFormat(Kind kind, int width, boolean signed, ByteOrder order) {

  public enum Kind {INTEGER, REAL}

  public static final NumericFormat INT8 = integer(1, true, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat UINT8 = integer(1, false, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat INT16 = integer(2, true, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat UINT16 = integer(2, false, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat INT32 = integer(4, true, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat UINT32 = integer(4, false, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat INT64 = integer(8, true, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat UINT64 = integer(8, false, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat INT8_LE = integer(1, true, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat UINT8_LE = integer(1, false, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat INT16_LE = integer(2, true, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat UINT16_LE = integer(2, false, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat INT32_LE = integer(4, true, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat UINT32_LE = integer(4, false, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat INT64_LE = integer(8, true, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat UINT64_LE = integer(8, false, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat FLOAT32 = new NumericFormat(Kind.REAL, 4, true, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat FLOAT64 = new NumericFormat(Kind.REAL, 8, true, ByteOrder.BIG_ENDIAN);
  public static final NumericFormat FLOAT32_LE = new NumericFormat(Kind.REAL, 4, true, ByteOrder.LITTLE_ENDIAN);
  public static final NumericFormat FLOAT64_LE = new NumericFormat(Kind.REAL, 8, true, ByteOrder.LITTLE_ENDIAN);

  public NumericFormat {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(order, "order must not be null");
    switch (kind) {
      case INTEGER -> {
        if (width != 1 && width != 2 && width != 4 && width != 8) {
          throw new IllegalArgumentException("Integer width must be 1, 2, 4 or 8 bytes, got: " + width);
        }
      }
      case REAL -> {
        if (width != 4 && width != 8) {
          throw new IllegalArgumentException("Real width must be 4 or 8 bytes, got: " + width);
        }
        if (!signed) {
          throw new IllegalArgumentException("Real numbers are always signed");
        }
      }
    }
  }

  public static NumericFormat integer(int width, boolean signed, @NotNull ByteOrder order) {
    return new NumericFormat(Kind.INTEGER, width, signed, order);
  }

  public int bits() {
    return width * Byte.SIZE;
  }

  /// Converts a number into the long this integer format carries, checking that it fits.
  /// @throws SizeExceededException if the value is outside the range of this format
  /// @throws FieldTypeException if the value has a fractional part
  public long toLong(@NotNull Number value, String fieldName) {
    Objects.requireNonNull(value);
    if (value instanceof BigInteger big) {
      final boolean fits = signed ? big.bitLength() < bits() : big.signum() >= 0 && big.bitLength() <= bits();
      if (!fits) {
        throw outOfRange(value, fieldName);
      }
      return big.longValue();
    }
    if (value instanceof Double || value instanceof Float) {
      final double d = value.doubleValue();
      if (d != Math.rint(d) || Double.isInfinite(d)) {
        throw new FieldTypeException("Value " + value + " is not an integer (field '" + fieldName + "')");
      }
      if (d < Long.MIN_VALUE || d >= 0x1p63) {
        throw outOfRange(value, fieldName);
      }
    }
    final long v = value.longValue();
    if (width == 8) {
      // unsigned 64 bit values arrive as their long bit pattern
      return v;
    }
    final long min = signed ? -(1L << (bits() - 1)) : 0L;
    final long max = signed ? (1L << (bits() - 1)) - 1 : (1L << bits()) - 1;
    if (v < min || v > max) {
      throw outOfRange(value, fieldName);
    }
    return v;
  }

  /// @throws SizeExceededException if a finite value overflows a 32-bit float
  public double toDouble(@NotNull Number value, String fieldName) {
    final double d = value.doubleValue();
    if (width == 4 && Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE) {
      throw outOfRange(value, fieldName);
    }
    return d;
  }

  /// Encodes a number into exactly [#width()] bytes in this format's byte order.
  public byte[] encode(@NotNull Number value, String fieldName) {
    final ByteBuffer buffer = ByteBuffer.allocate(width).order(order);
    if (kind == Kind.REAL) {
      final double d = toDouble(value, fieldName);
      if (width == 4) {
        buffer.putFloat((float) d);
      } else {
        buffer.putDouble(d);
      }
    } else {
      final long v = toLong(value, fieldName);
      switch (width) {
        case 1 -> buffer.put((byte) v);
        case 2 -> buffer.putShort((short) v);
        case 4 -> buffer.putInt((int) v);
        default -> buffer.putLong(v);
      }
    }
    return buffer.array();
  }

  public long decodeLong(byte[] bytes) {
    checkWidth(bytes);
    final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(order);
    return switch (width) {
      case 1 -> signed ? buffer.get() : buffer.get() & 0xFFL;
      case 2 -> signed ? buffer.getShort() : buffer.getShort() & 0xFFFFL;
      case 4 -> signed ? buffer.getInt() : buffer.getInt() & 0xFFFFFFFFL;
      default -> buffer.getLong();
    };
  }

  public double decodeDouble(byte[] bytes) {
    checkWidth(bytes);
    final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(order);
    return width == 4 ? buffer.getFloat() : buffer.getDouble();
  }

  /// Decimal rendering of a decoded integer, unsigned where this format is
  public String toString(long value) {
    return signed ? Long.toString(value) : Long.toUnsignedString(value);
  }

  private void checkWidth(byte[] bytes) {
    if (bytes.length != width) {
      throw new StreamLengthMismatchException("Expected " + width + " bytes but got " + bytes.length);
    }
  }

  private SizeExceededException outOfRange(Number value, String fieldName) {
    return new SizeExceededException("Value " + value + " does not fit in " + (signed ? "signed " : "unsigned ") +
        bits() + "-bit field '" + fieldName + "'");
  }
}
