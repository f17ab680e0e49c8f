// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import java.nio.ByteBuffer;

import static io.github.simbo1905.bitpacket.Field.LOGGER;

/// Exact length reads and writes against the byte cursor, plus the hex formatting shared by the leaves.
final class Wire {

  private Wire() {
  }

  /// A length or count taken from the stream as an `int`. The value is read as unsigned, so a uint64 with the top
  /// bit set is out of range rather than negative.
  /// @throws StreamLengthMismatchException if the value is negative or above `Integer.MAX_VALUE`
  static int checkedLength(long value, String what) {
    if (value < 0 || value > Integer.MAX_VALUE) {
      throw new StreamLengthMismatchException(what + " " + Long.toUnsignedString(value) + " is out of range");
    }
    return (int) value;
  }

  /// Read exactly `length` bytes or fail without consuming anything
  static byte[] read(ByteBuffer buffer, int length, String fieldName) {
    if (length < 0) {
      throw new IllegalArgumentException("Data length to read must be >= 0 (field '" + fieldName + "')");
    }
    if (buffer.remaining() < length) {
      throw new StreamLengthMismatchException("Data length mismatch reading '" + fieldName + "' (" + length +
          " expected, " + buffer.remaining() + " available)");
    }
    final int position = buffer.position();
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    LOGGER.finer(() -> "Read " + length + " bytes for '" + fieldName + "' at position " + position);
    return bytes;
  }

  /// Write `data`, which must be exactly `length` bytes long
  static void write(ByteBuffer buffer, int length, byte[] data, String fieldName) {
    if (length < 0) {
      throw new IllegalArgumentException("Data length to write must be >= 0 (field '" + fieldName + "')");
    }
    if (data.length != length) {
      throw new StreamLengthMismatchException("Data length mismatch writing '" + fieldName + "' (" + length +
          " expected, " + data.length + " found)");
    }
    if (buffer.remaining() < length) {
      throw new StreamLengthMismatchException("No room to write '" + fieldName + "' (" + length +
          " bytes needed, " + buffer.remaining() + " available)");
    }
    final int position = buffer.position();
    buffer.put(data);
    LOGGER.finer(() -> "Wrote " + length + " bytes for '" + fieldName + "' at position " + position);
  }

  /// `0x` followed by the unsigned value in upper case hex, zero padded to two digits per byte
  static String hex(long value, int byteSize) {
    return String.format("0x%0" + Math.max(1, byteSize * 2) + "X", value);
  }

  static String hex(byte[] bytes) {
    final StringBuilder sb = new StringBuilder(2 + bytes.length * 2).append("0x");
    for (byte b : bytes) {
      sb.append(String.format("%02X", b & 0xFF));
    }
    return sb.toString();
  }

  static long unsigned(byte[] bytes) {
    long value = 0;
    for (byte b : bytes) {
      value = (value << Byte.SIZE) | (b & 0xFF);
    }
    return value;
  }

  static int byteEnd(int bitSize) {
    return (bitSize + Byte.SIZE - 1) / Byte.SIZE;
  }
}
