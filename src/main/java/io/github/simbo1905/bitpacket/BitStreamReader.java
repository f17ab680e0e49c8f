// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Objects;

import static io.github.simbo1905.bitpacket.Field.LOGGER;

/// Bit granular reads over a byte cursor, most significant bit first. Whole bytes are taken from the buffer only
/// when the bits already fetched run out, so after reading `n` bits the buffer has advanced by `ceil(n / 8)` bytes.
public final class BitStreamReader {
  private final ByteBuffer buffer;
  private int current;
  private int available;
  private long bitsRead;

  public BitStreamReader(@NotNull ByteBuffer buffer) {
    this.buffer = Objects.requireNonNull(buffer);
  }

  /// Reads `count` bits, 0 to 64, as an unsigned number.
  /// @throws StreamLengthMismatchException if the buffer runs out of bytes; nothing is consumed in that case
  public long read(int count) {
    if (count < 0 || count > Long.SIZE) {
      throw new IllegalArgumentException("Bit count must be between 0 and 64, got: " + count);
    }
    if (count > available) {
      final int needed = Wire.byteEnd(count - available);
      if (buffer.remaining() < needed) {
        throw new StreamLengthMismatchException("Bit length mismatch (" + count + " bits expected, " +
            (available + buffer.remaining() * Byte.SIZE) + " available)");
      }
    }
    long result = 0;
    int remaining = count;
    while (remaining > 0) {
      if (available == 0) {
        current = buffer.get() & 0xFF;
        available = Byte.SIZE;
        LOGGER.finer(() -> String.format("BitStreamReader fetched 0x%02X at position %d", current, buffer.position() - 1));
      }
      final int take = Math.min(remaining, available);
      final int chunk = (current >>> (available - take)) & ((1 << take) - 1);
      result = (result << take) | chunk;
      available -= take;
      remaining -= take;
    }
    bitsRead += count;
    return result;
  }

  public long bitsRead() {
    return bitsRead;
  }

  /// Number of bits fetched from the buffer but not read yet. Always less than eight.
  public int pending() {
    return available;
  }

  /// Discards the bits left in the last fetched byte so the next read starts on a byte boundary.
  /// @return the discarded padding bits
  public long alignToByte() {
    final long padding = available == 0 ? 0 : current & ((1 << available) - 1);
    available = 0;
    return padding;
  }
}
