// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Objects;

import static io.github.simbo1905.bitpacket.Field.LOGGER;

/// Bit granular writes over a byte cursor, most significant bit first. A byte is put into the buffer as soon as its
/// eight bits are known; [#flush()] zero pads a final partial byte.
public final class BitStreamWriter {
  private final ByteBuffer buffer;
  private int current;
  private int used;
  private long bitsWritten;

  public BitStreamWriter(@NotNull ByteBuffer buffer) {
    this.buffer = Objects.requireNonNull(buffer);
  }

  /// Writes the low `count` bits, 0 to 64, of `bits`.
  /// @throws IllegalArgumentException if `bits` has bits set above `count`
  public void write(int count, long bits) {
    if (count < 0 || count > Long.SIZE) {
      throw new IllegalArgumentException("Bit count must be between 0 and 64, got: " + count);
    }
    if (count < Long.SIZE && (bits >>> count) != 0) {
      throw new IllegalArgumentException("Value 0x" + Long.toHexString(bits) + " does not fit in " + count + " bits");
    }
    int remaining = count;
    while (remaining > 0) {
      final int take = Math.min(Byte.SIZE - used, remaining);
      final int chunk = (int) ((bits >>> (remaining - take)) & ((1L << take) - 1));
      current = (current << take) | chunk;
      used += take;
      remaining -= take;
      if (used == Byte.SIZE) {
        emit();
      }
    }
    bitsWritten += count;
  }

  public long bitsWritten() {
    return bitsWritten;
  }

  /// Zero pads the pending bits, if any, up to a byte boundary and writes that byte.
  public void flush() {
    if (used > 0) {
      current <<= Byte.SIZE - used;
      used = Byte.SIZE;
      emit();
    }
  }

  private void emit() {
    if (!buffer.hasRemaining()) {
      throw new StreamLengthMismatchException("No room to write bits at position " + buffer.position());
    }
    final int value = current;
    buffer.put((byte) value);
    LOGGER.finer(() -> String.format("BitStreamWriter wrote 0x%02X at position %d", value, buffer.position() - 1));
    current = 0;
    used = 0;
  }
}
