// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;

/// Container of bit fields packed most significant bit first. Its [#bitSize()] is the exact sum of its children's
/// widths and its [#size()] rounds that up to whole bytes, the final bits being zero padding:
/// ```
/// BitStructure flags = new BitStructure("flags")
///     .append(new BitField("version", 4))
///     .append(new BitField("fragment", 13)); // 17 bits, 3 bytes on the wire
/// ```
/// A bit structure nested in another bit structure shares its parent's bit stream and adds no padding of its own.
/// What happens to non-zero padding when decoding is decided by the [PaddingMode].
public class BitStructure extends Container<Map<String, Object>> {
  private final PaddingMode padding;

  /// A bit structure following [PaddingMode#current()]
  public BitStructure(@NotNull String name) {
    this(name, PaddingMode.current());
  }

  public BitStructure(@NotNull String name, @NotNull PaddingMode padding) {
    super(name);
    this.padding = Objects.requireNonNull(padding, "padding mode must not be null");
  }

  public PaddingMode padding() {
    return padding;
  }

  @Override
  public BitStructure append(@NotNull Field<?> field) {
    super.append(field);
    return this;
  }

  @Override
  protected void checkNesting(Field<?> field) {
    if (field.streamKind() == StreamKind.BYTES) {
      throw new UnsupportedNestingException("Cannot append byte field '" + field.name() +
          "' to bit structure '" + name() + "' (hint: use a Structure instead of a BitStructure)");
    }
  }

  @Override
  public int bitSize() {
    int bits = 0;
    for (Field<?> field : fields()) {
      bits += field.bitSize();
    }
    return bits;
  }

  @Override
  public int size() {
    return Wire.byteEnd(bitSize());
  }

  @Override
  public Map<String, Object> value() {
    return childValues();
  }

  @Override
  protected void assignValue(Map<String, Object> value) {
    assignChildren(value);
  }

  @Override
  protected Map<String, Object> coerce(Object value) {
    return coerceMap(value);
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    final BitStreamWriter writer = new BitStreamWriter(buffer);
    encodeBits(writer, context);
    writer.flush();
    LOGGER.fine(() -> "BitStructure '" + name() + "' wrote " + writer.bitsWritten() + " bits");
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    final BitStreamReader reader = new BitStreamReader(buffer);
    decodeBits(reader, context);
    final int pending = reader.pending();
    final long bits = reader.alignToByte();
    if (bits != 0) {
      final String message = "Non-zero padding 0x" + Long.toHexString(bits) + " in the last " + pending +
          " bits of '" + name() + "'";
      if (padding == PaddingMode.STRICT) {
        throw new IllegalStateException(message);
      }
      LOGGER.warning(() -> message + ", it will be encoded as zero");
    }
    LOGGER.fine(() -> "BitStructure '" + name() + "' read " + reader.bitsRead() + " bits");
  }

  @Override
  protected void encodeBits(BitStreamWriter writer, Context context) {
    for (Field<?> field : fields()) {
      field.encodeBits(writer, context);
    }
  }

  @Override
  protected void decodeBits(BitStreamReader reader, Context context) {
    for (Field<?> field : fields()) {
      context.decode(field, reader);
    }
  }

  @Override
  StreamKind streamKind() {
    return StreamKind.ANY;
  }
}
