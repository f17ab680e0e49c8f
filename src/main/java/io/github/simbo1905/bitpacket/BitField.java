// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;

/// Unsigned value of 1 to 64 bits. Its [#size()] is in bits, and it can only live inside a [BitStructure],
/// which packs it together with its siblings into whole bytes.
public class BitField extends Field<Long> {
  private final int size;
  private long value;

  public BitField(@NotNull String name, int size) {
    this(name, size, 0L);
  }

  public BitField(@NotNull String name, int size, long value) {
    super(name);
    if (size < 1 || size > Long.SIZE) {
      throw new IllegalArgumentException("Bit field size must be between 1 and 64 bits, got: " + size);
    }
    this.size = size;
    assignValue(value);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public int bitSize() {
    return size;
  }

  @Override
  public Long value() {
    return value;
  }

  /// @throws SizeExceededException if the value is negative or wider than the field
  @Override
  protected void assignValue(Long value) {
    final long v = value;
    if (size < Long.SIZE) {
      if (v < 0) {
        throw new SizeExceededException("Negative values not allowed in bit field '" + name() + "'");
      }
      if ((v >>> size) != 0) {
        throw new SizeExceededException("Value is bigger than the field size (value " + v + " has bit size " +
            (Long.SIZE - Long.numberOfLeadingZeros(v)) + ", '" + name() + "' bit size is " + size + ")");
      }
    }
    this.value = v;
  }

  @Override
  protected Long coerce(Object value) {
    if (value instanceof Boolean bool) {
      return bool ? 1L : 0L;
    }
    if (value instanceof Number number) {
      final double d = number.doubleValue();
      if ((number instanceof Double || number instanceof Float) && d != Math.rint(d)) {
        throw new FieldTypeException("Value " + value + " is not an integer (bit field '" + name() + "')");
      }
      return number.longValue();
    }
    throw new FieldTypeException("Bit field '" + name() + "' cannot hold " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  public long hexValue() {
    return value;
  }

  @Override
  public String strValue() {
    return Wire.hex(value, Wire.byteEnd(size));
  }

  @Override
  public String strHexValue() {
    return Wire.hex(hexValue(), Wire.byteEnd(size));
  }

  @Override
  public String strEngValue() {
    final Object eng = engValue();
    return eng instanceof Long l ? Wire.hex(l, Wire.byteEnd(size)) : String.valueOf(eng);
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    throw notOnByteStream();
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    throw notOnByteStream();
  }

  @Override
  protected void encodeBits(BitStreamWriter writer, Context context) {
    writer.write(size, value);
  }

  @Override
  protected void decodeBits(BitStreamReader reader, Context context) {
    value = reader.read(size);
  }

  @Override
  StreamKind streamKind() {
    return StreamKind.BITS;
  }

  private UnsupportedNestingException notOnByteStream() {
    return new UnsupportedNestingException("Stream for bit field '" + name() + "' should be bit oriented " +
        "(hint: enclose it in a BitStructure)");
  }
}
