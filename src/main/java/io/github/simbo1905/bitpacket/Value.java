// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Objects;

/// Fixed width numeric leaf. The field keeps the bytes as they appear on the wire and decodes its value from them
/// through its [NumericFormat], so [#encode] always reproduces exactly the bytes last decoded.
public abstract class Value<V extends Number> extends Field<V> {
  private final NumericFormat format;
  private byte[] bytes;

  protected Value(@NotNull String name, @NotNull NumericFormat format, @NotNull Number value) {
    super(name);
    this.format = Objects.requireNonNull(format, "format must not be null");
    this.bytes = format.encode(Objects.requireNonNull(value), name);
  }

  public NumericFormat format() {
    return format;
  }

  @Override
  public int size() {
    return format.width();
  }

  byte[] raw() {
    return bytes;
  }

  @Override
  protected void assignValue(V value) {
    this.bytes = format.encode(Objects.requireNonNull(value, "value must not be null"), name());
  }

  /// The bytes of this field, in memory order, read as one unsigned big-endian number
  public long hexValue() {
    return Wire.unsigned(bytes);
  }

  @Override
  public String strValue() {
    return String.valueOf(value());
  }

  @Override
  public String strHexValue() {
    return Wire.hex(hexValue(), size());
  }

  @Override
  public String strEngValue() {
    return String.valueOf(engValue());
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    Wire.write(buffer, size(), bytes, name());
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    bytes = Wire.read(buffer, size(), name());
  }
}
