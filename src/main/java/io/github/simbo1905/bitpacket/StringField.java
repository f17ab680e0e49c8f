// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// A run of raw bytes whose length is given by a [LengthResolver]: either a constant, or a function of the
/// [Context], typically the value of a length field decoded just before this one.
///
/// [#size()] is the length of the current content. Decoding reads exactly the resolved length; encoding fails if the
/// content disagrees with it.
public class StringField extends Field<byte[]> {
  private final LengthResolver length;
  private byte[] data;

  public StringField(@NotNull String name, @NotNull LengthResolver length) {
    super(name);
    this.length = Objects.requireNonNull(length, "length resolver must not be null");
    this.data = length instanceof LengthResolver.Fixed fixed ? new byte[fixed.length()] : new byte[0];
  }

  /// A string whose length is fixed to that of its initial content
  public StringField(@NotNull String name, @NotNull byte[] data) {
    this(name, LengthResolver.constant(data.length));
    this.data = data.clone();
  }

  public static StringField fixed(String name, int length) {
    return new StringField(name, LengthResolver.constant(length));
  }

  /// A string whose length is the value of the numeric field at `lengthPath`
  public static StringField sizedBy(String name, String lengthPath) {
    return new StringField(name, LengthResolver.of(lengthPath));
  }

  public LengthResolver lengthResolver() {
    return length;
  }

  @Override
  public int size() {
    return data.length;
  }

  @Override
  public byte[] value() {
    return data.clone();
  }

  /// The content as ISO-8859-1 text, one character per byte
  public String text() {
    return new String(data, StandardCharsets.ISO_8859_1);
  }

  /// @throws LengthMismatchException if the new content differs in length from the length resolved right now
  @Override
  protected void assignValue(byte[] value) {
    Objects.requireNonNull(value, "value must not be null");
    final int expected = length.resolve(Context.of(root()));
    if (value.length != expected) {
      throw new LengthMismatchException("String '" + name() + "' must be " + expected + " bytes long (" +
          value.length + " given)");
    }
    this.data = value.clone();
  }

  @Override
  protected byte[] coerce(Object value) {
    if (value instanceof byte[] bytes) {
      return bytes;
    }
    if (value instanceof CharSequence text) {
      return text.toString().getBytes(StandardCharsets.ISO_8859_1);
    }
    throw new FieldTypeException("String field '" + name() + "' cannot hold " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  @Override
  public String strValue() {
    return data.length > 0 ? Wire.hex(data) : "";
  }

  @Override
  public String strHexValue() {
    return strValue();
  }

  @Override
  public String strEngValue() {
    final Object eng = engValue();
    return eng instanceof byte[] bytes ? (bytes.length > 0 ? Wire.hex(bytes) : "") : String.valueOf(eng);
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    Wire.write(buffer, length.resolve(context), data, name());
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    data = Wire.read(buffer, length.resolve(context), name());
  }
}
