// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// A length field followed by that many words of raw bytes. The length counts words of [#wordSize()] bytes, one by
/// default, and both children are kept consistent by [#setValue]: neither can be assigned on its own.
/// ```
/// Data payload = new Data("payload", IntegerField.uint16("length"));
/// payload.setValue("hello".getBytes(StandardCharsets.US_ASCII));
/// payload.bytes(); // 00 05 68 65 6C 6C 6F
/// ```
public class Data extends Container<byte[]> {
  public static final String DATA_FIELD = "Data";

  private final Field<Long> length;
  private final LengthResolver wordSize;
  private final StringField data;

  public Data(@NotNull String name, @NotNull Field<Long> length) {
    this(name, length, LengthResolver.constant(1));
  }

  public Data(@NotNull String name, @NotNull Field<Long> length, @NotNull LengthResolver wordSize) {
    super(name);
    this.length = Objects.requireNonNull(length, "length field must not be null");
    this.wordSize = Objects.requireNonNull(wordSize, "word size resolver must not be null");
    this.data = new StringField(DATA_FIELD, this::byteLength);
    for (Field<?> field : new Field<?>[]{length, data}) {
      if (field.streamKind() == StreamKind.BITS) {
        throw new UnsupportedNestingException("Data '" + name + "' needs a byte oriented length field");
      }
      attach(field);
      field.manage(this);
    }
    length.assignValue(0L);
  }

  /// Data has exactly two children, its length and its bytes.
  /// @throws UnsupportedOperationException always
  @Override
  public Data append(@NotNull Field<?> field) {
    throw new UnsupportedOperationException("Cannot append fields to Data '" + name() + "'");
  }

  public Field<Long> lengthField() {
    return length;
  }

  public StringField dataField() {
    return data;
  }

  public int wordSize() {
    return wordSize(Context.of(root()));
  }

  private int wordSize(Context context) {
    final int size = wordSize.resolve(context);
    if (size == 0) {
      throw new IllegalArgumentException("Word size of Data '" + name() + "' must be positive");
    }
    return size;
  }

  private int byteLength(Context context) {
    final long words = Wire.checkedLength(length.value(), "Word count of Data '" + name() + "'");
    return Wire.checkedLength(words * wordSize(context), "Byte length of Data '" + name() + "'");
  }

  @Override
  public byte[] value() {
    return data.value();
  }

  /// @throws LengthMismatchException if the byte count is not a multiple of the word size
  /// @throws ValueTooLongException if the word count does not fit in the length field
  @Override
  protected void assignValue(byte[] value) {
    Objects.requireNonNull(value, "value must not be null");
    final int size = wordSize();
    if (value.length % size != 0) {
      throw new LengthMismatchException("Data length " + value.length + " of '" + name() +
          "' is not a multiple of the word size " + size);
    }
    try {
      length.assignValue((long) (value.length / size));
    } catch (SizeExceededException e) {
      throw new ValueTooLongException("Data of " + value.length + " bytes is too long for length field '" +
          length.name() + "' of '" + name() + "'", e);
    }
    data.assignValue(value);
  }

  @Override
  protected byte[] coerce(Object value) {
    if (value instanceof byte[] bytes) {
      return bytes;
    }
    if (value instanceof CharSequence text) {
      return text.toString().getBytes(StandardCharsets.ISO_8859_1);
    }
    throw new FieldTypeException("Data '" + name() + "' cannot hold " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  @Override
  public String strValue() {
    return data.strValue();
  }

  @Override
  public String strEngValue() {
    final Object eng = engValue();
    return eng instanceof byte[] bytes ? (bytes.length > 0 ? Wire.hex(bytes) : "") : String.valueOf(eng);
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    length.encode(buffer, context);
    data.encode(buffer, context);
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    context.decode(length, buffer);
    context.decode(data, buffer);
    LOGGER.fine(() -> "Data '" + name() + "' read " + data.size() + " bytes");
  }
}
