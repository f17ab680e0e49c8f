// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/// Root of every node in a binary layout tree.
///
/// A layout is described once as a tree of fields and the same tree is used both to encode a value tree into bytes
/// and to decode bytes into a value tree. Leaves hold fixed or resolved width values; [Container] subclasses hold
/// named, ordered children. Every field knows its size in its own unit: bits for [BitField] and bytes for
/// everything else.
///
/// Encoding and decoding walk the tree depth first in declaration order over one shared [ByteBuffer] cursor. Any
/// length, count or type resolver is handed a [Context] rooted at the outermost container so that a field may depend
/// on a sibling of an ancestor that was decoded before it.
///
/// @param <V> the Java type of the field value
public abstract class Field<V> {

  public static final Logger LOGGER = Logger.getLogger(Field.class.getName());

  private String name;
  private Container<?> parent;
  private Field<?> manager;
  private Function<? super V, ?> calibration = value -> value;

  protected Field(@NotNull String name) {
    this.name = Objects.requireNonNull(name, "Field name must not be null");
  }

  public String name() {
    return name;
  }

  /// The enclosing container, or null when this field is a root. This link is only ever used to find the context
  /// of a resolver; the container owns the child, never the other way round.
  public Container<?> parent() {
    return parent;
  }

  public Field<?> root() {
    Field<?> field = this;
    while (field.parent() != null) {
      field = field.parent();
    }
    return field;
  }

  /// The children of this field in wire order. Leaves have none.
  public List<Field<?>> fields() {
    return List.of();
  }

  /// Size of the field in its unit: bits for bit fields, bytes for everything else.
  public abstract int size();

  /// Exact width of the field in bits.
  public int bitSize() {
    return size() * Byte.SIZE;
  }

  public abstract V value();

  /// Sets a new value.
  /// @throws IllegalStateException if a dynamic container keeps this field in sync with its own content
  public final void setValue(V value) {
    if (manager != null) {
      throw new IllegalStateException("Field '" + name + "' is maintained by '" + manager.name() +
          "' and cannot be assigned directly");
    }
    assignValue(value);
  }

  /// Untyped assignment used by dotted-path setters. The value is coerced into the field's value type first.
  /// @throws FieldTypeException if the value cannot represent this field's type
  public final void assign(Object value) {
    setValue(coerce(value));
  }

  protected abstract void assignValue(V value);

  protected abstract V coerce(Object value);

  public Function<? super V, ?> calibration() {
    return calibration;
  }

  /// Sets the unary function turning the raw value into an engineering value, e.g. counts into degrees.
  public void setCalibration(@NotNull Function<? super V, ?> calibration) {
    this.calibration = Objects.requireNonNull(calibration, "Calibration must not be null");
  }

  public Object engValue() {
    return calibration.apply(value());
  }

  public abstract String strValue();

  public abstract String strHexValue();

  public abstract String strEngValue();

  /// Clears state materialised by a previous decode. Static fields have none.
  public void reset() {
  }

  /// Writes this field into the buffer, consuming exactly [#size()] bytes of it.
  /// @throws StreamLengthMismatchException if the buffer has too little room
  public final void encode(@NotNull ByteBuffer buffer) {
    Objects.requireNonNull(buffer);
    final int start = buffer.position();
    encode(buffer, Context.encoding(root()));
    LOGGER.fine(() -> "Encoded '" + name + "' " + (buffer.position() - start) + " bytes at position " + start);
  }

  /// Reads this field from the buffer, consuming exactly as many bytes as the layout resolves to.
  /// @throws StreamLengthMismatchException if the buffer holds too few bytes
  public final void decode(@NotNull ByteBuffer buffer) {
    Objects.requireNonNull(buffer);
    final int start = buffer.position();
    final Context context = Context.decoding(root(), this);
    context.decode(this, buffer);
    LOGGER.fine(() -> "Decoded '" + name + "' " + (buffer.position() - start) + " bytes at position " + start);
  }

  public byte[] bytes() {
    final ByteBuffer buffer = ByteBuffer.allocate(size());
    encode(buffer);
    return buffer.array();
  }

  /// Decodes this field from exactly the given bytes.
  /// @throws StreamLengthMismatchException if the bytes are too short or leave bytes unconsumed
  public void setBytes(@NotNull byte[] bytes) {
    final ByteBuffer buffer = ByteBuffer.wrap(bytes);
    decode(buffer);
    if (buffer.hasRemaining()) {
      throw new StreamLengthMismatchException("Data length mismatch decoding '" + name + "' (" +
          buffer.position() + " expected, " + bytes.length + " given)");
    }
  }

  protected abstract void encode(ByteBuffer buffer, Context context);

  protected abstract void decode(ByteBuffer buffer, Context context);

  protected void encodeBits(BitStreamWriter writer, Context context) {
    throw new UnsupportedNestingException("Field '" + name + "' is byte oriented and cannot be written to a bit " +
        "stream (hint: use a Structure instead of a BitStructure)");
  }

  protected void decodeBits(BitStreamReader reader, Context context) {
    throw new UnsupportedNestingException("Field '" + name + "' is byte oriented and cannot be read from a bit " +
        "stream (hint: use a Structure instead of a BitStructure)");
  }

  /// Which kind of stream this field can be encoded on.
  StreamKind streamKind() {
    return StreamKind.BYTES;
  }

  void rename(String name) {
    this.name = Objects.requireNonNull(name);
  }

  void setParent(Container<?> parent) {
    this.parent = parent;
  }

  /// Hands write ownership of this field to a dynamic container that keeps it consistent with its content.
  void manage(Field<?> owner) {
    if (manager != null && manager != owner) {
      throw new IllegalArgumentException("Field '" + name + "' is already maintained by '" + manager.name() + "'");
    }
    this.manager = owner;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + name + "}";
  }
}
