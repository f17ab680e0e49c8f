// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/// A placeholder whose concrete field is only known at decode time, chosen by a [FieldFactory] from the fields
/// decoded before it. The classic use is the value of a type-length-value record:
/// ```
/// Structure tlv = new Structure("tlv")
///     .append(IntegerField.uint8("type"))
///     .append(new MetaField("value", ctx -> ctx.getLong("type") == 1
///         ? IntegerField.uint32("value")
///         : StringField.fixed("value", 4)));
/// ```
/// Until it is materialised, by a decode, by [#materialize()] or by [#bind(Field)], a meta field has no size,
/// value or bytes and every such access fails with [NotMaterializedException]. Once materialised it behaves as its
/// delegate, which takes over its name and parent.
public final class MetaField extends Field<Object> {
  private final FieldFactory factory;
  private Field<?> delegate;

  public MetaField(@NotNull String name, @NotNull FieldFactory factory) {
    super(name);
    this.factory = Objects.requireNonNull(factory, "field factory must not be null");
  }

  public FieldFactory factory() {
    return factory;
  }

  public boolean isMaterialized() {
    return delegate != null;
  }

  /// @throws NotMaterializedException if no concrete field has been chosen yet
  public Field<?> delegate() {
    if (delegate == null) {
      throw new NotMaterializedException("MetaField '" + name() + "' is not materialized yet");
    }
    return delegate;
  }

  /// The class of the delegate, or of the field the factory would create against the current tree
  public Class<?> type() {
    return type(Context.of(root()));
  }

  Class<?> type(Context context) {
    return delegate != null ? delegate.getClass() : factory.type(context);
  }

  /// Creates the delegate from the factory against the current tree, so the meta field can be assigned and encoded.
  public Field<?> materialize() {
    return materialize(Context.of(root()));
  }

  Field<?> materialize(Context context) {
    install(factory.create(context));
    return delegate;
  }

  /// Uses the given field as the delegate.
  /// @throws FieldTypeException if the field is not of the type the factory creates
  public void bind(@NotNull Field<?> field) {
    Objects.requireNonNull(field, "field must not be null");
    if (field.parent() != null) {
      throw new IllegalArgumentException("Field '" + field.name() + "' already belongs to '" +
          field.parent().name() + "'");
    }
    final Class<?> expected = factory.type(Context.of(root()));
    if (!expected.isAssignableFrom(field.getClass())) {
      throw new FieldTypeException("Field '" + field.name() + "' of type " + field.getClass().getSimpleName() +
          " does not match " + expected.getSimpleName() + " expected by '" + name() + "'");
    }
    install(field);
  }

  private void install(Field<?> field) {
    if (parent() != null) {
      parent().checkNesting(field);
    }
    if (delegate != null) {
      delegate.setParent(null);
    }
    field.rename(name());
    field.setParent(parent());
    delegate = field;
    LOGGER.fine(() -> "MetaField '" + name() + "' materialized as " + field.getClass().getSimpleName());
  }

  @Override
  public void reset() {
    if (delegate != null) {
      LOGGER.fine(() -> "Resetting MetaField '" + name() + "'");
      delegate.setParent(null);
      delegate = null;
    }
  }

  @Override
  public int size() {
    return delegate().size();
  }

  @Override
  public int bitSize() {
    return delegate().bitSize();
  }

  @Override
  public List<Field<?>> fields() {
    return delegate().fields();
  }

  @Override
  public Object value() {
    return delegate().value();
  }

  @Override
  protected void assignValue(Object value) {
    delegate().assign(value);
  }

  @Override
  protected Object coerce(Object value) {
    return value;
  }

  @Override
  public Object engValue() {
    return delegate().engValue();
  }

  @Override
  public String strValue() {
    return delegate().strValue();
  }

  @Override
  public String strHexValue() {
    return delegate().strHexValue();
  }

  @Override
  public String strEngValue() {
    return delegate().strEngValue();
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    delegate().encode(buffer, context);
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    materialize(context);
    context.decode(delegate, buffer);
  }

  @Override
  protected void encodeBits(BitStreamWriter writer, Context context) {
    delegate().encodeBits(writer, context);
  }

  @Override
  protected void decodeBits(BitStreamReader reader, Context context) {
    materialize(context);
    context.decode(delegate, reader);
  }

  @Override
  StreamKind streamKind() {
    return delegate == null ? StreamKind.ANY : delegate.streamKind();
  }

  @Override
  void rename(String name) {
    super.rename(name);
    if (delegate != null) {
      delegate.rename(name);
    }
  }

  @Override
  void setParent(Container<?> parent) {
    super.setParent(parent);
    if (delegate != null) {
      delegate.setParent(parent);
    }
  }

  @Override
  public String toString() {
    return "MetaField{name=" + name() + ", delegate=" + (delegate == null ? "none" : delegate) + "}";
  }
}
