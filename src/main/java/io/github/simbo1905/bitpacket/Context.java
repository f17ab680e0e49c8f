// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.bitpacket.Field.LOGGER;

/// The handle every [LengthResolver] and [FieldFactory] receives. It exposes the root of the tree being encoded or
/// decoded so a field may depend on any field decoded before it, including siblings of its ancestors.
///
/// While decoding, fields inside the subtree being decoded only become visible once they have been decoded. A
/// resolver that refers to a field declared later therefore fails with [FieldNotFoundException] rather than
/// silently reading a stale value.
public final class Context {
  private final Field<?> root;
  private final Field<?> target;
  private final Set<Field<?>> decoded;

  private Context(Field<?> root, Field<?> target) {
    this.root = Objects.requireNonNull(root);
    this.target = target;
    this.decoded = target == null ? Set.of() : Collections.newSetFromMap(new IdentityHashMap<>());
  }

  /// An unrestricted context over the given root, for resolvers evaluated outside of a decode and for testing
  /// resolvers in isolation.
  public static Context of(@NotNull Field<?> root) {
    return new Context(root, null);
  }

  static Context encoding(Field<?> root) {
    return new Context(root, null);
  }

  static Context decoding(Field<?> root, Field<?> target) {
    return new Context(root, Objects.requireNonNull(target));
  }

  public Field<?> root() {
    return root;
  }

  public boolean isDecoding() {
    return target != null;
  }

  /// Looks up a field by dotted path from the root.
  /// @throws FieldNotFoundException if a segment is missing or the field has not been decoded yet
  /// @throws NotAContainerException if a non-terminal segment names a leaf
  public Field<?> field(@NotNull String path) {
    Objects.requireNonNull(path);
    final Field<?> field = Container.lookup(root, path);
    if (target != null && !decoded.contains(field) && isWithin(field, target)) {
      throw new FieldNotFoundException("Field '" + path + "' does not exist yet: it is decoded after the field " +
          "that refers to it");
    }
    return field;
  }

  public Object get(@NotNull String path) {
    return field(path).value();
  }

  /// The value of a numeric field as a long.
  /// @throws FieldTypeException if the field value is not a number
  public long getLong(@NotNull String path) {
    final Object value = get(path);
    if (value instanceof Number number) {
      return number.longValue();
    }
    throw new FieldTypeException("Field '" + path + "' is not numeric: " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  void decode(Field<?> field, ByteBuffer buffer) {
    field.decode(buffer, this);
    markDecoded(field);
  }

  void decode(Field<?> field, BitStreamReader reader) {
    field.decodeBits(reader, this);
    markDecoded(field);
  }

  void markDecoded(Field<?> field) {
    if (target != null) {
      decoded.add(field);
      LOGGER.finer(() -> "Decoded '" + field.name() + "'");
    }
  }

  private static boolean isWithin(Field<?> field, Field<?> ancestor) {
    for (Field<?> f = field; f != null; f = f.parent()) {
      if (f == ancestor) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Context{root=" + root.name() + ", decoding=" + isDecoding() + "}";
  }
}
