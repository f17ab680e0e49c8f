// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// A structure whose trailing children are elements made on demand by a [FieldFactory] and named by their index,
/// `"0"`, `"1"` and so on. Leading children, such as the counter of an [Array], are fixed header fields.
///
/// Elements are materialised afresh on every decode. When building a tree for encoding they are either appended
/// directly or created by assigning the next free index:
/// ```
/// array.set("0", 10);
/// array.set("1", 20);
/// array.set("3", 40); // IndexOutOfBoundsException, index 2 does not exist yet
/// ```
public abstract class RepeatedStructure extends Structure {
  private final FieldFactory factory;
  private final int header;

  protected RepeatedStructure(@NotNull String name, @NotNull FieldFactory factory,
                              @NotNull List<? extends Field<?>> header) {
    super(name);
    this.factory = Objects.requireNonNull(factory, "field factory must not be null");
    this.header = header.size();
    header.forEach(field -> {
      checkNesting(field);
      attach(field);
    });
  }

  public FieldFactory factory() {
    return factory;
  }

  /// Number of elements, not counting header fields
  public int count() {
    return length() - header;
  }

  /// @throws IndexOutOfBoundsException if there is no element at that index
  public Field<?> element(int index) {
    Objects.checkIndex(index, count());
    return fields().get(header + index);
  }

  public List<Field<?>> elements() {
    return fields().subList(header, length());
  }

  /// The class of the elements the factory creates, looking through a [MetaField] to the type it would materialise.
  public Class<?> elementType() {
    return factory.type(Context.of(root()));
  }

  /// Appends an element under the next index. If the header cannot take the new element count, as when an
  /// [Array] counter is full, the element is detached again and keeps its own name.
  /// @throws FieldTypeException if the field is not of the element type
  /// @throws SizeExceededException if the new count does not fit the counter
  @Override
  public RepeatedStructure append(@NotNull Field<?> field) {
    Objects.requireNonNull(field, "field must not be null");
    final Class<?> expected = elementType();
    final Class<?> actual = field instanceof MetaField meta ? meta.type() : field.getClass();
    if (!expected.isAssignableFrom(actual)) {
      throw new FieldTypeException("Field '" + field.name() + "' of type " + actual.getSimpleName() +
          " is not of element type " + expected.getSimpleName() + " for '" + name() + "'");
    }
    if (field.parent() != null) {
      throw new IllegalArgumentException("Field '" + field.name() + "' already belongs to '" +
          field.parent().name() + "'");
    }
    checkNesting(field);
    final String originalName = field.name();
    field.rename(String.valueOf(count()));
    attach(field);
    try {
      elementsChanged();
    } catch (RuntimeException e) {
      truncate(length() - 1);
      field.rename(originalName);
      throw e;
    }
    return this;
  }

  /// Assigns through a dotted path whose first segment may be the index one past the last element, in which case
  /// a new element is created from the factory first.
  /// @throws IndexOutOfBoundsException if the index is beyond the next free one
  @Override
  public void set(@NotNull String path, Object value) {
    Objects.requireNonNull(path, "path must not be null");
    final int dot = path.indexOf(FIELD_SEPARATOR);
    final String head = dot < 0 ? path : path.substring(0, dot);
    final int index = parseIndex(head);
    if (index >= 0) {
      if (index > count()) {
        throw new IndexOutOfBoundsException("Index " + index + " is beyond the next element of '" + name() +
            "' (" + count() + " elements)");
      }
      if (index == count()) {
        append(newElement(Context.of(root())));
      }
    }
    super.set(path, value);
  }

  /// Removes every element and gives header fields their empty state.
  @Override
  public void reset() {
    LOGGER.fine(() -> "Resetting '" + name() + "', dropping " + count() + " elements");
    truncate(header);
    elementsChanged();
  }

  /// Replaces the elements with the values of the map's index keys, which must run from zero without gaps. Keys
  /// naming header fields are skipped since those fields follow the elements.
  @Override
  protected void assignValue(Map<String, Object> value) {
    Objects.requireNonNull(value, "value must not be null");
    final Map<Integer, Object> elementValues = new TreeMap<>();
    value.forEach((key, v) -> {
      final int index = parseIndex(String.valueOf(key));
      if (index >= 0) {
        elementValues.put(index, v);
      } else if (fields().stream().limit(header).noneMatch(f -> f.name().equals(String.valueOf(key)))) {
        throw new FieldNotFoundException("Field '" + key + "' does not exist in '" + name() + "'");
      }
    });
    reset();
    elementValues.forEach((index, v) -> set(String.valueOf(index), v));
  }

  /// Called after elements were appended or removed
  protected void elementsChanged() {
  }

  /// Drops the current elements, then creates and decodes `count` new ones from the buffer. Once the first element
  /// shows a fixed width, a count the remaining bytes cannot hold fails before any more elements are created.
  /// @throws StreamLengthMismatchException if the buffer is too short for `count` elements
  protected void decodeElements(ByteBuffer buffer, Context context, int count) {
    truncate(header);
    for (int i = 0; i < count; i++) {
      final Field<?> element = factory.create(context);
      checkNesting(element);
      element.rename(String.valueOf(i));
      attach(element);
      context.decode(element, buffer);
      if (i == 0 && element instanceof Value<?> value) {
        checkRemaining(buffer, count - 1L, value.size());
      }
    }
    LOGGER.fine(() -> "'" + name() + "' materialised " + count + " elements");
  }

  private void checkRemaining(ByteBuffer buffer, long elements, int width) {
    final long needed = elements * width;
    if (needed > buffer.remaining()) {
      throw new StreamLengthMismatchException("'" + name() + "' needs " + needed + " bytes for " + elements +
          " more elements of " + width + " bytes, " + buffer.remaining() + " available");
    }
  }

  private Field<?> newElement(Context context) {
    final Field<?> element = factory.create(context);
    if (element instanceof MetaField meta && !meta.isMaterialized()) {
      meta.materialize(context);
    }
    return element;
  }

  private static int parseIndex(String segment) {
    if (segment.isEmpty() || segment.length() > 9) {
      return -1;
    }
    for (int i = 0; i < segment.length(); i++) {
      final char c = segment.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
    }
    return Integer.parseInt(segment);
  }
}
