// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// A field made of named, ordered child fields. Child order is wire order and names are unique among siblings.
///
/// Children are reached by dotted paths such as `"header.flags.syn"`, which descend through nested containers and
/// through materialised [MetaField]s:
/// ```
/// Structure ip = new Structure("ip")
///     .append(new BitStructure("vh").append(new BitField("version", 4)).append(new BitField("ihl", 4)))
///     .append(IntegerField.uint8("tos"));
/// ip.set("vh.version", 4);
/// long version = (Long) ip.get("vh.version");
/// ```
public abstract class Container<V> extends Field<V> {
  public static final String FIELD_SEPARATOR = ".";

  private final List<Field<?>> fields = new ArrayList<>();
  private final Map<String, Field<?>> fieldsByName = new HashMap<>();

  protected Container(@NotNull String name) {
    super(name);
  }

  /// Appends a child and makes this container its parent.
  /// @throws NameConflictException if a child of the same name already exists
  /// @throws UnsupportedNestingException if the child cannot be carried by this kind of container
  public Container<V> append(@NotNull Field<?> field) {
    Objects.requireNonNull(field, "field must not be null");
    checkNesting(field);
    attach(field);
    return this;
  }

  /// Refuses children this container cannot encode. Structures refuse bit fields, bit structures refuse bytes.
  protected void checkNesting(Field<?> field) {
  }

  final void attach(Field<?> field) {
    if (field.parent() != null) {
      throw new IllegalArgumentException("Field '" + field.name() + "' already belongs to '" +
          field.parent().name() + "'");
    }
    if (fieldsByName.containsKey(field.name())) {
      throw new NameConflictException("Field '" + field.name() + "' already exists in '" + name() + "'");
    }
    fieldsByName.put(field.name(), field);
    fields.add(field);
    field.setParent(this);
  }

  /// Detaches every child from index `from` onwards.
  final void truncate(int from) {
    while (fields.size() > from) {
      final Field<?> removed = fields.remove(fields.size() - 1);
      fieldsByName.remove(removed.name());
      removed.setParent(null);
    }
  }

  /// Looks up a descendant by dotted path.
  /// @throws FieldNotFoundException at the first segment that names no child
  /// @throws NotAContainerException if a segment before the last names a leaf
  public Field<?> field(@NotNull String path) {
    Objects.requireNonNull(path, "path must not be null");
    final int dot = path.indexOf(FIELD_SEPARATOR);
    final String head = dot < 0 ? path : path.substring(0, dot);
    final Field<?> child = fieldsByName.get(head);
    if (child == null) {
      throw new FieldNotFoundException("Field '" + head + "' does not exist in '" + name() + "'");
    }
    if (dot < 0) {
      return child;
    }
    return asContainer(child).field(path.substring(dot + 1));
  }

  /// Resolves a dotted path from any field, which must be a container unless the path is empty.
  static Field<?> lookup(Field<?> origin, String path) {
    return asContainer(origin).field(path);
  }

  private static Container<?> asContainer(Field<?> field) {
    final Field<?> target = field instanceof MetaField meta ? meta.delegate() : field;
    if (target instanceof Container<?> container) {
      return container;
    }
    throw new NotAContainerException("Field '" + field.name() + "' is not a Container");
  }

  public boolean contains(@NotNull String path) {
    try {
      field(path);
      return true;
    } catch (FieldNotFoundException | NotMaterializedException e) {
      return false;
    }
  }

  /// The value of the descendant at the dotted path
  public Object get(@NotNull String path) {
    return field(path).value();
  }

  /// Assigns the value of the descendant at the dotted path. Each nested container handles the rest of the path
  /// itself, so an [Array] along the way can grow by one element.
  public void set(@NotNull String path, Object value) {
    Objects.requireNonNull(path, "path must not be null");
    final int dot = path.indexOf(FIELD_SEPARATOR);
    final String head = dot < 0 ? path : path.substring(0, dot);
    final Field<?> child = fieldsByName.get(head);
    if (child == null) {
      throw new FieldNotFoundException("Field '" + head + "' does not exist in '" + name() + "'");
    }
    if (dot < 0) {
      child.assign(value);
    } else {
      asContainer(child).set(path.substring(dot + 1), value);
    }
  }

  @Override
  public List<Field<?>> fields() {
    return Collections.unmodifiableList(fields);
  }

  public int length() {
    return fields.size();
  }

  /// Dotted paths of every leaf below this container, in wire order
  public List<String> keys() {
    final List<String> keys = new ArrayList<>();
    for (Field<?> field : fields) {
      final Field<?> target = field instanceof MetaField meta && meta.isMaterialized() ? meta.delegate() : field;
      if (target instanceof Container<?> container) {
        container.keys().forEach(key -> keys.add(field.name() + FIELD_SEPARATOR + key));
      } else {
        keys.add(field.name());
      }
    }
    return keys;
  }

  @Override
  public int size() {
    int size = 0;
    for (Field<?> field : fields) {
      size += field.size();
    }
    return size;
  }

  @Override
  public void reset() {
    LOGGER.fine(() -> "Resetting '" + name() + "'");
    fields.forEach(Field::reset);
  }

  /// Child values by name, in wire order. Nested containers contribute nested maps.
  protected Map<String, Object> childValues() {
    final Map<String, Object> values = new LinkedHashMap<>();
    fields.forEach(field -> values.put(field.name(), field.value()));
    return Collections.unmodifiableMap(values);
  }

  protected void assignChildren(Map<?, ?> values) {
    Objects.requireNonNull(values, "values must not be null");
    values.forEach((key, value) -> set(String.valueOf(key), value));
  }

  @SuppressWarnings("unchecked")
  protected Map<String, Object> coerceMap(Object value) {
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    throw new FieldTypeException("Container '" + name() + "' needs a map of child values, got " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  @Override
  public String strValue() {
    return fields.stream()
        .map(field -> field.name() + "=" + field.strValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }

  @Override
  public String strHexValue() {
    return Wire.hex(bytes());
  }

  @Override
  public String strEngValue() {
    return fields.stream()
        .map(field -> field.name() + "=" + field.strEngValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
