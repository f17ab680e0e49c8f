// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import java.util.function.Function;

/// Creates one new field from the [Context] of the tree being decoded. Used by [Array] and [MetaStructure] to
/// materialise their elements, and by [MetaField] to pick the concrete field type at decode time.
@FunctionalInterface
public interface FieldFactory extends
    Function<Context, Field<?>> {

  /// Create a fresh, unattached field
  default Field<?> create(Context context) {
    final Field<?> field = apply(context);
    if (field == null) {
      throw new FieldTypeException("Field factory produced no field");
    }
    if (field.parent() != null) {
      throw new FieldTypeException("Field factory must produce a new field but '" + field.name() +
          "' already belongs to '" + field.parent().name() + "'");
    }
    return field;
  }

  /// The concrete class of the fields this factory creates. A [MetaField] is looked through to its delegate type.
  default Class<?> type(Context context) {
    final Field<?> sample = create(context);
    if (sample instanceof MetaField meta) {
      return meta.type(context);
    }
    return sample.getClass();
  }
}
