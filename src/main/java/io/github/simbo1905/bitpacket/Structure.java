// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Map;

/// Byte aligned container. Children are written and read one after the other in the order they were appended, over
/// the same buffer cursor. Bit fields must be grouped into a [BitStructure] first.
public class Structure extends Container<Map<String, Object>> {

  public Structure(@NotNull String name) {
    super(name);
  }

  @Override
  public Structure append(@NotNull Field<?> field) {
    super.append(field);
    return this;
  }

  @Override
  protected void checkNesting(Field<?> field) {
    if (field.streamKind() == StreamKind.BITS) {
      throw new UnsupportedNestingException("Cannot append bit field '" + field.name() + "' to structure '" +
          name() + "' (hint: enclose it in a BitStructure)");
    }
  }

  /// Child values by name in wire order
  @Override
  public Map<String, Object> value() {
    return childValues();
  }

  @Override
  protected void assignValue(Map<String, Object> value) {
    assignChildren(value);
  }

  @Override
  protected Map<String, Object> coerce(Object value) {
    return coerceMap(value);
  }

  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    final int start = buffer.position();
    for (Field<?> field : fields()) {
      field.encode(buffer, context);
    }
    LOGGER.fine(() -> "Structure '" + name() + "' wrote " + (buffer.position() - start) + " bytes");
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    final int start = buffer.position();
    for (Field<?> field : fields()) {
      context.decode(field, buffer);
    }
    LOGGER.fine(() -> "Structure '" + name() + "' read " + (buffer.position() - start) + " bytes");
  }
}
