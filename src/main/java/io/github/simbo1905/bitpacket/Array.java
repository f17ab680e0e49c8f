// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/// A counter followed by that many elements. The counter is the first child, it is written and read like any other
/// field, and the array keeps it equal to the number of elements: it cannot be assigned directly.
/// ```
/// Array values = new Array("values", IntegerField.uint8("count"), ctx -> IntegerField.uint32("value"));
/// values.setBytes(new byte[]{2, 0, 0, 0, 10, 0, 0, 0, 20});
/// values.get("1"); // 20L
/// ```
public class Array extends RepeatedStructure {
  private final Field<Long> counter;

  public Array(@NotNull String name, @NotNull Field<Long> counter, @NotNull FieldFactory factory) {
    super(name, factory, List.of(Objects.requireNonNull(counter, "counter must not be null")));
    this.counter = counter;
    counter.manage(this);
    counter.assignValue(0L);
  }

  public Field<Long> counter() {
    return counter;
  }

  @Override
  public Array append(@NotNull Field<?> field) {
    super.append(field);
    return this;
  }

  @Override
  protected void elementsChanged() {
    counter.assignValue((long) count());
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    final int start = buffer.position();
    truncate(1);
    context.decode(counter, buffer);
    final int count = Wire.checkedLength(counter.value(), "Counter of Array '" + name() + "'");
    decodeElements(buffer, context, count);
    LOGGER.fine(() -> "Array '" + name() + "' read " + count + " elements in " + (buffer.position() - start) +
        " bytes");
  }
}
