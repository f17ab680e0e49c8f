// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/// Repeats an element a number of times that is resolved from the [Context], usually from a count field decoded
/// earlier somewhere else in the tree:
/// ```
/// Structure message = new Structure("message")
///     .append(IntegerField.uint8("n"))
///     .append(IntegerField.uint16("checksum"))
///     .append(new MetaStructure("items", LengthResolver.of("n"), ctx -> IntegerField.uint16("item")));
/// ```
public class MetaStructure extends RepeatedStructure {
  private final LengthResolver count;

  public MetaStructure(@NotNull String name, @NotNull LengthResolver count, @NotNull FieldFactory factory) {
    super(name, factory, List.of());
    this.count = Objects.requireNonNull(count, "count resolver must not be null");
  }

  public LengthResolver countResolver() {
    return count;
  }

  @Override
  public MetaStructure append(@NotNull Field<?> field) {
    super.append(field);
    return this;
  }

  /// @throws LengthMismatchException if the number of elements differs from the resolved count
  @Override
  protected void encode(ByteBuffer buffer, Context context) {
    final int expected = count.resolve(context);
    if (count() != expected) {
      throw new LengthMismatchException("MetaStructure '" + name() + "' holds " + count() + " elements but " +
          expected + " are expected");
    }
    super.encode(buffer, context);
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    final int start = buffer.position();
    decodeElements(buffer, context, count.resolve(context));
    LOGGER.fine(() -> "MetaStructure '" + name() + "' read " + count() + " elements in " +
        (buffer.position() - start) + " bytes");
  }
}
