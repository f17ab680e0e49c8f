// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import java.util.function.ToIntFunction;

/// Resolves a byte length or an element count from the [Context] of the tree being encoded or decoded.
/// Either a literal, see [#constant(int)], or any unary function of the context.
@FunctionalInterface
public interface LengthResolver extends
    ToIntFunction<Context> {

  /// Resolve the length against the given context
  /// @throws StreamLengthMismatchException if the resolved length is negative
  default int resolve(Context context) {
    return Wire.checkedLength(applyAsInt(context), "Resolved length");
  }

  static LengthResolver constant(int length) {
    return new Fixed(length);
  }

  /// The value of the numeric field at the given dotted path, which must be decoded before the field using it.
  /// Values beyond `Integer.MAX_VALUE` fail with [StreamLengthMismatchException].
  static LengthResolver of(String path) {
    return context -> Wire.checkedLength(context.getLong(path), "Length '" + path + "'");
  }

  /// A length known when the layout is defined
  record Fixed(int length) implements LengthResolver {
    public Fixed {
      if (length < 0) {
        throw new IllegalArgumentException("Fixed length must be >= 0, got " + length);
      }
    }

    @Override
    public int applyAsInt(Context context) {
      return length;
    }
  }
}
