// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// The streams a field can be encoded on. Containers use this to refuse children they cannot carry.
enum StreamKind {
  /// Byte aligned fields that only work on the buffer itself.
  BYTES,
  /// Sub-byte fields that only work inside a [BitStructure].
  BITS,
  /// Fields that work on either, such as a [BitStructure] or a [MetaField] not yet materialised.
  ANY
}
