// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a field, or a value assigned to it, is not of the expected concrete type.
public class FieldTypeException extends IllegalArgumentException {

  public FieldTypeException(String message) {
    super(message);
  }
}
