// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a field is appended to a container that already holds a child of the same name.
public class NameConflictException extends IllegalArgumentException {

  public NameConflictException(String message) {
    super(message);
  }
}
