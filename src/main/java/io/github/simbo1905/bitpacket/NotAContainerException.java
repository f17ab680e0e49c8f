// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a non-terminal segment of a dotted path names a leaf field.
public class NotAContainerException extends FieldNotFoundException {

  public NotAContainerException(String message) {
    super(message);
  }
}
