// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a byte oriented field is placed on a bit stream, or a bit field on a byte stream.
public class UnsupportedNestingException extends UnsupportedOperationException {

  public UnsupportedNestingException(String message) {
    super(message);
  }
}
