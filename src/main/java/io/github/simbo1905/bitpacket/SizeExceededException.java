// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a value does not fit in the bit or byte width of its field.
public class SizeExceededException extends IllegalArgumentException {

  public SizeExceededException(String message) {
    super(message);
  }

  public SizeExceededException(String message, Throwable cause) {
    super(message, cause);
  }
}
