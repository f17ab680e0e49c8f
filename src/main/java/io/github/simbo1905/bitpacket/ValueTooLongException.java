// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when [Data] content is too long for the declared width of its length field.
public class ValueTooLongException extends SizeExceededException {

  public ValueTooLongException(String message) {
    super(message);
  }

  public ValueTooLongException(String message, Throwable cause) {
    super(message, cause);
  }
}
