// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a byte run does not have the length its resolver currently dictates.
public class LengthMismatchException extends IllegalArgumentException {

  public LengthMismatchException(String message) {
    super(message);
  }
}
