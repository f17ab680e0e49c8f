// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when fewer bytes remain in the stream than a field declares, or when the bytes
/// written for a field disagree with its resolved length.
public class StreamLengthMismatchException extends IllegalStateException {

  public StreamLengthMismatchException(String message) {
    super(message);
  }
}
