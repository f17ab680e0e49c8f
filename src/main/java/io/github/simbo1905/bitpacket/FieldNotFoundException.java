// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import java.util.NoSuchElementException;

/// Raised when a dotted path names a field that does not exist, or that has not been decoded yet.
/// A resolver that refers forward to a field declared after the one being decoded sees this exception.
public class FieldNotFoundException extends NoSuchElementException {

  public FieldNotFoundException(String message) {
    super(message);
  }
}
