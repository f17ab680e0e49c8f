// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

/// Raised when a [MetaField] is accessed before a decode or an explicit bind created its delegate.
public class NotMaterializedException extends IllegalStateException {

  public NotMaterializedException(String message) {
    super(message);
  }
}
