// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import java.util.Arrays;

/// What a [BitStructure] does with the bits left over in its last byte when decoding. Set via system property
/// `bitpacket.BitStructure.Padding`. The default is LENIENT.
///
/// Encoding always writes zero padding, whatever the mode.
public enum PaddingMode {
  /// Non-zero padding is logged as a warning and dropped, so it is re-encoded as zero.
  LENIENT,

  /// Non-zero padding fails the decode with an [IllegalStateException].
  STRICT;

  public static final String PROPERTY = "bitpacket.BitStructure.Padding";

  public static PaddingMode current() {
    final String mode = System.getProperty(PROPERTY, "LENIENT").toUpperCase();
    try {
      return PaddingMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid padding mode: " + mode + ". Must be one of: " +
          Arrays.toString(PaddingMode.values()));
    }
  }
}
