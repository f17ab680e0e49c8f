// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

/// A single bit telling whether something is masked. [MaskValue] exposes one per named mask.
public class MaskField extends BitField {

  public MaskField(@NotNull String name) {
    this(name, false);
  }

  public MaskField(@NotNull String name, boolean value) {
    super(name, 1, value ? 1L : 0L);
  }

  public void mask() {
    setValue(1L);
  }

  public void unmask() {
    setValue(0L);
  }

  public boolean isMasked() {
    return value() == 1L;
  }

  @Override
  public String strValue() {
    return value() == 1L ? "Masked" : "Unmasked";
  }

  @Override
  public String strEngValue() {
    final Object eng = engValue();
    if (eng instanceof Long l) {
      return l == 1L ? "Masked" : "Unmasked";
    }
    return String.valueOf(eng);
  }
}
