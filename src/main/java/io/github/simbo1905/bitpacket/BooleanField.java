// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

/// A single bit read as a boolean.
public class BooleanField extends BitField {

  public BooleanField(@NotNull String name) {
    this(name, false);
  }

  public BooleanField(@NotNull String name, boolean value) {
    super(name, 1, value ? 1L : 0L);
  }

  public void enable() {
    setValue(1L);
  }

  public void disable() {
    setValue(0L);
  }

  public boolean isEnabled() {
    return value() == 1L;
  }

  @Override
  public String strValue() {
    return value() == 1L ? "True" : "False";
  }

  @Override
  public String strEngValue() {
    final Object eng = engValue();
    if (eng instanceof Long l) {
      return l == 1L ? "True" : "False";
    }
    return String.valueOf(eng);
  }
}
