// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

/// A single bit flag that is either active or inactive.
public class FlagField extends BitField {

  public FlagField(@NotNull String name) {
    this(name, false);
  }

  public FlagField(@NotNull String name, boolean value) {
    super(name, 1, value ? 1L : 0L);
  }

  public void activate() {
    setValue(1L);
  }

  public void deactivate() {
    setValue(0L);
  }

  public boolean isActive() {
    return value() == 1L;
  }

  @Override
  public String strValue() {
    return value() == 1L ? "Active" : "Inactive";
  }

  @Override
  public String strEngValue() {
    final Object eng = engValue();
    if (eng instanceof Long l) {
      return l == 1L ? "Active" : "Inactive";
    }
    return String.valueOf(eng);
  }
}
