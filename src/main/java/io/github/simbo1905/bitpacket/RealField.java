// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

/// IEEE-754 single or double precision number. A single precision field hands back the float widened to a double.
public class RealField extends Value<Double> {

  public RealField(@NotNull String name, @NotNull NumericFormat format) {
    this(name, format, 0.0);
  }

  public RealField(@NotNull String name, @NotNull NumericFormat format, double value) {
    super(name, requireReal(format), value);
  }

  public static RealField float32(String name) {
    return new RealField(name, NumericFormat.FLOAT32);
  }

  public static RealField float64(String name) {
    return new RealField(name, NumericFormat.FLOAT64);
  }

  public static RealField float32le(String name) {
    return new RealField(name, NumericFormat.FLOAT32_LE);
  }

  public static RealField float64le(String name) {
    return new RealField(name, NumericFormat.FLOAT64_LE);
  }

  @Override
  public Double value() {
    return format().decodeDouble(raw());
  }

  @Override
  protected Double coerce(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new FieldTypeException("Real field '" + name() + "' cannot hold " +
        (value == null ? "null" : value.getClass().getSimpleName()));
  }

  private static NumericFormat requireReal(NumericFormat format) {
    if (format.kind() != NumericFormat.Kind.REAL) {
      throw new IllegalArgumentException("Real field needs a real format, got: " + format);
    }
    return format;
  }
}
