// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Unsigned big-endian integer of 8, 16, 32 or 64 bits carrying a set of named masks, such as a status register.
/// Each mask gets a read only one bit view, a [MaskField] unless another view factory is given, which follows the
/// register value after every assignment and decode. The views are listed by [#fields()] in mask value order.
public class MaskValue extends IntegerField {
  private final Map<String, Long> masks = new LinkedHashMap<>();
  private final Map<String, BitField> views = new LinkedHashMap<>();

  public MaskValue(@NotNull String name, @NotNull NumericFormat format, @NotNull Map<String, Long> masks,
                   @NotNull Function<String, ? extends BitField> viewFactory) {
    super(name, requireUnsigned(format));
    Objects.requireNonNull(viewFactory);
    masks.entrySet().stream()
        .sorted((a, b) -> Long.compareUnsigned(a.getValue(), b.getValue()))
        .forEach(entry -> {
          final long mask = entry.getValue();
          if (mask == 0 || (format.width() < Long.BYTES && (mask >>> format.bits()) != 0)) {
            throw new IllegalArgumentException("Mask '" + entry.getKey() + "' 0x" + Long.toHexString(mask) +
                " is empty or wider than " + format.bits() + " bits");
          }
          final BitField view = Objects.requireNonNull(viewFactory.apply(entry.getKey()));
          if (view.size() != 1) {
            throw new IllegalArgumentException("Mask view '" + view.name() + "' must be a single bit");
          }
          view.manage(this);
          this.masks.put(entry.getKey(), mask);
          this.views.put(entry.getKey(), view);
        });
    updateMasks();
  }

  public static MaskValue mask8(String name, Map<String, Long> masks) {
    return new MaskValue(name, NumericFormat.UINT8, masks, MaskField::new);
  }

  public static MaskValue mask16(String name, Map<String, Long> masks) {
    return new MaskValue(name, NumericFormat.UINT16, masks, MaskField::new);
  }

  public static MaskValue mask32(String name, Map<String, Long> masks) {
    return new MaskValue(name, NumericFormat.UINT32, masks, MaskField::new);
  }

  public static MaskValue mask64(String name, Map<String, Long> masks) {
    return new MaskValue(name, NumericFormat.UINT64, masks, MaskField::new);
  }

  /// Sets the given bits
  public void mask(long bits) {
    setValue(value() | bits);
  }

  /// Clears the given bits
  public void unmask(long bits) {
    setValue(value() & ~bits);
  }

  /// @throws FieldNotFoundException if no mask has that name
  public boolean isMasked(String maskName) {
    final Long mask = masks.get(maskName);
    if (mask == null) {
      throw new FieldNotFoundException("Mask '" + maskName + "' does not exist in '" + name() + "'");
    }
    return (value() & mask) != 0;
  }

  public Map<String, Long> masks() {
    return Map.copyOf(masks);
  }

  @Override
  public List<Field<?>> fields() {
    return List.copyOf(views.values());
  }

  @Override
  protected void assignValue(Long value) {
    super.assignValue(value);
    updateMasks();
  }

  @Override
  protected void decode(ByteBuffer buffer, Context context) {
    super.decode(buffer, context);
    updateMasks();
  }

  @Override
  public String strValue() {
    return strHexValue();
  }

  @Override
  public String strEngValue() {
    return strHexValue();
  }

  private void updateMasks() {
    final long value = value();
    masks.forEach((name, mask) -> views.get(name).assignValue((value & mask) != 0 ? 1L : 0L));
  }

  private static NumericFormat requireUnsigned(NumericFormat format) {
    if (format.signed() || format.order() != ByteOrder.BIG_ENDIAN) {
      throw new IllegalArgumentException("Mask values must be unsigned big-endian, got: " + format);
    }
    return format;
  }
}
