// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;

import java.nio.ByteBuffer;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Encoding then decoding through a fresh copy of the same layout gives back the same values and the same bytes.
class RoundTripPropertyTest {

  @Property
  void signed64(@ForAll long value) {
    final var field = IntegerField.int64("v");
    field.setValue(value);
    final var copy = IntegerField.int64("v");
    copy.setBytes(field.bytes());
    assertThat(copy.value()).isEqualTo(value);
  }

  @Property
  void unsigned32LittleEndian(@ForAll @LongRange(min = 0, max = 0xFFFFFFFFL) long value) {
    final var field = IntegerField.uint32le("v");
    field.setValue(value);
    final byte[] bytes = field.bytes();
    assertThat(bytes).hasSize(4);
    assertThat(bytes[0] & 0xFF).isEqualTo((int) (value & 0xFF));
    final var copy = IntegerField.uint32le("v");
    copy.setBytes(bytes);
    assertThat(copy.value()).isEqualTo(value);
  }

  @Property
  void realsKeepTheirBits(@ForAll double value) {
    final var field = RealField.float64("d");
    field.setValue(value);
    final var copy = RealField.float64("d");
    copy.setBytes(field.bytes());
    assertThat(Double.doubleToRawLongBits(copy.value())).isEqualTo(Double.doubleToRawLongBits(value));
  }

  @Property
  void bitStructureSizeAndValues(@ForAll @IntRange(min = 1, max = 64) int width,
                                 @ForAll @IntRange(min = 0, max = 7) int flag,
                                 @ForAll long raw) {
    final long value = width == 64 ? raw : raw & ((1L << width) - 1);
    final var bits = layout(width);
    bits.set("flag", flag);
    bits.set("value", value);
    assertThat(bits.bitSize()).isEqualTo(3 + width);
    assertThat(bits.size()).isEqualTo((3 + width + 7) / 8);

    final var copy = layout(width);
    copy.setBytes(bits.bytes());
    assertThat(copy.get("flag")).isEqualTo((long) flag);
    assertThat(copy.get("value")).isEqualTo(value);
  }

  @Property
  void lengthPrefixedStrings(@ForAll @Size(max = 255) List<Byte> content) {
    final byte[] data = new byte[content.size()];
    for (int i = 0; i < data.length; i++) {
      data[i] = content.get(i);
    }
    final var structure = lengthPrefixed();
    structure.set("len", data.length);
    structure.set("text", data);
    final byte[] encoded = structure.bytes();
    assertThat(encoded).hasSize(1 + data.length);
    assertThat(structure.size()).isEqualTo(encoded.length);

    final var copy = lengthPrefixed();
    final ByteBuffer buffer = ByteBuffer.wrap(encoded);
    copy.decode(buffer);
    assertThat(buffer.hasRemaining()).isFalse();
    assertThat(copy.get("text")).isEqualTo(data);
  }

  @Property
  void arraysCountTheirElements(@ForAll @Size(max = 20) List<@IntRange(min = 0, max = 65535) Integer> values) {
    final var array = new Array("a", IntegerField.uint8("n"), context -> IntegerField.uint16("v"));
    for (int i = 0; i < values.size(); i++) {
      array.set(String.valueOf(i), values.get(i));
    }
    assertThat(array.counter().value()).isEqualTo((long) values.size());
    final var copy = new Array("a", IntegerField.uint8("n"), context -> IntegerField.uint16("v"));
    copy.setBytes(array.bytes());
    assertThat(copy.count()).isEqualTo(values.size());
    assertThat(copy.bytes()).isEqualTo(array.bytes());
  }

  private static BitStructure layout(int width) {
    return new BitStructure("bits", PaddingMode.STRICT)
        .append(new BitField("flag", 3))
        .append(new BitField("value", width));
  }

  private static Structure lengthPrefixed() {
    return new Structure("s")
        .append(IntegerField.uint8("len"))
        .append(StringField.sizedBy("text", "len"));
  }
}
