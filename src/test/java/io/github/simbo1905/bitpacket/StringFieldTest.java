// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static io.github.simbo1905.bitpacket.HexBytes.hex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringFieldTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private static Structure lengthPrefixed() {
    return new Structure("s")
        .append(IntegerField.uint8("len"))
        .append(StringField.sizedBy("text", "len"));
  }

  @Test
  @DisplayName("[03 41 42 43] decodes to the three bytes ABC")
  void lengthPrefixedDecode() {
    final var structure = lengthPrefixed();
    structure.setBytes(hex("03 414243"));
    final var text = (StringField) structure.field("text");
    assertThat(text.value()).isEqualTo("ABC".getBytes(StandardCharsets.US_ASCII));
    assertThat(text.text()).isEqualTo("ABC");
    assertThat(text.size()).isEqualTo(3);
    assertThat(text.strValue()).isEqualTo("0x414243");
    assertThat(structure.size()).isEqualTo(4);
    assertThat(structure.bytes()).isEqualTo(hex("03 414243"));
  }

  @Test
  void shortStreamFails() {
    assertThatThrownBy(() -> lengthPrefixed().setBytes(hex("05 41")))
        .isInstanceOf(StreamLengthMismatchException.class);
  }

  @Test
  @DisplayName("A resolver may not refer to a field that is decoded after it")
  void forwardReferenceFails() {
    final var structure = new Structure("s")
        .append(StringField.sizedBy("text", "len"))
        .append(IntegerField.uint8("len"));
    assertThatThrownBy(() -> structure.setBytes(hex("03 414243")))
        .isInstanceOf(FieldNotFoundException.class)
        .hasMessageContaining("len");
  }

  @Test
  void resolverMayReadOutsideTheDecodedSubtree() {
    final var outer = new Structure("outer")
        .append(IntegerField.uint8("len"))
        .append(new Structure("inner").append(StringField.sizedBy("text", "len")));
    outer.set("len", 2);
    final var inner = (Structure) outer.field("inner");
    inner.setBytes(hex("4142"));
    assertThat(((StringField) outer.field("inner.text")).text()).isEqualTo("AB");
  }

  @Test
  void assignmentMustMatchTheResolvedLength() {
    final var structure = lengthPrefixed();
    structure.set("len", 3);
    structure.set("text", "ABC");
    assertThat(structure.bytes()).isEqualTo(hex("03 414243"));
    assertThatThrownBy(() -> structure.set("text", "ABCD"))
        .isInstanceOf(LengthMismatchException.class);
  }

  @Test
  void encodeFailsWhenTheLengthFieldDisagrees() {
    final var structure = lengthPrefixed();
    structure.set("len", 3);
    structure.set("text", "ABC");
    structure.set("len", 2);
    assertThatThrownBy(structure::bytes).isInstanceOf(StreamLengthMismatchException.class);
  }

  @Test
  void fixedLengthStrings() {
    final var fixed = StringField.fixed("magic", 4);
    assertThat(fixed.size()).isEqualTo(4);
    assertThat(fixed.bytes()).isEqualTo(hex("00000000"));
    fixed.setValue(hex("CAFEBABE"));
    assertThat(fixed.strHexValue()).isEqualTo("0xCAFEBABE");
    assertThat(fixed.lengthResolver()).isEqualTo(LengthResolver.constant(4));

    final var literal = new StringField("literal", "PK".getBytes(StandardCharsets.US_ASCII));
    assertThat(literal.bytes()).isEqualTo(hex("504B"));
    assertThat(StringField.fixed("empty", 0).strValue()).isEmpty();
  }

  @Test
  void resolverCanBeAnyFunctionOfTheContext() {
    final var structure = new Structure("s")
        .append(IntegerField.uint8("words"))
        .append(new StringField("text", context -> (int) context.getLong("words") * 2));
    structure.setBytes(hex("02 01020304"));
    assertThat(structure.field("text").size()).isEqualTo(4);
    assertThatThrownBy(() -> LengthResolver.constant(-1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("A uint32 length of FFFFFFFF is out of range rather than an overflow")
  void lengthAboveIntRangeFails() {
    final var structure = new Structure("s")
        .append(IntegerField.uint32("len"))
        .append(StringField.sizedBy("text", "len"));
    assertThatThrownBy(() -> structure.setBytes(hex("FFFFFFFF 41")))
        .isInstanceOf(StreamLengthMismatchException.class)
        .hasMessageContaining("4294967295");
  }

  @Test
  void uint64LengthWithTheTopBitSetFails() {
    final var structure = new Structure("s")
        .append(IntegerField.uint64("len"))
        .append(StringField.sizedBy("text", "len"));
    assertThatThrownBy(() -> structure.setBytes(hex("8000000000000000 41")))
        .isInstanceOf(StreamLengthMismatchException.class);
  }

  @Test
  void negativeResolvedLengthFails() {
    final var structure = new Structure("s")
        .append(IntegerField.int8("len"))
        .append(StringField.sizedBy("text", "len"));
    assertThatThrownBy(() -> structure.setBytes(hex("FF 41")))
        .isInstanceOf(StreamLengthMismatchException.class);
  }
}
