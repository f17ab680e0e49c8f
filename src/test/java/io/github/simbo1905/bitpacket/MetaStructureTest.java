// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static io.github.simbo1905.bitpacket.HexBytes.hex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetaStructureTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private static Structure message() {
    return new Structure("message")
        .append(IntegerField.uint8("n"))
        .append(IntegerField.uint8("flags"))
        .append(new MetaStructure("items", LengthResolver.of("n"), context -> IntegerField.uint16("item")));
  }

  @Test
  void countComesFromAnEarlierField() {
    final var message = message();
    message.setBytes(hex("02 FF 0001 0002"));
    assertThat(message.get("items.0")).isEqualTo(1L);
    assertThat(message.get("items.1")).isEqualTo(2L);
    assertThat(((MetaStructure) message.field("items")).count()).isEqualTo(2);
    assertThat(message.bytes()).isEqualTo(hex("02 FF 0001 0002"));
  }

  @Test
  void encodeChecksTheCount() {
    final var message = message();
    message.setBytes(hex("02 FF 0001 0002"));
    message.set("n", 3);
    assertThatThrownBy(message::bytes).isInstanceOf(LengthMismatchException.class);
    message.set("items.2", 3);
    assertThat(message.bytes()).isEqualTo(hex("03 FF 0001 0002 0003"));
  }

  @Test
  void buildForEncoding() {
    final var message = message();
    message.set("n", 1);
    message.set("items.0", 10);
    assertThat(message.bytes()).isEqualTo(hex("01 00 000A"));
  }

  @Test
  void countMustBeDecodedFirst() {
    final var message = new Structure("message")
        .append(new MetaStructure("items", LengthResolver.of("n"), context -> IntegerField.uint16("item")))
        .append(IntegerField.uint8("n"));
    assertThatThrownBy(() -> message.setBytes(hex("0001 01")))
        .isInstanceOf(FieldNotFoundException.class);
  }

  @Test
  void constantCount() {
    final var triple = new MetaStructure("rgb", LengthResolver.constant(3), context -> IntegerField.uint8("c"));
    triple.setBytes(hex("102030"));
    assertThat(triple.keys()).containsExactly("0", "1", "2");
    assertThat(triple.get("2")).isEqualTo(0x30L);
    triple.reset();
    assertThat(triple.count()).isZero();
    assertThatThrownBy(triple::bytes).isInstanceOf(LengthMismatchException.class);
  }

  @Test
  void appendChecksTypeAndIndexes() {
    final var items = new MetaStructure("items", LengthResolver.constant(2), context -> IntegerField.uint16("item"));
    items.append(IntegerField.uint16("a")).append(IntegerField.uint16("b"));
    assertThat(items.element(1).name()).isEqualTo("1");
    assertThatThrownBy(() -> items.append(RealField.float64("d")))
        .isInstanceOf(FieldTypeException.class);
  }

  @Test
  void elementFactoryMaySeeEarlierElements() {
    // each element is one byte wider than the previous one, starting at one byte
    final var items = new MetaStructure("items", LengthResolver.constant(3),
        context -> StringField.fixed("item", ((MetaStructure) context.root()).count() + 1));
    items.setBytes(hex("01 0203 040506"));
    assertThat(items.element(2).size()).isEqualTo(3);
    assertThat(items.element(2).strValue()).isEqualTo("0x040506");
  }

  @Test
  void countAboveIntRangeFails() {
    final var message = new Structure("message")
        .append(IntegerField.uint32("n"))
        .append(new MetaStructure("items", LengthResolver.of("n"), context -> IntegerField.uint16("item")));
    assertThatThrownBy(() -> message.setBytes(hex("FFFFFFFF 0001")))
        .isInstanceOf(StreamLengthMismatchException.class);
  }
}
