// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitpacket;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.simbo1905.bitpacket.HexBytes.hex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainerTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private static Structure message() {
    return new Structure("message")
        .append(IntegerField.uint8("kind"))
        .append(new Structure("header")
            .append(IntegerField.uint16("id"))
            .append(new BitStructure("flags")
                .append(new BitField("priority", 3))
                .append(new BitField("reserved", 5))))
        .append(IntegerField.int32("payload"));
  }

  @Test
  void duplicateNamesAreRejected() {
    final var structure = new Structure("s").append(IntegerField.uint8("a"));
    assertThatThrownBy(() -> structure.append(IntegerField.uint16("a")))
        .isInstanceOf(NameConflictException.class)
        .hasMessageContaining("'a'");
    assertThat(structure.length()).isEqualTo(1);
  }

  @Test
  void fieldCannotHaveTwoParents() {
    final var shared = IntegerField.uint8("a");
    new Structure("first").append(shared);
    assertThatThrownBy(() -> new Structure("second").append(shared))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void dottedPathsDescend() {
    final var message = message();
    message.set("header.id", 0x0102);
    message.set("header.flags.priority", 5);
    assertThat(message.get("header.id")).isEqualTo(0x0102L);
    assertThat(message.field("header.flags.priority").parent().name()).isEqualTo("flags");
    assertThat(message.field("header.flags.priority").root()).isSameAs(message);
    assertThat(message.contains("header.flags.reserved")).isTrue();
    assertThat(message.contains("header.flags.missing")).isFalse();
  }

  @Test
  void missingSegmentsAndLeavesFailLookup() {
    final var message = message();
    assertThatThrownBy(() -> message.field("trailer"))
        .isInstanceOf(FieldNotFoundException.class);
    assertThatThrownBy(() -> message.field("header.missing.id"))
        .isInstanceOf(FieldNotFoundException.class)
        .hasMessageContaining("'missing'");
    assertThatThrownBy(() -> message.field("kind.low"))
        .isInstanceOf(NotAContainerException.class);
    assertThatThrownBy(() -> message.set("payload.x", 1))
        .isInstanceOf(NotAContainerException.class);
    assertThatThrownBy(() -> Context.of(IntegerField.uint8("leaf")).get("x"))
        .isInstanceOf(NotAContainerException.class);
  }

  @Test
  void keysFlattenLeavesInWireOrder() {
    assertThat(message().keys()).containsExactly(
        "kind", "header.id", "header.flags.priority", "header.flags.reserved", "payload");
  }

  @Test
  void sizeIsTheSumOfChildren() {
    final var message = message();
    assertThat(message.size()).isEqualTo(1 + 2 + 1 + 4);
    assertThat(message.bytes()).hasSize(8);
    assertThat(message.fields()).hasSize(3);
    assertThatThrownBy(() -> message.fields().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void valueIsAnOrderedMapOfChildValues() {
    final var message = message();
    message.setBytes(hex("07 0102 A0 FFFFFFFF"));
    final Map<String, Object> value = message.value();
    assertThat(value.keySet()).containsExactly("kind", "header", "payload");
    assertThat(value.get("kind")).isEqualTo(7L);
    assertThat(value.get("payload")).isEqualTo(-1L);
    @SuppressWarnings("unchecked") final var header = (Map<String, Object>) value.get("header");
    assertThat(header.get("id")).isEqualTo(0x0102L);
    assertThat(((Map<?, ?>) header.get("flags")).get("priority")).isEqualTo(5L);
  }

  @Test
  void setValueAssignsByName() {
    final var message = message();
    final Map<String, Object> header = new LinkedHashMap<>();
    header.put("id", 9);
    header.put("flags", Map.of("priority", 1));
    message.setValue(Map.of("kind", 2, "header", header));
    assertThat(message.bytes()).isEqualTo(hex("02 0009 20 00000000"));
    assertThatThrownBy(() -> message.assign(42)).isInstanceOf(FieldTypeException.class);
    assertThatThrownBy(() -> message.setValue(Map.of("nope", 1))).isInstanceOf(FieldNotFoundException.class);
  }

  @Test
  void resolverContextReadsFromTheRoot() {
    final var message = message();
    message.set("kind", 3);
    final var context = Context.of(message.field("header.id").root());
    assertThat(context.root()).isSameAs(message);
    assertThat(context.getLong("kind")).isEqualTo(3L);
    assertThat(context.getLong("header.id")).isZero();
    assertThat(context.isDecoding()).isFalse();
    assertThatThrownBy(() -> Context.of(message).getLong("header"))
        .isInstanceOf(FieldTypeException.class);
  }

  @Test
  void stringRenderings() {
    final var structure = new Structure("s")
        .append(IntegerField.uint8("a"))
        .append(IntegerField.uint16("b"));
    structure.set("a", 1);
    structure.set("b", 0xABCD);
    assertThat(structure.strValue()).isEqualTo("{a=1, b=43981}");
    assertThat(structure.strHexValue()).isEqualTo("0x01ABCD");
  }
}
