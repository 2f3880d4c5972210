package com.onthegomap.wdosm.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ElementKeyTest {

  @Test
  void testOrdering() {
    var keys = new TreeSet<>(List.of(
      ElementKey.relation(1, 1),
      ElementKey.node(5, 2),
      ElementKey.way(3, 1),
      ElementKey.node(9, 1),
      ElementKey.way(2, 1)
    ));
    assertEquals(List.of(
      ElementKey.node(9, 1),
      ElementKey.way(2, 1),
      ElementKey.way(3, 1),
      ElementKey.relation(1, 1),
      ElementKey.node(5, 2)
    ), List.copyOf(keys));
  }

  @Test
  void testValidation() {
    assertThrows(IllegalArgumentException.class, () -> new ElementKey(null, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> ElementKey.node(-1, 1));
  }

  @Test
  void testToString() {
    assertEquals("w100", ElementKey.way(100, 3).toString());
  }

  @ParameterizedTest
  @CsvSource({
    "n, NODE",
    "N, NODE",
    "node, NODE",
    "w, WAY",
    "way, WAY",
    "r, RELATION",
    "' relation', RELATION",
  })
  void testParseType(String text, ElementType expected) {
    assertEquals(expected, ElementType.parse(text));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", " ", "x", "area"})
  void testUnknownType(String text) {
    assertNull(ElementType.parse(text));
  }
}
