package com.onthegomap.wdosm.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.parse.ElementParser;
import com.onthegomap.wdosm.reader.RawRow;
import com.onthegomap.wdosm.stats.Stats;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReferenceGraphBuilderTest {

  private static ReferenceGraph build(int threads, RawRow... rows) {
    var batch = new ElementParser(threads, Stats.inMemory()).parse(1, List.of(rows));
    return new ReferenceGraphBuilder(batch.knownIds(), threads).build(batch.records(), batch.tokens());
  }

  private static List<String> edges(ReferenceGraph graph) {
    return graph.edges().stream().map(ReferenceEdge::toString).toList();
  }

  @Test
  void testScenarioEdgesCarryContainerIdentifier() {
    ReferenceGraph graph = build(2,
      new RawRow("w", 100L, "Q42 c u0qgbz9dns1 n10 n11"),
      new RawRow("n", 10L, ""),
      new RawRow("n", 11L, "")
    );
    assertEquals(List.of("w100(Q42)->n10", "w100(Q42)->n11"), edges(graph));
    for (ReferenceEdge edge : graph.edges()) {
      assertEquals(42L, edge.containerWdId());
    }
    assertTrue(graph.isContainer(ElementKey.way(100, 1)));
    assertFalse(graph.isContainer(ElementKey.node(10, 1)));
    assertEquals(1, graph.incoming(ElementKey.node(10, 1)).size());
  }

  @Test
  void testContainerWithoutIdentifier() {
    ReferenceGraph graph = build(1,
      new RawRow("r", 1L, "w2"),
      new RawRow("w", 2L, "")
    );
    ReferenceEdge edge = graph.edges().iterator().next();
    assertEquals(null, edge.containerWdId());
    assertEquals(0, edge.containerWdIdOrZero());
  }

  @Test
  void testDuplicateReferencesCollapse() {
    ReferenceGraph graph = build(2,
      new RawRow("w", 100L, "n10 n10 n10"),
      new RawRow("w", 100L, "n10"),
      new RawRow("n", 10L, "")
    );
    assertEquals(List.of("w100->n10"), edges(graph));
  }

  @Test
  void testDanglingReferenceMakesNoEdge() {
    ReferenceGraph graph = build(1,
      new RawRow("w", 100L, "n10 n999"),
      new RawRow("n", 10L, "")
    );
    assertEquals(List.of("w100->n10"), edges(graph));
  }

  @Test
  void testReferencedTypeComesFromRecords() {
    ReferenceGraph graph = build(1,
      new RawRow("r", 1L, "n5 w6 x6"),
      new RawRow("w", 5L, ""),
      new RawRow("n", 6L, ""),
      new RawRow("w", 6L, "")
    );
    // n5 only exists as a way; w6 matches way 6 exactly; x6 falls back to the first key with id 6
    assertEquals(List.of("r1->n6", "r1->w5", "r1->w6"), edges(graph));
  }

  @Test
  void testIdOnlyOnSkippedRowMakesNoEdge() {
    ReferenceGraph graph = build(1,
      new RawRow("w", 1L, "n5"),
      new RawRow("bogus", 5L, "")
    );
    assertEquals(0, graph.size());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 8})
  void testEveryEdgeReferencesKnownId(int threads) {
    List<RawRow> rows = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      rows.add(new RawRow("w", (long) i, "n" + (i * 2) + " n" + (i + 1) + " r" + (i + 1000)));
    }
    var batch = new ElementParser(threads, Stats.inMemory()).parse(1, rows);
    ReferenceGraph graph = new ReferenceGraphBuilder(batch.knownIds(), threads).build(batch.records(), batch.tokens());
    assertFalse(graph.edges().isEmpty());
    for (ReferenceEdge edge : graph.edges()) {
      assertTrue(batch.knownIds().contains(edge.referenced().id()), edge.toString());
      assertTrue(batch.records().containsKey(edge.referenced()), edge.toString());
    }
    ReferenceGraph single = build(1, rows.toArray(RawRow[]::new));
    assertEquals(single.edges(), graph.edges());
  }
}
