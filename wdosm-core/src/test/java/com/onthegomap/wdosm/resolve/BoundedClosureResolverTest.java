package com.onthegomap.wdosm.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.graph.ReferenceEdge;
import com.onthegomap.wdosm.graph.ReferenceGraph;
import com.onthegomap.wdosm.stats.Stats;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BoundedClosureResolverTest {

  private static final ElementKey R1 = ElementKey.relation(1, 1);
  private static final ElementKey W100 = ElementKey.way(100, 1);
  private static final ElementKey N10 = ElementKey.node(10, 1);

  private final Stats stats = Stats.inMemory();

  private BoundedClosureResolver resolver(int maxDepth, ReferenceEdge... edges) {
    return new BoundedClosureResolver(ReferenceGraph.of(List.of(edges)), maxDepth, 2, stats);
  }

  private static ClosureResult aggregate(List<Candidate> candidates) {
    return IdentifierAggregator.aggregate(candidates);
  }

  @Test
  void testSingleContainer() {
    var resolver = resolver(5, new ReferenceEdge(W100, 42L, N10));
    ClosureResult result = aggregate(resolver.candidates(N10));
    assertEquals(Map.of(42L, 1), result.memberCounts());
    assertTrue(result.witnesses().isEmpty());
  }

  @Test
  void testElementWithoutContainersGetsNothing() {
    var resolver = resolver(5, new ReferenceEdge(W100, 42L, N10));
    assertTrue(resolver.candidates(W100).isEmpty());
    assertTrue(resolver.resolveAll(List.of(W100, R1)).isEmpty());
  }

  @Test
  void testClimbsContainersOfContainers() {
    var resolver = resolver(5,
      new ReferenceEdge(R1, 7L, W100),
      new ReferenceEdge(W100, null, N10)
    );
    var all = resolver.resolveAll(List.of(N10, W100));

    // the path through way 100 to relation 1 repeats the way 100 pair
    ClosureResult node = aggregate(all.get(N10));
    assertEquals(Map.of(0L, 2, 7L, 1), node.memberCounts());
    assertEquals(List.of(W100), node.witnesses());

    ClosureResult way = aggregate(all.get(W100));
    assertEquals(Map.of(7L, 1), way.memberCounts());
    assertTrue(way.witnesses().isEmpty());
  }

  @Test
  void testDepthBoundTruncatesPaths() {
    ReferenceEdge[] chain = {
      new ReferenceEdge(R1, 7L, W100),
      new ReferenceEdge(W100, null, N10)
    };
    assertEquals(Map.of(0L, 1), aggregate(resolver(2, chain).candidates(N10)).memberCounts());
    assertEquals(1, stats.get("closure_paths_truncated"));
    assertTrue(resolver(1, chain).resolveAll(List.of(N10, W100)).isEmpty());
  }

  @Test
  void testRejectsDepthBelowOne() {
    var graph = ReferenceGraph.empty();
    assertThrows(IllegalArgumentException.class, () -> new BoundedClosureResolver(graph, 0, 1, stats));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 5, 8})
  void testNoPathLongerThanDepth(int maxDepth) {
    List<ReferenceEdge> edges = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      edges.add(new ReferenceEdge(ElementKey.way(i + 1, 1), (long) i, ElementKey.way(i, 1)));
    }
    var resolver = new BoundedClosureResolver(ReferenceGraph.of(edges), maxDepth, 3, stats);
    List<Candidate> candidates = resolver.candidates(ElementKey.way(0, 1));
    // a chain has one path per length, path k holding k - 1 pairs
    int pathsKept = Math.min(maxDepth, 11) - 1;
    assertEquals(pathsKept * (pathsKept + 1) / 2, candidates.size());
    for (Candidate candidate : candidates) {
      assertTrue(candidate.contributor().id() <= maxDepth - 1, candidate.toString());
    }
  }

  @Test
  @Timeout(10)
  void testSelfLoopSkipped() {
    ElementKey w5 = ElementKey.way(5, 1);
    ElementKey n1 = ElementKey.node(1, 1);
    var resolver = resolver(5,
      new ReferenceEdge(w5, null, w5),
      new ReferenceEdge(w5, null, n1)
    );
    var all = resolver.resolveAll(List.of(w5, n1));
    assertEquals(List.of(new Candidate(0, w5)), all.get(n1));
    assertFalse(all.containsKey(w5));
  }

  @Test
  @Timeout(10)
  void testLongerCyclesOnlyStoppedByDepth() {
    ElementKey w1 = ElementKey.way(1, 1);
    ElementKey w2 = ElementKey.way(2, 1);
    var resolver = resolver(5,
      new ReferenceEdge(w1, null, w2),
      new ReferenceEdge(w2, null, w1)
    );
    ClosureResult result = aggregate(resolver.candidates(w1));
    assertEquals(Map.of(0L, 1 + 2 + 3 + 4), result.memberCounts());
    assertEquals(List.of(w1, w2), result.witnesses());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4, 7})
  void testSameResultForAnyThreadCount(int threads) {
    List<ReferenceEdge> edges = new ArrayList<>();
    for (int i = 0; i < 60; i++) {
      ElementKey node = ElementKey.node(i, 1);
      ElementKey way = ElementKey.way(i / 3, 1);
      ElementKey relation = ElementKey.relation(i / 9, 1);
      edges.add(new ReferenceEdge(way, i % 2 == 0 ? null : (long) (i / 3), node));
      edges.add(new ReferenceEdge(relation, (long) (i / 9), way));
      edges.add(new ReferenceEdge(ElementKey.relation(i / 9 + 1, 1), null, relation));
    }
    List<ElementKey> targets = new ArrayList<>();
    for (int i = 0; i < 60; i++) {
      targets.add(ElementKey.node(i, 1));
      targets.add(ElementKey.way(i / 3, 1));
    }
    var graph = ReferenceGraph.of(edges);
    var expected = aggregateAll(new BoundedClosureResolver(graph, 5, 1, Stats.inMemory()).resolveAll(targets));
    var actual = aggregateAll(new BoundedClosureResolver(graph, 5, threads, Stats.inMemory()).resolveAll(targets));
    assertEquals(expected, actual);
  }

  private static Map<ElementKey, ClosureResult> aggregateAll(Map<ElementKey, List<Candidate>> candidates) {
    Map<ElementKey, ClosureResult> result = new TreeMap<>();
    candidates.forEach((key, list) -> result.put(key, IdentifierAggregator.aggregate(list)));
    return result;
  }
}
