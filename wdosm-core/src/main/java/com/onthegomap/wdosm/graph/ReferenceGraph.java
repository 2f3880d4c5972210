package com.onthegomap.wdosm.graph;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.onthegomap.wdosm.element.ElementKey;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * The reference edges of one parse run, indexed by container and by referenced element.
 * <p>
 * The graph may contain cycles. Edges are unique per (container, referenced) pair.
 */
@Immutable
public class ReferenceGraph {

  private static final Comparator<ReferenceEdge> EDGE_ORDER = Comparator
    .comparing(ReferenceEdge::container)
    .thenComparing(ReferenceEdge::referenced);
  private final ImmutableSet<ReferenceEdge> edges;
  private final ImmutableListMultimap<ElementKey, ReferenceEdge> byContainer;
  private final ImmutableListMultimap<ElementKey, ReferenceEdge> byReferenced;

  private ReferenceGraph(List<ReferenceEdge> sortedEdges) {
    this.edges = ImmutableSet.copyOf(sortedEdges);
    ImmutableListMultimap.Builder<ElementKey, ReferenceEdge> containers = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<ElementKey, ReferenceEdge> referenced = ImmutableListMultimap.builder();
    for (ReferenceEdge edge : edges) {
      containers.put(edge.container(), edge);
      referenced.put(edge.referenced(), edge);
    }
    this.byContainer = containers.build();
    this.byReferenced = referenced.build();
  }

  /** Returns a graph of {@code edges} in a stable order, keeping one copy of repeated edges. */
  public static ReferenceGraph of(Collection<ReferenceEdge> edges) {
    return new ReferenceGraph(edges.stream().distinct().sorted(EDGE_ORDER).toList());
  }

  public static ReferenceGraph empty() {
    return of(List.of());
  }

  /** Returns every edge, ordered by container then referenced element. */
  public ImmutableSet<ReferenceEdge> edges() {
    return edges;
  }

  /** Returns the edges from {@code container} to its members. */
  public List<ReferenceEdge> outgoing(ElementKey container) {
    return byContainer.get(container);
  }

  /** Returns the edges from every container of {@code referenced}. */
  public List<ReferenceEdge> incoming(ElementKey referenced) {
    return byReferenced.get(referenced);
  }

  /** True when {@code key} references at least one element. */
  public boolean isContainer(ElementKey key) {
    return byContainer.containsKey(key);
  }

  public int size() {
    return edges.size();
  }
}
