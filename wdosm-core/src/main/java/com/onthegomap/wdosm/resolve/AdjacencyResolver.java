package com.onthegomap.wdosm.resolve;

import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.graph.ReferenceEdge;
import com.onthegomap.wdosm.graph.ReferenceGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The cheap closure strategy.
 * <p>
 * For a target element, looks at each element it references. Members that reference elements themselves contribute
 * the identifier they carried when the graph was built, if positive, along with their own key. Each member counts once.
 */
public class AdjacencyResolver {

  private final ReferenceGraph graph;

  public AdjacencyResolver(ReferenceGraph graph) {
    this.graph = graph;
  }

  /** Returns the candidates for {@code target}, ordered by member key. */
  public List<Candidate> candidates(ElementKey target) {
    Set<Candidate> result = new LinkedHashSet<>();
    for (ReferenceEdge child : graph.outgoing(target)) {
      ElementKey member = child.referenced();
      for (ReferenceEdge memberEdge : graph.outgoing(member)) {
        if (memberEdge.containerWdIdOrZero() > 0) {
          result.add(new Candidate(memberEdge.containerWdId(), member));
        }
      }
    }
    return new ArrayList<>(result);
  }

  /** Returns the non-empty candidate lists of every element in {@code targets}. */
  public Map<ElementKey, List<Candidate>> resolveAll(Collection<ElementKey> targets) {
    Map<ElementKey, List<Candidate>> result = new TreeMap<>();
    for (ElementKey target : targets) {
      List<Candidate> found = candidates(target);
      if (!found.isEmpty()) {
        result.put(target, found);
      }
    }
    return result;
  }
}
