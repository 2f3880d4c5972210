package com.onthegomap.wdosm.resolve;

import com.carrotsearch.hppc.LongIntHashMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.util.Hppc;
import java.util.Collection;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collapses a candidate multiset into a {@link ClosureResult}.
 */
public class IdentifierAggregator {

  private IdentifierAggregator() {}

  /**
   * Counts the candidates naming each identifier and collects the contributors of identifiers named more than once.
   * An empty input gives {@link ClosureResult#EMPTY}.
   */
  public static ClosureResult aggregate(Collection<Candidate> candidates) {
    if (candidates.isEmpty()) {
      return ClosureResult.EMPTY;
    }
    LongIntHashMap counts = Hppc.newLongIntHashMap();
    for (Candidate candidate : candidates) {
      counts.addTo(candidate.wdId(), 1);
    }
    TreeSet<ElementKey> witnesses = new TreeSet<>();
    for (Candidate candidate : candidates) {
      if (counts.get(candidate.wdId()) > 1) {
        witnesses.add(candidate.contributor());
      }
    }
    TreeMap<Long, Integer> sorted = new TreeMap<>();
    for (var cursor : counts) {
      sorted.put(cursor.key, cursor.value);
    }
    return new ClosureResult(ImmutableSortedMap.copyOfSorted(sorted), ImmutableList.copyOf(witnesses));
  }
}
