package com.onthegomap.wdosm.resolve;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.onthegomap.wdosm.element.ElementKey;
import java.util.Collections;

/**
 * Candidate identifiers of one element, counted.
 *
 * @param memberCounts how many candidates named each identifier, 0 standing for "no identifier"
 * @param witnesses    sorted keys of the contributors whose identifier was named more than once
 */
public record ClosureResult(
  ImmutableSortedMap<Long, Integer> memberCounts,
  ImmutableList<ElementKey> witnesses
) {

  public static final ClosureResult EMPTY = new ClosureResult(ImmutableSortedMap.of(), ImmutableList.of());

  public boolean isEmpty() {
    return memberCounts.isEmpty() && witnesses.isEmpty();
  }

  /** Returns the largest count in {@link #memberCounts()}, 0 when empty. */
  public int maxCount() {
    return memberCounts.isEmpty() ? 0 : Collections.max(memberCounts.values());
  }
}
