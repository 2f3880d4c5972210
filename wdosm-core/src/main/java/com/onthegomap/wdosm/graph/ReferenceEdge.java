package com.onthegomap.wdosm.graph;

import com.onthegomap.wdosm.element.ElementKey;

/**
 * A container element referencing one of its members.
 *
 * @param container       the referencing element
 * @param containerWdId   Wikidata identifier of {@code container} when the edge was built, or null
 * @param referenced      the referenced element
 */
public record ReferenceEdge(ElementKey container, Long containerWdId, ElementKey referenced) {

  /** Returns the container's identifier, 0 when it has none. */
  public long containerWdIdOrZero() {
    return containerWdId == null ? 0 : containerWdId;
  }

  @Override
  public String toString() {
    return container + (containerWdId == null ? "" : "(Q" + containerWdId + ")") + "->" + referenced;
  }
}
