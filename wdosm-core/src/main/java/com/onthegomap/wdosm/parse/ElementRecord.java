package com.onthegomap.wdosm.parse;

import com.onthegomap.wdosm.element.ElementKey;

/**
 * What one parse run learned about an element from its own annotation string.
 *
 * @param key                     the element
 * @param wdId                    Wikidata identifier tagged on the element, or null
 * @param centroid                geohash of the element's approximate center, or null
 * @param featureType             free-text tags joined by {@code -}, empty when there were none
 * @param originalReferenceCount  reference tokens seen, valid or not
 * @param validReferenceCount     reference tokens whose id passed the {@link KnownIdFilter}
 */
public record ElementRecord(
  ElementKey key,
  Long wdId,
  String centroid,
  String featureType,
  int originalReferenceCount,
  int validReferenceCount
) {

  public ElementRecord {
    if (featureType == null) {
      throw new IllegalArgumentException("featureType must not be null, use an empty string");
    }
  }

  public boolean hasWdId() {
    return wdId != null;
  }

  /** Returns the dangling references, those that did not pass the {@link KnownIdFilter}. */
  public int danglingReferenceCount() {
    return originalReferenceCount - validReferenceCount;
  }
}
