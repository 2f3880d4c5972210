package com.onthegomap.wdosm.resolve;

import com.onthegomap.wdosm.element.ElementKey;

/**
 * A Wikidata identifier suggested for an element by a related element.
 *
 * @param wdId        the suggested identifier, 0 when the contributor has none
 * @param contributor the related element carrying {@code wdId}
 */
public record Candidate(long wdId, ElementKey contributor) {}
