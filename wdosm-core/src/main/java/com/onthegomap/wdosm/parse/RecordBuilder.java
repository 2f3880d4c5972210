package com.onthegomap.wdosm.parse;

import com.onthegomap.wdosm.element.ElementKey;
import java.util.StringJoiner;

/**
 * Folds every token of one element into its {@link ElementRecord}.
 * <p>
 * When an element carries several identifier or centroid tokens, the largest value wins: numerically for identifiers,
 * lexicographically for centroids. Input order never matters for those two fields.
 */
public class RecordBuilder {

  private final KnownIdFilter knownIds;

  public RecordBuilder(KnownIdFilter knownIds) {
    this.knownIds = knownIds;
  }

  public ElementRecord build(ElementKey key, Iterable<Token> tokens) {
    Long wdId = null;
    String centroid = null;
    StringJoiner featureType = new StringJoiner("-");
    int originalRefs = 0;
    int validRefs = 0;
    for (Token token : tokens) {
      if (token.isReference()) {
        originalRefs++;
        if (knownIds.contains(token.value())) {
          validRefs++;
        }
      } else if (token.isIdentifier()) {
        if (wdId == null || token.value() > wdId) {
          wdId = token.value();
        }
      } else if (token.isCentroid()) {
        String payload = token.payload();
        if (!payload.isEmpty() && (centroid == null || payload.compareTo(centroid) > 0)) {
          centroid = payload;
        }
      } else if (!token.payload().isEmpty()) {
        featureType.add(token.payload());
      }
    }
    return new ElementRecord(key, wdId, centroid, featureType.toString(), originalRefs, validRefs);
  }
}
