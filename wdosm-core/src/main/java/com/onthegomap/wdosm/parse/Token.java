package com.onthegomap.wdosm.parse;

import com.google.common.primitives.Longs;

/**
 * One piece of an element's annotation string: a single-character {@code kind} and the rest of the text as
 * {@code payload}.
 * <p>
 * An <em>integer</em> token looks like {@code [A-Za-z][0-9]+}. Integer tokens of kind {@code Q} carry a Wikidata
 * identifier, tokens of kind {@code c} carry the centroid geohash, and every other integer token references another
 * element by id. Anything else is free text.
 *
 * @param kind    first character of the token
 * @param payload remaining characters, possibly empty
 * @param value   numeric payload for integer tokens, otherwise null
 */
public record Token(char kind, String payload, Long value) {

  public static final char IDENTIFIER_KIND = 'Q';
  public static final char CENTROID_KIND = 'c';

  /** Returns the token for one separator-free piece of annotation text. */
  public static Token of(String text) {
    if (text.isEmpty()) {
      throw new IllegalArgumentException("Empty token");
    }
    return of(text.charAt(0), text.substring(1));
  }

  /** Returns the token with {@code kind} and {@code payload}, working out if it is an integer token. */
  public static Token of(char kind, String payload) {
    Long value = isAsciiLetter(kind) && isDigits(payload) ? Longs.tryParse(payload) : null;
    return new Token(kind, payload, value);
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isDigits(String text) {
    if (text.isEmpty()) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  /** True when the payload is a number that fits in a {@code long}. */
  public boolean isInteger() {
    return value != null;
  }

  public boolean isIdentifier() {
    return kind == IDENTIFIER_KIND && isInteger();
  }

  public boolean isCentroid() {
    return kind == CENTROID_KIND;
  }

  public boolean isReference() {
    return isInteger() && kind != IDENTIFIER_KIND && kind != CENTROID_KIND;
  }

  /** Free text is whatever is neither a reference, an identifier, nor a centroid. */
  public boolean isFreeText() {
    return !isReference() && !isIdentifier() && !isCentroid();
  }

  /** A token of a reserved kind with nothing after it, like the {@code c} in {@code "c:u0qgbz9dns1"}. */
  boolean isBareMarker() {
    return payload.isEmpty() && (kind == IDENTIFIER_KIND || kind == CENTROID_KIND);
  }

  @Override
  public String toString() {
    return kind + payload;
  }
}
