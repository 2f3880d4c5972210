package com.onthegomap.wdosm.element;

import java.util.Locale;

/**
 * The kind of an OpenStreetMap element.
 *
 * @see <a href="https://wiki.openstreetmap.org/wiki/Elements">OSM element data model</a>
 */
public enum ElementType {
  NODE('n'),
  WAY('w'),
  RELATION('r');

  private final char code;

  ElementType(char code) {
    this.code = code;
  }

  /** Single-letter code used in raw and exported CSV files. */
  public char code() {
    return code;
  }

  /** Returns the type for a one-letter code, or null for anything else. */
  public static ElementType fromCode(char code) {
    return switch (Character.toLowerCase(code)) {
      case 'n' -> NODE;
      case 'w' -> WAY;
      case 'r' -> RELATION;
      default -> null;
    };
  }

  /**
   * Returns the type named by the first character of {@code text} ({@code "n"}, {@code "node"}, {@code "W"}...), or
   * null if blank or unknown.
   */
  public static ElementType parse(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.strip().toLowerCase(Locale.ROOT);
    return trimmed.isEmpty() ? null : fromCode(trimmed.charAt(0));
  }
}
