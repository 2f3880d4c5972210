package com.onthegomap.wdosm.resolve;

import java.util.Locale;

/**
 * How a parse run infers candidate identifiers for elements without one of their own.
 */
public enum ClosureStrategy {
  /** One hop: identifiers of the members of an element that are containers themselves. See {@link AdjacencyResolver}. */
  FAST("fast"),
  /** Climbs containers up to a depth bound. See {@link BoundedClosureResolver}. */
  COMPLETE("complete");

  private final String id;

  ClosureStrategy(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /**
   * Returns the strategy called {@code name}, ignoring case.
   *
   * @throws IllegalArgumentException if {@code name} is not {@code fast} or {@code complete}
   */
  public static ClosureStrategy from(String name) {
    String normalized = name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    for (ClosureStrategy strategy : values()) {
      if (strategy.id.equals(normalized)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unknown closure strategy '" + name + "', expected fast or complete");
  }
}
