package com.onthegomap.wdosm.element;

import java.util.Comparator;

/**
 * Identifies one element of a dataset.
 * <p>
 * Keys sort by dataset, then type ({@code node < way < relation}), then id.
 */
public record ElementKey(ElementType type, long id, int dataset) implements Comparable<ElementKey> {

  private static final Comparator<ElementKey> ORDER = Comparator
    .comparingInt(ElementKey::dataset)
    .thenComparing(ElementKey::type)
    .thenComparingLong(ElementKey::id);

  public ElementKey {
    if (type == null) {
      throw new IllegalArgumentException("Missing element type");
    }
    if (id < 0) {
      throw new IllegalArgumentException("Element id must be >= 0, was " + id);
    }
  }

  public static ElementKey node(long id, int dataset) {
    return new ElementKey(ElementType.NODE, id, dataset);
  }

  public static ElementKey way(long id, int dataset) {
    return new ElementKey(ElementType.WAY, id, dataset);
  }

  public static ElementKey relation(long id, int dataset) {
    return new ElementKey(ElementType.RELATION, id, dataset);
  }

  @Override
  public int compareTo(ElementKey o) {
    return ORDER.compare(this, o);
  }

  @Override
  public String toString() {
    return type.code() + Long.toString(id);
  }
}
