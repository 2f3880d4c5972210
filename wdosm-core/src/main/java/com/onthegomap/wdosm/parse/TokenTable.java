package com.onthegomap.wdosm.parse;

import com.onthegomap.wdosm.element.ElementKey;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Scratch table of a parse run holding the tokens of every element, in the order they were read.
 */
public class TokenTable {

  private final SortedMap<ElementKey, List<Token>> tokens;

  TokenTable(SortedMap<ElementKey, List<Token>> tokens) {
    this.tokens = tokens;
  }

  /** Returns a table with a copy of {@code tokens}. */
  public static TokenTable of(Map<ElementKey, List<Token>> tokens) {
    SortedMap<ElementKey, List<Token>> copy = new TreeMap<>();
    tokens.forEach((key, value) -> copy.put(key, List.copyOf(value)));
    return new TokenTable(copy);
  }

  /** Returns the tokens of {@code key}, empty when the element is unknown. */
  public List<Token> get(ElementKey key) {
    return tokens.getOrDefault(key, Collections.emptyList());
  }

  public void forEach(BiConsumer<ElementKey, List<Token>> consumer) {
    tokens.forEach(consumer);
  }

  public int size() {
    return tokens.size();
  }

  /** Drops every token so the memory can be reclaimed. */
  public void clear() {
    tokens.clear();
  }
}
