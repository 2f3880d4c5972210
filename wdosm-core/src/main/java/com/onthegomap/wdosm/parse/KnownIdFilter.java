package com.onthegomap.wdosm.parse;

import com.carrotsearch.hppc.LongHashSet;
import com.onthegomap.wdosm.util.Hppc;
import java.util.function.Consumer;
import java.util.function.LongConsumer;
import java.util.function.LongPredicate;

/**
 * The bare element ids present in the raw batch of the current parse run.
 * <p>
 * Membership ignores the element type, so a reference to node 7 passes when only way 7 exists. Source files are
 * usually cut out of a larger extract and this cheaply drops references to elements that were cut away.
 * <p>
 * Not thread safe while being rebuilt, safe for concurrent {@link #contains(long)} calls afterwards.
 */
public class KnownIdFilter implements LongPredicate {

  private final LongHashSet ids = Hppc.newLongHashSet();

  /** Returns a filter holding {@code ids}. */
  public static KnownIdFilter of(long... ids) {
    KnownIdFilter result = new KnownIdFilter();
    result.rebuild(sink -> {
      for (long id : ids) {
        sink.accept(id);
      }
    });
    return result;
  }

  /** Clears every id from a previous run and then adds the ones {@code source} passes to its consumer. */
  public void rebuild(Consumer<LongConsumer> source) {
    ids.clear();
    source.accept(ids::add);
  }

  public boolean contains(long id) {
    return ids.contains(id);
  }

  @Override
  public boolean test(long id) {
    return contains(id);
  }

  public int size() {
    return ids.size();
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }
}
