package com.onthegomap.wdosm.stats;

import java.util.concurrent.atomic.LongAdder;

/**
 * A tally of parse-run events, such as skipped rows or closure paths, that only goes up.
 */
public interface Counter {

  void incBy(long value);

  default void inc() {
    incBy(1);
  }

  /** A counter whose total can be read back. */
  interface Readable extends Counter {

    long get();
  }

  static MultiThreadCounter newMultiThreadCounter() {
    return new MultiThreadCounter();
  }

  /** A counter that shard threads bump concurrently. Reads sum the {@link LongAdder} cells. */
  final class MultiThreadCounter implements Readable {

    private final LongAdder total = new LongAdder();

    private MultiThreadCounter() {}

    @Override
    public void incBy(long value) {
      total.add(value);
    }

    @Override
    public long get() {
      return total.sum();
    }
  }
}
