package com.onthegomap.wdosm.stats;

import com.onthegomap.wdosm.util.LogUtil;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects timings and counters for one or more parse runs and reports them at the end.
 */
public interface Stats {

  /** Returns a new stat collector that keeps everything in memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /**
   * Logs the elapsed time of each stage and the value of every counter.
   */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    for (var entry : new TreeMap<>(counters()).entrySet()) {
      logger.info("\t{}\t{}", entry.getKey(), entry.getValue().get());
    }
  }

  /**
   * Records that a pipeline stage with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    LogUtil.setStage(name);
    var timer = timers().startTimer(name, true);
    return () -> {
      timer.stop();
      LogUtil.clearStage();
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Returns all counters registered through {@link #longCounter(String)}. */
  Map<String, Counter.Readable> counters();

  /**
   * Returns and starts tracking a counter with {@code name} optimized for the caller to increment from multiple
   * threads. Asking twice for the same name returns the same counter.
   */
  default Counter.MultiThreadCounter longCounter(String name) {
    return (Counter.MultiThreadCounter) counters().computeIfAbsent(name, n -> Counter.newMultiThreadCounter());
  }

  /** Returns the current value of the counter called {@code name} or 0 if it was never registered. */
  default long get(String name) {
    Counter.Readable counter = counters().get(name);
    return counter == null ? 0 : counter.get();
  }

  class InMemory implements Stats {

    private final Timers timers = new Timers();
    private final Map<String, Counter.Readable> counters = new ConcurrentSkipListMap<>();

    /** use {@link #inMemory()} */
    private InMemory() {}

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public Map<String, Counter.Readable> counters() {
      return counters;
    }
  }
}
