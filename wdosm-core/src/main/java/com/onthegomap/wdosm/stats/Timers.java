package com.onthegomap.wdosm.stats;

import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of pipeline stages that are being timed.
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private final Map<String, Stopwatch> timers = Collections.synchronizedMap(new LinkedHashMap<>());

  /** Starts timing {@code name} and returns a handle to call when it finished. */
  public Finishable startTimer(String name, boolean logStart) {
    if (logStart) {
      LOGGER.info("");
      LOGGER.info("Starting...");
    }
    Stopwatch stopwatch = Stopwatch.createStarted();
    timers.put(name, stopwatch);
    return () -> {
      stopwatch.stop();
      if (logStart) {
        LOGGER.info("Finished in {}", stopwatch);
      }
    };
  }

  /** Returns the elapsed time of every stage started so far, in start order. */
  public Map<String, Duration> all() {
    Map<String, Duration> result = new LinkedHashMap<>();
    synchronized (timers) {
      timers.forEach((name, stopwatch) -> result.put(name, stopwatch.elapsed()));
    }
    return result;
  }

  public void printSummary() {
    var all = all();
    int maxLength = all.keySet().stream().mapToInt(String::length).max().orElse(0);
    for (var entry : all.entrySet()) {
      LOGGER.info("\t{} {}ms", padRight(entry.getKey(), maxLength), entry.getValue().toMillis());
    }
  }

  private static String padRight(String str, int size) {
    return str.length() >= size ? str : str + " ".repeat(size - str.length());
  }

  /** A handle that callers can use to indicate a task has finished. */
  @FunctionalInterface
  public interface Finishable {

    void stop();
  }
}
