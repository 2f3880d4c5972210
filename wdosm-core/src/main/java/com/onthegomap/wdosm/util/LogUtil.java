package com.onthegomap.wdosm.util;

import java.util.Map;
import org.slf4j.MDC;

/**
 * Keeps the dataset and pipeline stage of the current thread in the SLF4J {@link MDC} so every log line of a parse run
 * starts with a prefix like {@code [ds3 resolve:closure] }.
 * <p>
 * The log4j2 pattern prints the rendered prefix through {@code %X{prefix}}.
 */
public final class LogUtil {

  static final String PREFIX_KEY = "prefix";
  private static final String DATASET_KEY = "dataset";
  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Tags subsequent logs from this thread with dataset id {@code dataset}. */
  public static void setDataset(int dataset) {
    MDC.put(DATASET_KEY, Integer.toString(dataset));
    render();
  }

  public static void clearDataset() {
    MDC.remove(DATASET_KEY);
    render();
  }

  /** Returns the dataset id logs from this thread are tagged with, or null. */
  public static Integer getDataset() {
    String dataset = MDC.get(DATASET_KEY);
    return dataset == null ? null : Integer.valueOf(dataset);
  }

  /** Tags subsequent logs from this thread with pipeline stage {@code stage}. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, stage);
    render();
  }

  /** Appends {@code :child} to the current stage, or starts a stage named {@code child} if there is none. */
  public static void enterSubStage(String child) {
    String parent = getStage();
    setStage(parent == null ? child : parent + ":" + child);
  }

  public static void clearStage() {
    MDC.remove(STAGE_KEY);
    render();
  }

  /** Returns the stage logs from this thread are tagged with, or null. */
  public static String getStage() {
    return MDC.get(STAGE_KEY);
  }

  /** Returns a copy of this thread's tags to hand to {@link #restore(Map)} on a worker thread. */
  public static Map<String, String> capture() {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return context == null ? Map.of() : context;
  }

  /** Replaces this thread's tags with {@code context}. */
  public static void restore(Map<String, String> context) {
    MDC.setContextMap(context);
  }

  /** Drops every tag from this thread. */
  public static void clear() {
    MDC.clear();
  }

  private static void render() {
    String dataset = MDC.get(DATASET_KEY);
    String stage = MDC.get(STAGE_KEY);
    if (dataset == null && stage == null) {
      MDC.remove(PREFIX_KEY);
    } else if (dataset == null) {
      MDC.put(PREFIX_KEY, "[" + stage + "] ");
    } else if (stage == null) {
      MDC.put(PREFIX_KEY, "[ds" + dataset + "] ");
    } else {
      MDC.put(PREFIX_KEY, "[ds" + dataset + " " + stage + "] ");
    }
  }
}
