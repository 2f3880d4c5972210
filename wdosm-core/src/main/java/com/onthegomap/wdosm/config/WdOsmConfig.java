package com.onthegomap.wdosm.config;

import com.onthegomap.wdosm.resolve.ClosureStrategy;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Holder for the parameters of a parse run.
 *
 * @param strategy          which closure strategy fills in candidate identifiers
 * @param maxDepth          longest path, counted with its seed, the {@link ClosureStrategy#COMPLETE} strategy builds
 * @param purgeIntermediate drop the token table and edge set once the run finished
 * @param exportCsv         write the dump and suspect CSV files at the end of the run
 * @param threads           worker threads for parsing, graph building and closure layers
 * @param inputDir          folder holding {@code <NAME>.wdDump.raw.csv}
 * @param outputDir         folder the exported CSV files are written to
 * @param name              upper-case dataset abbreviation used to name files
 */
public record WdOsmConfig(
  ClosureStrategy strategy,
  int maxDepth,
  boolean purgeIntermediate,
  boolean exportCsv,
  int threads,
  Path inputDir,
  Path outputDir,
  String name
) {

  public static final int DEFAULT_MAX_DEPTH = 5;
  public static final String DEFAULT_NAME = "TMP";
  private static final Path DEFAULT_DIR = Path.of("/tmp");

  public WdOsmConfig {
    if (strategy == null) {
      throw new IllegalArgumentException("Missing closure strategy");
    }
    if (maxDepth < 1) {
      throw new IllegalArgumentException("max_depth must be >= 1, was " + maxDepth);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    name = normalizeName(name);
  }

  public static WdOsmConfig defaults() {
    return from(Arguments.of());
  }

  /**
   * Returns a config read from {@code arguments}.
   *
   * @throws IllegalArgumentException if the strategy is unknown or a numeric parameter is out of range
   */
  public static WdOsmConfig from(Arguments arguments) {
    ClosureStrategy strategy = ClosureStrategy.from(
      arguments.getString("strategy|update_method", "closure strategy, one of fast or complete", "fast"));
    int maxDepth = arguments.getInteger("max_depth|stop_level",
      "longest membership chain the complete strategy follows", DEFAULT_MAX_DEPTH);
    Path inputDir = arguments.file("input_dir|path", "folder of the raw CSV files", DEFAULT_DIR);
    return new WdOsmConfig(
      strategy,
      maxDepth,
      arguments.getBoolean("purge_intermediate|delkxs", "discard tokens and edges after the run", true),
      arguments.getBoolean("export_csv|expcsv", "write the dump and suspect CSV files", true),
      arguments.threads(),
      inputDir,
      arguments.file("output_dir", "folder of the exported CSV files", inputDir),
      arguments.getString("name", "dataset abbreviation, e.g. an ISO 3166-1 alpha-2 code", DEFAULT_NAME)
    );
  }

  /** Returns a copy of this config that uses {@code newStrategy}. */
  public WdOsmConfig withStrategy(ClosureStrategy newStrategy) {
    return new WdOsmConfig(newStrategy, maxDepth, purgeIntermediate, exportCsv, threads, inputDir, outputDir, name);
  }

  /** Returns a copy of this config that uses {@code newMaxDepth}. */
  public WdOsmConfig withMaxDepth(int newMaxDepth) {
    return new WdOsmConfig(strategy, newMaxDepth, purgeIntermediate, exportCsv, threads, inputDir, outputDir, name);
  }

  /** Returns a copy of this config that runs on {@code newThreads} threads. */
  public WdOsmConfig withThreads(int newThreads) {
    return new WdOsmConfig(strategy, maxDepth, purgeIntermediate, exportCsv, newThreads, inputDir, outputDir, name);
  }

  /** Returns a copy of this config that keeps the token table and edge set when {@code purge} is false. */
  public WdOsmConfig withPurgeIntermediate(boolean purge) {
    return new WdOsmConfig(strategy, maxDepth, purge, exportCsv, threads, inputDir, outputDir, name);
  }

  public Path rawInputFile() {
    return inputDir.resolve(name + ".wdDump.raw.csv");
  }

  private static String normalizeName(String name) {
    return name == null || name.isBlank() ? DEFAULT_NAME : name.trim().toUpperCase(Locale.ROOT);
  }
}
