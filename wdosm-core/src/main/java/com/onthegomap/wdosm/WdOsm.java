package com.onthegomap.wdosm;

import com.google.common.collect.ImmutableSortedMap;
import com.onthegomap.wdosm.config.Arguments;
import com.onthegomap.wdosm.config.WdOsmConfig;
import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.graph.ReferenceGraph;
import com.onthegomap.wdosm.graph.ReferenceGraphBuilder;
import com.onthegomap.wdosm.parse.ElementParser;
import com.onthegomap.wdosm.parse.ElementRecord;
import com.onthegomap.wdosm.parse.KnownIdFilter;
import com.onthegomap.wdosm.parse.TokenTable;
import com.onthegomap.wdosm.reader.RawRow;
import com.onthegomap.wdosm.reader.RawRowCsvReader;
import com.onthegomap.wdosm.reader.RawRowSource;
import com.onthegomap.wdosm.resolve.AdjacencyResolver;
import com.onthegomap.wdosm.resolve.BoundedClosureResolver;
import com.onthegomap.wdosm.resolve.Candidate;
import com.onthegomap.wdosm.resolve.ClosureResult;
import com.onthegomap.wdosm.resolve.IdentifierAggregator;
import com.onthegomap.wdosm.stats.Stats;
import com.onthegomap.wdosm.store.Dataset;
import com.onthegomap.wdosm.store.DatasetRegistry;
import com.onthegomap.wdosm.store.ElementRow;
import com.onthegomap.wdosm.store.RecordTable;
import com.onthegomap.wdosm.util.LogUtil;
import com.onthegomap.wdosm.writer.CsvExporter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the identifier-resolution pipeline over the raw rows of one dataset.
 * <p>
 * Each run tokenizes the annotation strings, builds one record per element and the reference graph between them,
 * then fills in candidate identifiers for the elements that lack one using the configured closure strategy. The
 * known-id filter, token table and edge set belong to the run and are never shared with another one.
 * <p>
 * To run from the command line:
 *
 * <pre>{@code
 * java -jar wdosm.jar parse --name=BR --input_dir=/tmp --strategy=complete --max_depth=5
 * }</pre>
 */
public class WdOsm {

  private static final Logger LOGGER = LoggerFactory.getLogger(WdOsm.class);
  private final WdOsmConfig config;
  private final Stats stats;

  public WdOsm(WdOsmConfig config, Stats stats) {
    this.config = config;
    this.stats = stats;
  }

  /**
   * Everything one parse run produced.
   *
   * @param dataset   the dataset the rows belong to
   * @param rowsByKey one row per element
   * @param knownIds  the ids the run accepted as references
   * @param tokens    tokens of every element, cleared when intermediate results are purged
   * @param graph     the reference graph, empty when intermediate results are purged
   */
  public record ParseRun(
    int dataset,
    ImmutableSortedMap<ElementKey, ElementRow> rowsByKey,
    KnownIdFilter knownIds,
    TokenTable tokens,
    ReferenceGraph graph
  ) {

    /** Returns every row, ordered by key. */
    public List<ElementRow> rows() {
      return rowsByKey.values().asList();
    }

    /** Returns the row of {@code key}, or null when the run did not see that element. */
    public ElementRow row(ElementKey key) {
      return rowsByKey.get(key);
    }
  }

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    WdOsmConfig config = WdOsmConfig.from(arguments);
    Stats stats = Stats.inMemory();
    DatasetRegistry registry = new DatasetRegistry();
    Dataset dataset = registry.register(
      config.name(),
      arguments.getString("dataset_name", "dataset title", null),
      arguments.getString("curator", "curator of the dataset", null)
    );
    RecordTable table = new RecordTable();
    String summary = new WdOsm(config, stats).run(dataset.id(), new RawRowCsvReader(config.rawInputFile()), table);
    stats.printSummary();
    LOGGER.info(summary);
  }

  /**
   * Reads {@code source}, parses it as dataset {@code dataset}, replaces that dataset's rows in {@code table} and
   * exports them when configured to.
   *
   * @return a one-line summary of the run
   */
  public String run(int dataset, RawRowSource source, RecordTable table) {
    LogUtil.setDataset(dataset);
    try {
      List<RawRow> rows;
      var timer = stats.startStage("read");
      try {
        rows = source.readAll();
      } finally {
        timer.stop();
      }
      ParseRun run = parse(dataset, rows);
      table.replaceDataset(dataset, run.rowsByKey().values());
      if (config.exportCsv()) {
        timer = stats.startStage("export");
        try {
          return new CsvExporter(config.outputDir(), config.name()).export(table, dataset);
        } finally {
          timer.stop();
        }
      }
      return "Parsed " + run.rowsByKey().size() + " elements of " + config.name() + ", no files written";
    } finally {
      LogUtil.clearDataset();
    }
  }

  /** Runs every stage of the pipeline over {@code rows}, which all belong to {@code dataset}. */
  public ParseRun parse(int dataset, List<RawRow> rows) {
    stats.longCounter("rows").incBy(rows.size());

    var timer = stats.startStage("parse");
    ElementParser.ParsedBatch batch;
    try {
      batch = new ElementParser(config.threads(), stats).parse(dataset, rows);
    } finally {
      timer.stop();
    }

    timer = stats.startStage("graph");
    ReferenceGraph graph;
    try {
      graph = new ReferenceGraphBuilder(batch.knownIds(), config.threads()).build(batch.records(), batch.tokens());
      stats.longCounter("edges").incBy(graph.size());
    } finally {
      timer.stop();
    }

    timer = stats.startStage("resolve");
    Map<ElementKey, ClosureResult> results = new TreeMap<>();
    try {
      List<ElementKey> targets = new ArrayList<>();
      for (ElementRecord record : batch.records().values()) {
        if (!record.hasWdId()) {
          targets.add(record.key());
        }
      }
      LOGGER.info("resolving {} elements without an identifier using the {} strategy", targets.size(),
        config.strategy().id());
      Map<ElementKey, List<Candidate>> candidates = switch (config.strategy()) {
        case FAST -> new AdjacencyResolver(graph).resolveAll(targets);
        case COMPLETE -> new BoundedClosureResolver(graph, config.maxDepth(), config.threads(), stats)
          .resolveAll(targets);
      };
      candidates.forEach((key, list) -> {
        ClosureResult result = IdentifierAggregator.aggregate(list);
        if (!result.isEmpty()) {
          results.put(key, result);
        }
      });
      stats.longCounter("records_with_candidates").incBy(results.size());
    } finally {
      timer.stop();
    }

    var elementRows = ImmutableSortedMap.<ElementKey, ElementRow>naturalOrder();
    for (ElementRecord record : batch.records().values()) {
      elementRows.put(record.key(), ElementRow.of(record, results.get(record.key())));
    }

    TokenTable tokens = batch.tokens();
    if (config.purgeIntermediate()) {
      tokens.clear();
      graph = ReferenceGraph.empty();
    }
    return new ParseRun(dataset, elementRows.build(), batch.knownIds(), tokens, graph);
  }
}
