package com.onthegomap.wdosm.parse;

import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.element.ElementType;
import com.onthegomap.wdosm.reader.RawRow;
import com.onthegomap.wdosm.stats.Counter;
import com.onthegomap.wdosm.stats.Stats;
import com.onthegomap.wdosm.worker.Worker;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw rows of one dataset into a {@link TokenTable} and one {@link ElementRecord} per element.
 * <p>
 * Rows are sharded across worker threads by element key, so every row of an element lands on the same thread and
 * keeps its file order. Rows with an unknown element type are skipped and counted.
 */
public class ElementParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ElementParser.class);
  private final int threads;
  private final Counter.MultiThreadCounter rowsSkipped;
  private final Counter.MultiThreadCounter tokensRead;
  private final Counter.MultiThreadCounter freeTextTokens;
  private final Counter.MultiThreadCounter referenceTokens;
  private final Counter.MultiThreadCounter danglingReferences;

  public ElementParser(int threads, Stats stats) {
    this.threads = threads;
    this.rowsSkipped = stats.longCounter("rows_skipped");
    this.tokensRead = stats.longCounter("tokens");
    this.freeTextTokens = stats.longCounter("tokens_free_text");
    this.referenceTokens = stats.longCounter("references");
    this.danglingReferences = stats.longCounter("references_dangling");
  }

  /** Output of {@link #parse(int, List)}. */
  public record ParsedBatch(
    KnownIdFilter knownIds,
    TokenTable tokens,
    SortedMap<ElementKey, ElementRecord> records
  ) {}

  /**
   * Builds the known-id filter from {@code rows}, then tokenizes every row and builds the records of dataset
   * {@code dataset}.
   */
  public ParsedBatch parse(int dataset, List<RawRow> rows) {
    KnownIdFilter knownIds = new KnownIdFilter();
    knownIds.rebuild(ids -> {
      for (RawRow row : rows) {
        if (row.osmId() != null) {
          ids.accept(row.osmId());
        }
      }
    });
    LOGGER.info("{} distinct ids in {} rows", knownIds.size(), rows.size());

    List<ElementKey> keys = new ArrayList<>(rows.size());
    for (RawRow row : rows) {
      keys.add(keyOf(dataset, row));
    }

    RecordBuilder builder = new RecordBuilder(knownIds);
    List<Map<ElementKey, List<Token>>> tokenShards = new ArrayList<>();
    List<Map<ElementKey, ElementRecord>> recordShards = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      tokenShards.add(new LinkedHashMap<>());
      recordShards.add(new HashMap<>());
    }
    Worker.runShards("tokenize", threads, workerIndex -> {
      Map<ElementKey, List<Token>> shard = tokenShards.get(workerIndex);
      for (int i = 0; i < rows.size(); i++) {
        ElementKey key = keys.get(i);
        if (key == null || Math.floorMod(key.hashCode(), threads) != workerIndex) {
          continue;
        }
        List<Token> tokens = shard.computeIfAbsent(key, k -> new ArrayList<>());
        for (Token token : TokenParser.tokenize(rows.get(i).otherIds())) {
          tokens.add(token);
          tokensRead.inc();
          if (token.isFreeText()) {
            freeTextTokens.inc();
          }
        }
      }
      Map<ElementKey, ElementRecord> records = recordShards.get(workerIndex);
      for (var entry : shard.entrySet()) {
        ElementRecord built = builder.build(entry.getKey(), entry.getValue());
        referenceTokens.incBy(built.originalReferenceCount());
        danglingReferences.incBy(built.danglingReferenceCount());
        records.put(entry.getKey(), built);
      }
    });

    Map<ElementKey, List<Token>> allTokens = new HashMap<>();
    SortedMap<ElementKey, ElementRecord> allRecords = new TreeMap<>();
    for (int i = 0; i < threads; i++) {
      allTokens.putAll(tokenShards.get(i));
      allRecords.putAll(recordShards.get(i));
    }
    return new ParsedBatch(knownIds, TokenTable.of(allTokens), allRecords);
  }

  private ElementKey keyOf(int dataset, RawRow row) {
    ElementType type = ElementType.parse(row.osmType());
    if (type == null || row.osmId() == null || row.osmId() < 0) {
      rowsSkipped.inc();
      LOGGER.debug("skipping row with unusable key: {}", row);
      return null;
    }
    return new ElementKey(type, row.osmId(), dataset);
  }
}
