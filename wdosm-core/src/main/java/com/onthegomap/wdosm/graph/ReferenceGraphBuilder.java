package com.onthegomap.wdosm.graph;

import com.carrotsearch.hppc.LongObjectHashMap;
import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.element.ElementType;
import com.onthegomap.wdosm.parse.ElementRecord;
import com.onthegomap.wdosm.parse.KnownIdFilter;
import com.onthegomap.wdosm.parse.Token;
import com.onthegomap.wdosm.parse.TokenTable;
import com.onthegomap.wdosm.util.Hppc;
import com.onthegomap.wdosm.worker.Worker;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link ReferenceGraph} of a parse run from the reference tokens of every element.
 * <p>
 * A reference token only becomes an edge when its id passes the {@link KnownIdFilter}. The referenced element's type
 * comes from the records of the run: the element whose type matches the token kind when there is one, otherwise the
 * first element with that id in key order.
 */
public class ReferenceGraphBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceGraphBuilder.class);
  private final KnownIdFilter knownIds;
  private final int threads;

  public ReferenceGraphBuilder(KnownIdFilter knownIds, int threads) {
    this.knownIds = knownIds;
    this.threads = threads;
  }

  public ReferenceGraph build(Map<ElementKey, ElementRecord> records, TokenTable tokens) {
    LongObjectHashMap<List<ElementKey>> keysById = indexById(records);
    List<ElementRecord> containers = new ArrayList<>(records.values());
    Set<ReferenceEdge> edges = ConcurrentHashMap.newKeySet();
    Worker.runShards("edges", threads, workerIndex -> {
      for (int i = workerIndex; i < containers.size(); i += threads) {
        ElementRecord container = containers.get(i);
        for (Token token : tokens.get(container.key())) {
          if (token.isReference() && knownIds.contains(token.value())) {
            ElementKey referenced = resolve(keysById, token);
            if (referenced != null) {
              edges.add(new ReferenceEdge(container.key(), container.wdId(), referenced));
            }
          }
        }
      }
    });
    ReferenceGraph graph = ReferenceGraph.of(edges);
    LOGGER.info("{} edges between {} elements", graph.size(), records.size());
    return graph;
  }

  private static LongObjectHashMap<List<ElementKey>> indexById(Map<ElementKey, ElementRecord> records) {
    LongObjectHashMap<List<ElementKey>> result = Hppc.newLongObjectHashMap();
    for (ElementKey key : records.keySet()) {
      List<ElementKey> keys = result.get(key.id());
      if (keys == null) {
        result.put(key.id(), keys = new ArrayList<>(1));
      }
      keys.add(key);
    }
    for (var cursor : result) {
      cursor.value.sort(null);
    }
    return result;
  }

  private static ElementKey resolve(LongObjectHashMap<List<ElementKey>> keysById, Token token) {
    List<ElementKey> candidates = keysById.get(token.value());
    if (candidates == null || candidates.isEmpty()) {
      // the id was in the raw batch, but only on rows that were skipped
      return null;
    }
    ElementType wanted = ElementType.fromCode(token.kind());
    for (ElementKey key : candidates) {
      if (key.type() == wanted) {
        return key;
      }
    }
    return candidates.get(0);
  }
}
