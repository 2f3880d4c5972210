package com.onthegomap.wdosm.resolve;

import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.graph.ReferenceEdge;
import com.onthegomap.wdosm.graph.ReferenceGraph;
import com.onthegomap.wdosm.stats.Counter;
import com.onthegomap.wdosm.stats.Stats;
import com.onthegomap.wdosm.worker.Worker;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The thorough closure strategy: climbs from each target element to its containers, their containers, and so on.
 * <p>
 * Every target starts with a one-entry path holding only a seed. Each layer extends every path by one edge whose
 * referenced element is the path's current element, recording the container's identifier (0 when missing) and key. A
 * step onto an edge from an element to itself is skipped. Longer cycles are only cut by {@code maxDepth}: a path
 * holding {@code maxDepth} entries, seed included, is never extended.
 * <p>
 * Every extended path contributes all of its recorded pairs to its target, so nearer containers are counted once per
 * path running through them. All targets advance together one layer at a time. A layer is split across worker threads
 * and the next layer starts only after all of them finished.
 */
public class BoundedClosureResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundedClosureResolver.class);
  private final ReferenceGraph graph;
  private final int maxDepth;
  private final int threads;
  private final Counter.MultiThreadCounter pathCounter;
  private final Counter.MultiThreadCounter truncatedCounter;

  public BoundedClosureResolver(ReferenceGraph graph, int maxDepth, int threads, Stats stats) {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be >= 1, was " + maxDepth);
    }
    this.graph = graph;
    this.maxDepth = maxDepth;
    this.threads = threads;
    this.pathCounter = stats.longCounter("closure_paths");
    this.truncatedCounter = stats.longCounter("closure_paths_truncated");
  }

  /** A path from a target up through its containers, stored as a chain back to the seed. */
  private record Path(ElementKey target, ElementKey current, Candidate pair, Path parent, int length) {

    static Path seed(ElementKey target) {
      return new Path(target, target, null, null, 1);
    }

    Path extend(ReferenceEdge edge) {
      return new Path(target, edge.container(), new Candidate(edge.containerWdIdOrZero(), edge.container()), this,
        length + 1);
    }

    void addPairsTo(List<Candidate> out) {
      for (Path p = this; p.pair != null; p = p.parent) {
        out.add(p.pair);
      }
    }
  }

  /** Returns the non-empty candidate multisets of every element in {@code targets}. */
  public Map<ElementKey, List<Candidate>> resolveAll(Collection<ElementKey> targets) {
    List<Path> frontier = new ArrayList<>();
    for (ElementKey target : targets) {
      if (!graph.incoming(target).isEmpty()) {
        frontier.add(Path.seed(target));
      }
    }
    Map<ElementKey, List<Candidate>> result = new TreeMap<>();
    int depth = 1;
    while (!frontier.isEmpty()) {
      frontier = expandLayer(frontier, result);
      depth++;
      LOGGER.debug("layer {}: {} paths", depth, frontier.size());
    }
    return result;
  }

  /** Returns the candidates of {@code target} alone. */
  public List<Candidate> candidates(ElementKey target) {
    return resolveAll(List.of(target)).getOrDefault(target, List.of());
  }

  private List<Path> expandLayer(List<Path> frontier, Map<ElementKey, List<Candidate>> result) {
    int shards = Math.min(threads, frontier.size());
    List<List<Path>> nextShards = new ArrayList<>(shards);
    List<Map<ElementKey, List<Candidate>>> pairShards = new ArrayList<>(shards);
    for (int i = 0; i < shards; i++) {
      nextShards.add(new ArrayList<>());
      pairShards.add(new HashMap<>());
    }
    Worker.runShards("closure", shards, workerIndex -> {
      List<Path> next = nextShards.get(workerIndex);
      Map<ElementKey, List<Candidate>> pairs = pairShards.get(workerIndex);
      for (int i = workerIndex; i < frontier.size(); i += shards) {
        Path path = frontier.get(i);
        for (ReferenceEdge edge : graph.incoming(path.current())) {
          if (edge.container().equals(path.current())) {
            continue;
          }
          if (path.length() >= maxDepth) {
            truncatedCounter.inc();
            break;
          }
          Path extended = path.extend(edge);
          pathCounter.inc();
          extended.addPairsTo(pairs.computeIfAbsent(extended.target(), k -> new ArrayList<>()));
          next.add(extended);
        }
      }
    });
    List<Path> nextFrontier = new ArrayList<>();
    for (int i = 0; i < shards; i++) {
      nextFrontier.addAll(nextShards.get(i));
      pairShards.get(i).forEach((target, pairs) -> result.computeIfAbsent(target, k -> new ArrayList<>()).addAll(pairs));
    }
    return nextFrontier;
  }
}
