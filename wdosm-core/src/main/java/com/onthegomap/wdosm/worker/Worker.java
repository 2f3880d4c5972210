package com.onthegomap.wdosm.worker;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.onthegomap.wdosm.util.Exceptions;
import com.onthegomap.wdosm.util.LogUtil;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits one step of a parse run into shards and runs each shard on its own daemon thread.
 * <p>
 * Shard threads are named {@code <name>-<n>} and log with the caller's dataset and stage plus {@code :<name>}. The
 * caller blocks until every shard has finished. When a shard fails, the remaining shards are interrupted and the
 * failure is rethrown on the calling thread.
 */
public final class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);

  private Worker() {}

  /**
   * Runs {@code task} for shards {@code 0} to {@code shards - 1} in parallel and waits for all of them.
   *
   * @throws IllegalArgumentException if {@code shards < 1}
   * @throws RuntimeException         the first shard failure, made unchecked by {@link Exceptions#unchecked}
   */
  public static void runShards(String name, int shards, ShardTask task) {
    Preconditions.checkArgument(shards >= 1, "%s needs at least one shard, got %s", name, shards);
    ExecutorService pool = Executors.newFixedThreadPool(shards,
      new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
    CompletionService<Integer> completion = new ExecutorCompletionService<>(pool);
    Map<String, String> context = LogUtil.capture();
    for (int i = 0; i < shards; i++) {
      int shard = i;
      completion.submit(() -> {
        LogUtil.restore(context);
        LogUtil.enterSubStage(name);
        try {
          task.run(shard);
          return shard;
        } finally {
          LogUtil.clear();
        }
      });
    }
    pool.shutdown();
    try {
      for (int finished = 0; finished < shards; finished++) {
        awaitNext(name, completion);
      }
    } catch (InterruptedException e) {
      throw Exceptions.unchecked(name, e);
    } finally {
      pool.shutdownNow();
    }
  }

  private static void awaitNext(String name, CompletionService<Integer> completion) throws InterruptedException {
    try {
      int shard = completion.take().get();
      LOGGER.trace("{} shard {} done", name, shard);
    } catch (ExecutionException e) {
      Throwable failure = e.getCause() == null ? e : e.getCause();
      LOGGER.error("{} shard failed, stopping the others", name, failure);
      throw Exceptions.unchecked(name, failure);
    }
  }
}
