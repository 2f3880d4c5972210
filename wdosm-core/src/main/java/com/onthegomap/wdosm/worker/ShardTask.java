package com.onthegomap.wdosm.worker;

/**
 * The work for one shard of a {@link Worker} step, given the shard's index.
 */
@FunctionalInterface
public interface ShardTask {

  @SuppressWarnings("java:S112")
  void run(int shard) throws Exception;
}
