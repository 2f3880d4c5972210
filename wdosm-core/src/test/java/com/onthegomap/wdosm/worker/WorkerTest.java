package com.onthegomap.wdosm.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.wdosm.util.Exceptions;
import com.onthegomap.wdosm.util.LogUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class WorkerTest {

  @AfterEach
  void clearLogTags() {
    LogUtil.clear();
  }

  @Test
  @Timeout(10)
  void testEveryShardRunsOnItsOwnThread() {
    Set<Integer> seen = new ConcurrentSkipListSet<>();
    Set<String> threadNames = new ConcurrentSkipListSet<>();
    Worker.runShards("test", 4, shard -> {
      seen.add(shard);
      threadNames.add(Thread.currentThread().getName());
    });
    assertEquals(Set.of(0, 1, 2, 3), seen);
    assertEquals(Set.of("test-0", "test-1", "test-2", "test-3"), threadNames);
  }

  @Test
  @Timeout(10)
  void testShardsInheritDatasetAndStage() {
    LogUtil.setDataset(3);
    LogUtil.setStage("resolve");
    Set<String> stages = new ConcurrentSkipListSet<>();
    Set<Integer> datasets = new ConcurrentSkipListSet<>();
    Worker.runShards("closure", 2, shard -> {
      stages.add(LogUtil.getStage());
      datasets.add(LogUtil.getDataset());
    });
    assertEquals(Set.of("resolve:closure"), stages);
    assertEquals(Set.of(3), datasets);
    assertEquals("resolve", LogUtil.getStage());
  }

  @Test
  @Timeout(10)
  void testFailingShardStopsTheOthers() {
    class ExpectedException extends RuntimeException {}
    var thrown = assertThrows(ExpectedException.class, () -> Worker.runShards("fail", 4, shard -> {
      if (shard == 1) {
        throw new ExpectedException();
      } else {
        Thread.sleep(5000);
      }
    }));
    assertInstanceOf(ExpectedException.class, thrown);
  }

  @Test
  @Timeout(10)
  void testCheckedFailureIsWrapped() {
    IOException cause = new IOException("disk");
    var thrown = assertThrows(UncheckedIOException.class, () -> Worker.runShards("io", 1, shard -> {
      throw cause;
    }));
    assertSame(cause, thrown.getCause());

    var stageFailure = assertThrows(Exceptions.StageFailedException.class, () -> Worker.runShards("other", 2, shard -> {
      throw new Exception("boom");
    }));
    assertEquals("other", stageFailure.stage());
  }

  @Test
  void testRejectsZeroShards() {
    assertThrows(IllegalArgumentException.class, () -> Worker.runShards("none", 0, shard -> {
    }));
  }

  @Test
  @Timeout(10)
  void testCallerWithoutTags() {
    Set<String> stages = new ConcurrentSkipListSet<>();
    Worker.runShards("solo", 1, shard -> stages.add(LogUtil.getStage()));
    assertEquals(Set.of("solo"), stages);
    assertNull(LogUtil.getStage());
    assertTrue(LogUtil.capture().isEmpty());
  }
}
