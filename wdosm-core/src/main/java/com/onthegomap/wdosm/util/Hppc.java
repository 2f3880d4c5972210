package com.onthegomap.wdosm.util;

import com.carrotsearch.hppc.LongHashSet;
import com.carrotsearch.hppc.LongIntHashMap;
import com.carrotsearch.hppc.LongObjectHashMap;

/**
 * Static factory methods for <a href="https://github.com/carrotsearch/hppc">High Performance Primitive
 * Collections</a>.
 */
public class Hppc {

  private Hppc() {}

  public static LongHashSet newLongHashSet() {
    return new LongHashSet(10, 0.75);
  }

  public static LongIntHashMap newLongIntHashMap() {
    return new LongIntHashMap(10, 0.75);
  }

  public static <T> LongObjectHashMap<T> newLongObjectHashMap() {
    return new LongObjectHashMap<>(10, 0.75);
  }
}
