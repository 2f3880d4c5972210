package com.onthegomap.wdosm.reader;

import java.util.List;

/**
 * Delivers the raw rows of one dataset to a parse run.
 */
@FunctionalInterface
public interface RawRowSource {

  /** Returns every row of the batch, in file order. */
  List<RawRow> readAll();

  static RawRowSource of(List<RawRow> rows) {
    return () -> rows;
  }
}
