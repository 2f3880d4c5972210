package com.onthegomap.wdosm.store;

import com.onthegomap.wdosm.element.ElementKey;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory table of {@link ElementRow ElementRows}, partitioned by dataset.
 * <p>
 * Parse runs replace every row of their dataset at once and never touch rows of other datasets.
 */
public class RecordTable {

  private final Map<Integer, NavigableMap<ElementKey, ElementRow>> byDataset = new ConcurrentHashMap<>();

  /** Deletes every row of {@code dataset} then stores {@code rows}. */
  public void replaceDataset(int dataset, Collection<ElementRow> rows) {
    NavigableMap<ElementKey, ElementRow> fresh = new ConcurrentSkipListMap<>();
    for (ElementRow row : rows) {
      if (row.key().dataset() != dataset) {
        throw new IllegalArgumentException("Row " + row.key() + " is not part of dataset " + dataset);
      }
      if (fresh.put(row.key(), row) != null) {
        throw new IllegalArgumentException("Duplicate row for " + row.key() + " in dataset " + dataset);
      }
    }
    byDataset.put(dataset, fresh);
  }

  public void deleteDataset(int dataset) {
    byDataset.remove(dataset);
  }

  public Optional<ElementRow> get(ElementKey key) {
    var rows = byDataset.get(key.dataset());
    return rows == null ? Optional.empty() : Optional.ofNullable(rows.get(key));
  }

  /** Returns the rows of {@code dataset} ordered by type then id. */
  public List<ElementRow> rows(int dataset) {
    var rows = byDataset.get(dataset);
    return rows == null ? List.of() : List.copyOf(rows.values());
  }

  /** Returns the rows of {@code dataset} with an identifier of their own. */
  public List<ElementRow> resolvedRows(int dataset) {
    return rows(dataset).stream().filter(ElementRow::resolved).toList();
  }

  /** Returns the rows of {@code dataset} with candidate identifiers but none of their own. */
  public List<ElementRow> suspectRows(int dataset) {
    return rows(dataset).stream().filter(ElementRow::suspect).toList();
  }

  public int size(int dataset) {
    var rows = byDataset.get(dataset);
    return rows == null ? 0 : rows.size();
  }
}
