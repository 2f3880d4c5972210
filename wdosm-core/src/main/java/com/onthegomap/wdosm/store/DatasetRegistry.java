package com.onthegomap.wdosm.store;

import com.onthegomap.wdosm.config.Arguments;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out dataset ids and remembers which abbreviation they belong to.
 */
@ThreadSafe
public class DatasetRegistry {

  static final String DEFAULT_NAME = "Installation tests, CHANGE this title";
  static final String DEFAULT_CURATOR = "no-curation, CHANGE here";
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRegistry.class);
  private final List<Dataset> datasets = new ArrayList<>();
  private final Map<String, Dataset> byAbbrev = new HashMap<>();
  private final Clock clock;

  public DatasetRegistry() {
    this(Clock.systemDefaultZone());
  }

  DatasetRegistry(Clock clock) {
    this.clock = clock;
  }

  /** Registers the dataset described by {@code abbrev}, {@code dataset_name} and {@code curator} and logs it. */
  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Dataset dataset = new DatasetRegistry().register(
      arguments.getString("abbrev|name", "dataset abbreviation", null),
      arguments.getString("dataset_name", "dataset title", null),
      arguments.getString("curator", "curator of the dataset", null)
    );
    LOGGER.info("dataset {}: {}", dataset.id(), dataset);
  }

  /**
   * Registers a dataset and returns it, or returns the existing one when {@code abbrev} is taken.
   * <p>
   * Blank arguments get placeholder values that curators are expected to replace.
   */
  public synchronized Dataset register(String abbrev, String name, String curator) {
    String actualAbbrev = StringUtils.isNotBlank(abbrev) ? abbrev.strip() :
      "inst-test-num" + clock.millis();
    Dataset existing = byAbbrev.get(actualAbbrev);
    if (existing != null) {
      return existing;
    }
    Dataset dataset = new Dataset(
      datasets.size() + 1,
      actualAbbrev,
      StringUtils.defaultIfBlank(name, DEFAULT_NAME),
      StringUtils.defaultIfBlank(curator, DEFAULT_CURATOR),
      LocalDate.now(clock)
    );
    datasets.add(dataset);
    byAbbrev.put(actualAbbrev, dataset);
    LOGGER.info("registered dataset {} as {}", actualAbbrev, dataset.id());
    return dataset;
  }

  public synchronized Optional<Dataset> get(int id) {
    return id >= 1 && id <= datasets.size() ? Optional.of(datasets.get(id - 1)) : Optional.empty();
  }

  /** Returns the abbreviation of dataset {@code id}, or null when there is none. */
  public synchronized String abbrev(int id) {
    return get(id).map(Dataset::abbrev).orElse(null);
  }

  public synchronized Optional<Dataset> byAbbrev(String abbrev) {
    return Optional.ofNullable(byAbbrev.get(abbrev));
  }
}
