package com.onthegomap.wdosm.reader;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a raw dump CSV with an {@code osm_type,osm_id,other_ids} header.
 */
public class RawRowCsvReader implements RawRowSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(RawRowCsvReader.class);
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final CsvSchema SCHEMA = MAPPER
    .schemaFor(RawRow.class)
    .withHeader()
    .withColumnReordering(true);
  private static final ObjectReader READER = MAPPER.readerFor(RawRow.class).with(SCHEMA);
  private final Path path;

  public RawRowCsvReader(Path path) {
    this.path = path;
  }

  /**
   * Returns every row in the file.
   *
   * @throws UncheckedIOException     if the file cannot be read
   * @throws IllegalArgumentException if a line cannot be mapped to a row
   */
  @Override
  public List<RawRow> readAll() {
    try (var reader = Files.newBufferedReader(path)) {
      List<RawRow> rows = read(reader);
      LOGGER.info("read {} rows from {}", rows.size(), path.toAbsolutePath());
      return rows;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + path, e);
    }
  }

  static List<RawRow> read(Reader input) throws IOException {
    List<RawRow> result = new ArrayList<>();
    try (var iterator = READER.<RawRow>readValues(input)) {
      while (iterator.hasNext()) {
        result.add(iterator.next());
      }
    } catch (RuntimeJsonMappingException e) {
      throw new IllegalArgumentException("Malformed raw row: " + e.getMessage(), e);
    }
    return result;
  }
}
