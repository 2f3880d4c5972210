package com.onthegomap.wdosm.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.wdosm.parse.TokenParser;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RawRowCsvReaderTest {

  @Test
  void testReadFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("BR.wdDump.raw.csv");
    Files.writeString(file, """
      osm_type,osm_id,other_ids
      w,100,Q42 c u0qgbz9dns1 n10 n11
      n,10,
      r,7,"Q1, n10; w100"
      """);
    List<RawRow> rows = new RawRowCsvReader(file).readAll();
    assertEquals(3, rows.size());
    assertEquals(new RawRow("w", 100L, "Q42 c u0qgbz9dns1 n10 n11"), rows.get(0));
    assertEquals("n", rows.get(1).osmType());
    assertEquals(10L, rows.get(1).osmId());
    assertTrue(TokenParser.parse(rows.get(1).otherIds()).isEmpty());
    assertEquals("Q1, n10; w100", rows.get(2).otherIds());
  }

  @Test
  void testColumnsInAnyOrder() throws IOException {
    List<RawRow> rows = RawRowCsvReader.read(new StringReader("""
      other_ids,osm_id,osm_type
      n1,5,way
      """));
    assertEquals(List.of(new RawRow("way", 5L, "n1")), rows);
  }

  @Test
  void testEmptyFile() throws IOException {
    assertEquals(List.of(), RawRowCsvReader.read(new StringReader("osm_type,osm_id,other_ids\n")));
  }

  @Test
  void testMalformedRow() {
    StringReader input = new StringReader("""
      osm_type,osm_id,other_ids
      w,abc,n1
      """);
    assertThrows(IllegalArgumentException.class, () -> RawRowCsvReader.read(input));
  }

  @Test
  void testMissingFile(@TempDir Path dir) {
    RawRowCsvReader reader = new RawRowCsvReader(dir.resolve("missing.csv"));
    assertThrows(UncheckedIOException.class, reader::readAll);
  }
}
