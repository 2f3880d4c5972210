package com.onthegomap.wdosm.writer;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.onthegomap.wdosm.resolve.ClosureResult;
import com.onthegomap.wdosm.store.ElementRow;
import com.onthegomap.wdosm.store.RecordTable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the rows of one dataset to {@code <NAME>.wdDump.csv} (elements with an identifier of their own) and
 * {@code <NAME>.noWdId.csv} (suspects: elements with candidate identifiers but none of their own).
 */
public class CsvExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvExporter.class);
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final CsvSchema RESOLVED_SCHEMA = schema(ResolvedRow.class);
  private static final CsvSchema SUSPECT_SCHEMA = schema(SuspectRow.class);
  private static final ObjectMapper JSON = new ObjectMapper();
  private final Path outputDir;
  private final String name;

  public CsvExporter(Path outputDir, String name) {
    this.outputDir = outputDir;
    this.name = name;
  }

  private static CsvSchema schema(Class<?> clazz) {
    return MAPPER.schemaFor(clazz).withHeader().withLineSeparator("\n");
  }

  @JsonPropertyOrder({"osm_type", "osm_id", "wd_id", "centroid"})
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ResolvedRow(String osmType, long osmId, String wdId, String centroid) {}

  @JsonPropertyOrder({"osm_type", "osm_id", "wd_member_ids"})
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SuspectRow(String osmType, long osmId, String wdMemberIds) {}

  public Path resolvedFile() {
    return outputDir.resolve(name + ".wdDump.csv");
  }

  public Path suspectFile() {
    return outputDir.resolve(name + ".noWdId.csv");
  }

  /**
   * Writes both files for {@code dataset} and returns a one-line summary.
   *
   * @throws UncheckedIOException if a file cannot be written
   */
  public String export(RecordTable table, int dataset) {
    List<ResolvedRow> resolved = table.resolvedRows(dataset).stream()
      .map(row -> new ResolvedRow(typeCode(row), row.key().id(), "Q" + row.record().wdId(), row.record().centroid()))
      .toList();
    List<SuspectRow> suspects = table.suspectRows(dataset).stream()
      .map(row -> new SuspectRow(typeCode(row), row.key().id(), memberIdsJson(row.members().orElseThrow())))
      .toList();
    write(resolvedFile(), RESOLVED_SCHEMA, resolved);
    write(suspectFile(), SUSPECT_SCHEMA, suspects);
    LOGGER.info("wrote {} resolved and {} suspect rows", resolved.size(), suspects.size());
    return "Files written at " + outputDir.resolve(name) + ".*.csv: " + resolved.size() + " resolved, " +
      suspects.size() + " suspects";
  }

  /** Renders the identifier counts of {@code result} as a JSON object like {@code {"Q42":2,"Q0":1}}. */
  public static String memberIdsJson(ClosureResult result) {
    Map<String, Integer> byId = new LinkedHashMap<>();
    result.memberCounts().forEach((id, count) -> byId.put("Q" + id, count));
    try {
      return JSON.writeValueAsString(byId);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode " + byId, e);
    }
  }

  private static String typeCode(ElementRow row) {
    return String.valueOf(row.key().type().code());
  }

  private static void write(Path path, CsvSchema schema, List<?> rows) {
    try {
      Files.createDirectories(path.toAbsolutePath().getParent());
      try (var out = Files.newBufferedWriter(path)) {
        if (rows.isEmpty()) {
          // the header is only emitted along with the first row
          List<String> columns = new ArrayList<>();
          schema.forEach(column -> columns.add(column.getName()));
          out.write(String.join(",", columns) + "\n");
        } else {
          MAPPER.writer(schema).writeValues(out).writeAll(rows).close();
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + path, e);
    }
  }
}
