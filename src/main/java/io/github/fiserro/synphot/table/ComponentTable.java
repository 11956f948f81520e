package io.github.fiserro.synphot.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fiserro.synphot.ComponentNotFoundException;
import io.github.fiserro.synphot.ReferenceDataException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Component table mapping component names to the reference files holding their curves. Used for
 * both throughput and thermal (emissivity) tables.
 */
@Slf4j
public class ComponentTable {

  /** Component that is part of a chain but neither attenuates nor emits. */
  public static final String CLEAR = "clear";

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Row(String compname, String filename) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Contents(List<Row> rows) {}

  private final String name;
  private final Map<String, String> fileNames = new LinkedHashMap<>();

  public ComponentTable(String name, List<Row> rows) {
    this.name = name;
    // first entry wins on duplicated names
    rows.forEach(row -> fileNames.putIfAbsent(row.compname(), row.filename().strip()));
  }

  /** Reads a JSON component table: {@code {"rows": [{"compname": ..., "filename": ...}]}}. */
  public static ComponentTable read(Path path, String name, ObjectMapper objectMapper) {
    try {
      Contents contents = objectMapper.readValue(path.toFile(), Contents.class);
      if (contents.rows() == null) {
        throw new ReferenceDataException("Component table " + name + " has no rows");
      }
      log.debug("Loaded component table {} with {} rows", name, contents.rows().size());
      return new ComponentTable(name, contents.rows());
    } catch (IOException e) {
      throw new ReferenceDataException(
          "Cannot read component table " + name + " (" + path + ")", e);
    }
  }

  public static boolean isClear(String name) {
    return name == null || name.isEmpty() || CLEAR.equals(name);
  }

  public String name() {
    return name;
  }

  /**
   * File holding the curve of {@code compname}, or {@link #CLEAR} for clear components.
   *
   * @throws ComponentNotFoundException if the name is not in this table
   */
  public String lookup(String compname) {
    if (isClear(compname)) {
      return CLEAR;
    }
    String fileName = fileNames.get(compname);
    if (fileName == null) {
      throw new ComponentNotFoundException(
          "Can't find " + compname + " in comptable " + name);
    }
    return fileName;
  }

  /** {@link #lookup} applied to a whole chain, order preserved. */
  public List<String> fileNames(List<String> compnames) {
    return compnames.stream().map(this::lookup).toList();
  }
}
