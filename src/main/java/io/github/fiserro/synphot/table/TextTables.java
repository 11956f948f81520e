package io.github.fiserro.synphot.table;

import io.github.fiserro.synphot.ReferenceDataException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Whitespace-separated text tables with {@code #} comment lines. */
final class TextTables {

  private TextTables() {}

  /** Non-comment, non-blank lines split into tokens. Lines with fewer than two are rejected. */
  static List<String[]> readRows(Path path, String name) {
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ReferenceDataException("Cannot read " + name + " (" + path + ")", e);
    }

    List<String[]> rows = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      String[] tokens = line.split("\\s+");
      if (tokens.length < 2) {
        throw new ReferenceDataException(
            "Error processing " + name + ": line " + (i + 1) + " has no value: '" + line + "'");
      }
      rows.add(tokens);
    }
    return rows;
  }
}
