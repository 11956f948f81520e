package io.github.fiserro.synphot.spectrum;

import io.github.fiserro.synphot.ReferenceDataException;
import io.github.fiserro.synphot.table.ReferenceFiles;
import io.github.fiserro.synphot.table.ReferenceName;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads spectral curves from ASCII reference files.
 *
 * <p>File layout:
 * <ul>
 *   <li>lines starting with {@code #} are comments; {@code # key = value} comments are header
 *       metadata (e.g. {@code temperature}, {@code beamfill})</li>
 *   <li>data lines are whitespace separated numbers, wavelength (Angstrom) first</li>
 *   <li>parameterized families start with a column header line such as
 *       {@code wavelength throughput mjd#52000 mjd#56000}</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class SpectrumFileReader {

  static final String TEMPERATURE = "temperature";
  static final String BEAM_FILL = "beamfill";

  private final ReferenceFiles referenceFiles;

  /** Two-column throughput curve named after its reference name. */
  public TabularSpectralElement readThroughput(String refName) {
    Table table = read(refName);
    return new TabularSpectralElement(refName, table.column(0), table.column(1));
  }

  /**
   * Two-column emissivity curve. The {@code temperature} header is mandatory, {@code beamfill}
   * defaults to 1.
   */
  public ThermalSpectralElement readThermal(String refName) {
    Table table = read(refName);
    double temperature = table.metadata(TEMPERATURE, null);
    double beamFill = table.metadata(BEAM_FILL, 1.0);
    return new ThermalSpectralElement(
        refName, table.column(0), table.column(1), temperature, beamFill);
  }

  /**
   * Parameterized throughput family. {@code refName} carries the {@code [key#]} marker that
   * selects the parameter columns.
   */
  public ParameterizedThroughput readFamily(String refName) {
    ReferenceName reference = ReferenceName.parse(refName);
    if (!reference.isParameterized()) {
      throw new ReferenceDataException(refName + " has no parameter marker");
    }
    Table table = read(reference.bareName());
    if (table.header == null) {
      throw new ReferenceDataException(refName + " has no column header line");
    }

    String prefix = reference.parameterKey() + "#";
    double[] defaultThroughput = null;
    Map<Double, double[]> columns = new LinkedHashMap<>();
    for (int c = 1; c < table.header.size(); c++) {
      String columnName = table.header.get(c).toLowerCase(Locale.ROOT);
      if (columnName.equals("throughput")) {
        defaultThroughput = table.column(c);
      } else if (columnName.startsWith(prefix)) {
        columns.put(parseNumber(columnName.substring(prefix.length()), refName), table.column(c));
      } else {
        log.debug("Ignoring column '{}' of {}", columnName, refName);
      }
    }
    if (columns.isEmpty()) {
      throw new ReferenceDataException(refName + " has no " + prefix + " columns");
    }
    return new ParameterizedThroughput(reference.bareName(), reference.parameterKey(),
        table.column(0), defaultThroughput, columns);
  }

  /** Two-column flux spectrum in photlam. */
  public SourceSpectrum readSource(String refName) {
    Table table = read(refName);
    return new SourceSpectrum(refName, table.column(0), table.column(1));
  }

  /** Single column of wavelengths. */
  public double[] readWavelengths(String refName) {
    return read(refName).column(0);
  }

  private Table read(String refName) {
    Path path = referenceFiles.resolve(refName);
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ReferenceDataException("Cannot read " + refName + " (" + path + ")", e);
    }

    Table table = new Table(refName);
    for (String raw : lines) {
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith("#")) {
        table.parseMetadata(line.substring(1));
        continue;
      }
      String[] tokens = line.split("\\s+");
      if (table.rows.isEmpty() && table.header == null && !isNumeric(tokens[0])) {
        table.header = List.of(tokens);
        continue;
      }
      double[] row = new double[tokens.length];
      for (int i = 0; i < tokens.length; i++) {
        row[i] = parseNumber(tokens[i], refName);
      }
      table.rows.add(row);
    }
    table.checkAscending();
    log.debug("Read {} rows from {}", table.rows.size(), path);
    return table;
  }

  private static boolean isNumeric(String token) {
    try {
      Double.parseDouble(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static double parseNumber(String token, String refName) {
    try {
      return Double.parseDouble(token);
    } catch (NumberFormatException e) {
      throw new ReferenceDataException("Non-numeric value '" + token + "' in " + refName, e);
    }
  }

  private static final class Table {

    private final String refName;
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private final List<double[]> rows = new ArrayList<>();
    private List<String> header;

    private Table(String refName) {
      this.refName = refName;
    }

    private void parseMetadata(String comment) {
      int eq = comment.indexOf('=');
      if (eq > 0) {
        metadata.put(comment.substring(0, eq).strip().toLowerCase(Locale.ROOT),
            comment.substring(eq + 1).strip());
      }
    }

    private double metadata(String key, Double defaultValue) {
      String value = metadata.get(key);
      if (value == null) {
        if (defaultValue == null) {
          throw new ReferenceDataException(refName + " has no '" + key + "' header");
        }
        return defaultValue;
      }
      return parseNumber(value, refName);
    }

    private double[] column(int index) {
      if (rows.isEmpty()) {
        throw new ReferenceDataException(refName + " contains no data");
      }
      double[] result = new double[rows.size()];
      for (int r = 0; r < rows.size(); r++) {
        double[] row = rows.get(r);
        if (index >= row.length) {
          throw new ReferenceDataException(
              refName + " row " + (r + 1) + " has no column " + (index + 1));
        }
        result[r] = row[index];
      }
      return result;
    }

    private void checkAscending() {
      for (int r = 1; r < rows.size(); r++) {
        if (rows.get(r)[0] <= rows.get(r - 1)[0]) {
          throw new ReferenceDataException(
              refName + " wavelengths are not strictly ascending at row " + (r + 1));
        }
      }
    }
  }
}
