package io.github.fiserro.synphot.table;

import io.github.fiserro.synphot.ReferenceDataException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/** Detector pixel scales (arcsec/pixel) keyed by {@code instrument,detector}. */
public class DetectorTable {

  private final String name;
  private final Map<String, Double> pixelScales;

  public DetectorTable(String name, Map<String, Double> pixelScales) {
    this.name = name;
    this.pixelScales = Map.copyOf(pixelScales);
  }

  public static DetectorTable read(Path path, String name) {
    Map<String, Double> scales = new LinkedHashMap<>();
    for (String[] tokens : TextTables.readRows(path, name)) {
      try {
        scales.putIfAbsent(tokens[0], Double.parseDouble(tokens[1]));
      } catch (NumberFormatException e) {
        throw new ReferenceDataException(
            "Error processing " + name + ": bad pixel scale for " + tokens[0], e);
      }
    }
    return new DetectorTable(name, scales);
  }

  public String name() {
    return name;
  }

  /** Pixel scale registered under exactly {@code key}. */
  public OptionalDouble pixelScale(String key) {
    Double scale = pixelScales.get(key);
    return scale == null ? OptionalDouble.empty() : OptionalDouble.of(scale);
  }
}
