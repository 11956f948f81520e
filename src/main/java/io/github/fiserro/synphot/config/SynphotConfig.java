package io.github.fiserro.synphot.config;

import io.github.fiserro.synphot.spectrum.WaveSets;
import io.github.fiserro.synphot.table.ReferenceFiles;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import lombok.extern.jackson.Jacksonized;

/**
 * Configuration of the reference data used to resolve observation modes. Every value has a
 * default, so a JSON file only needs the entries it changes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Accessors(fluent = true)
public class SynphotConfig {

  /** Reference data alias always mapped to {@link #rootDir}. */
  public static final String ROOT_ALIAS = "crrefer";

  /** Root of the reference data tree. */
  @Builder.Default
  String rootDir = "cdbs";

  /** Extra {@code prefix$} aliases; relative directories resolve against {@link #rootDir}. */
  @Builder.Default
  Map<String, String> directoryAliases = Map.of();

  @Builder.Default
  String graphTable = "mtab/graph.json";

  @Builder.Default
  String componentTable = "mtab/comp.json";

  @Builder.Default
  String thermalTable = "mtab/therm.json";

  @Builder.Default
  String waveCatalog = "wavecat.dat";

  @Builder.Default
  String detectorTable = "detectors.dat";

  /**
   * Calibration spectrum whose wavelength range bounds thermal spectra; {@code null} disables
   * the bound.
   */
  @Builder.Default
  String calibrationSpectrum = "calspec/alpha_lyr_stis.dat";

  /** Collecting area in cm^2, used when the graph table does not declare one. */
  @Builder.Default
  double primaryArea = 45238.93416;

  @Builder.Default
  double defaultWaveSetMin = 500.0;

  @Builder.Default
  double defaultWaveSetMax = 26000.0;

  @Builder.Default
  int defaultWaveSetCount = 10000;

  @Builder.Default
  boolean defaultWaveSetLog = true;

  /** Default wavelength grid described by the {@code defaultWaveSet*} settings. */
  public double[] defaultWaveSet() {
    return defaultWaveSetLog
        ? WaveSets.logSpaced(defaultWaveSetMin, defaultWaveSetMax, defaultWaveSetCount)
        : WaveSets.linearSpaced(defaultWaveSetMin, defaultWaveSetMax, defaultWaveSetCount);
  }

  /** File resolver for {@link #rootDir} and the configured aliases. */
  public ReferenceFiles referenceFiles() {
    Path root = Path.of(rootDir);
    Map<String, Path> aliases = new HashMap<>();
    aliases.put(ROOT_ALIAS, root);
    directoryAliases.forEach((prefix, dir) -> aliases.put(prefix, root.resolve(dir)));
    return new ReferenceFiles(root, aliases);
  }
}
