package io.github.fiserro.synphot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Suppliers;
import io.github.fiserro.synphot.component.Component;
import io.github.fiserro.synphot.component.ComponentBuilder;
import io.github.fiserro.synphot.component.ComponentCache;
import io.github.fiserro.synphot.component.ThermalComponent;
import io.github.fiserro.synphot.compose.OpticalComposer;
import io.github.fiserro.synphot.compose.SensitivityComposer;
import io.github.fiserro.synphot.compose.ThermalComposer;
import io.github.fiserro.synphot.config.SynphotConfig;
import io.github.fiserro.synphot.mode.BinnedWaveSets;
import io.github.fiserro.synphot.mode.ModeParser;
import io.github.fiserro.synphot.mode.ParsedMode;
import io.github.fiserro.synphot.table.ComponentChain;
import io.github.fiserro.synphot.table.ComponentTable;
import io.github.fiserro.synphot.table.GraphTable;
import io.github.fiserro.synphot.table.ReferenceTables;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves observation-mode strings into {@link ObservationMode}s.
 *
 * <p>Owns the reference table cache and the built-component cache; both live as long as the
 * resolver and are shared by every mode it resolves. Safe for use from several threads.
 */
@Slf4j
public class ObservationModeResolver {

  /** Thermal names that mean "no thermal model" for their position in the chain. */
  private static final Set<String> NON_THERMAL_NAMES = Set.of(ComponentTable.CLEAR, "", "0.0");

  @Getter
  @Accessors(fluent = true)
  private final SynphotConfig config;

  @Getter
  @Accessors(fluent = true)
  private final ComponentCache componentCache;

  private final ReferenceTables tables;
  private final ModeParser parser = new ModeParser();
  private final ComponentBuilder componentBuilder;
  private final BinnedWaveSets binnedWaveSets;
  private final OpticalComposer opticalComposer = new OpticalComposer();
  private final SensitivityComposer sensitivityComposer =
      new SensitivityComposer(opticalComposer);
  private final Supplier<ThermalComposer> thermalComposer =
      Suppliers.memoize(this::createThermalComposer);

  public ObservationModeResolver(SynphotConfig config) {
    this(config, new ReferenceTables(config.referenceFiles(), new ObjectMapper()),
        new ComponentCache());
  }

  public ObservationModeResolver(SynphotConfig config, ReferenceTables tables,
      ComponentCache componentCache) {
    this.config = config;
    this.tables = tables;
    this.componentCache = componentCache;
    this.componentBuilder = new ComponentBuilder(tables.spectrumReader());
    this.binnedWaveSets = new BinnedWaveSets(tables.spectrumReader());
  }

  /**
   * Parses {@code modeString}, walks the graph table and builds the optical components.
   *
   * @throws ModeParseException on malformed mode syntax
   * @throws ModeResolutionException when the graph table cannot resolve the keywords
   * @throws ComponentNotFoundException when a component is missing from the component table
   * @throws ParameterOutOfRangeException when a parameter lies outside its component's grid
   */
  public ObservationMode resolveMode(String modeString) {
    ParsedMode parsed = parser.parse(modeString);

    GraphTable graphTable = tables.graphTable(config.graphTable());
    ComponentChain chain = graphTable.resolve(parsed.keywords());

    List<String> throughputFiles =
        tables.componentTable(config.componentTable()).fileNames(chain.opticalNames());
    List<Component> components = new ArrayList<>();
    for (String fileName : throughputFiles) {
      Component component = componentBuilder.build(fileName, parsed.parameters(), componentCache);
      if (!component.isEmpty()) {
        components.add(component);
      }
    }
    log.debug("Resolved {} -> {} ({} non-empty components)",
        parsed.modeString(), chain.opticalNames(), components.size());

    Supplier<Optional<String>> binset = Suppliers.memoize(
        () -> tables.waveCatalog(config.waveCatalog()).lookup(parsed.modeString()));

    return ObservationMode.builder()
        .parsed(parsed)
        .chain(chain)
        .throughputFileNames(throughputFiles)
        .components(components)
        .primaryArea(graphTable.primaryArea().orElse(config.primaryArea()))
        .binnedWaveSetSpec(binset)
        .binnedWavelengths(Suppliers.memoize(() -> binnedWavelengths(parsed, binset.get())))
        .thermalComponents(Suppliers.memoize(
            () -> thermalComponents(parsed, chain, throughputFiles)))
        .pixelScale(Suppliers.memoize(() -> pixelScale(parsed)))
        .opticalComposer(opticalComposer)
        .sensitivityComposer(sensitivityComposer)
        .thermalComposer(thermalComposer)
        .build();
  }

  private List<ThermalComponent> thermalComponents(
      ParsedMode parsed, ComponentChain chain, List<String> throughputFiles) {
    List<String> thermalNames = chain.thermalNames();
    if (thermalNames.stream().allMatch(NON_THERMAL_NAMES::contains)) {
      throw new ThermalUnsupportedException(
          "No thermal support provided for " + parsed.modeString());
    }
    if (thermalNames.size() != throughputFiles.size()) {
      throw new BrokenChainException(String.format(
          "Cannot calculate thermal spectrum for %s: %d optical but %d thermal components;"
              + " graph table may be broken",
          parsed.modeString(), throughputFiles.size(), thermalNames.size()));
    }

    ComponentTable thermalTable = tables.componentTable(config.thermalTable());
    List<ThermalComponent> result = new ArrayList<>();
    for (int i = 0; i < thermalNames.size(); i++) {
      String thermalName = thermalNames.get(i);
      String thermalFile = NON_THERMAL_NAMES.contains(thermalName)
          ? ComponentTable.CLEAR
          : thermalTable.lookup(thermalName);
      ThermalComponent component = componentBuilder.buildThermal(
          throughputFiles.get(i), thermalFile, parsed.parameters());
      if (!component.isEmpty()) {
        result.add(component);
      }
    }
    return List.copyOf(result);
  }

  private double pixelScale(ParsedMode parsed) {
    List<String> keywords = parsed.keywords();
    if (keywords.size() < 2) {
      throw new ComponentNotFoundException(
          "Obsmode " + parsed.modeString() + " does not name an instrument and detector");
    }
    String key = keywords.get(0) + "," + keywords.get(1);
    return tables.detectorTable(config.detectorTable()).pixelScale(key)
        .orElseThrow(() -> new ComponentNotFoundException(
            "Can't find pixel scale for " + key + " in " + config.detectorTable()));
  }

  private double[] binnedWavelengths(ParsedMode parsed, Optional<String> binset) {
    String entry = binset.orElseThrow(() -> new ComponentNotFoundException(
        "No binned wavelength set for " + parsed.modeString() + " in " + config.waveCatalog()));
    return binnedWaveSets.expand(entry);
  }

  private ThermalComposer createThermalComposer() {
    double[] calibration = config.calibrationSpectrum() == null
        ? null
        : tables.sourceSpectrum(config.calibrationSpectrum()).waveSet();
    return new ThermalComposer(config.defaultWaveSet(), calibration);
  }
}
