package io.github.fiserro.synphot;

import io.github.fiserro.synphot.component.Component;
import io.github.fiserro.synphot.component.ThermalComponent;
import io.github.fiserro.synphot.compose.OpticalComposer;
import io.github.fiserro.synphot.compose.SensitivityComposer;
import io.github.fiserro.synphot.compose.ThermalComposer;
import io.github.fiserro.synphot.mode.ParsedMode;
import io.github.fiserro.synphot.spectrum.SourceSpectrum;
import io.github.fiserro.synphot.spectrum.TabularSpectralElement;
import io.github.fiserro.synphot.table.ComponentChain;
import io.github.fiserro.synphot.table.ComponentTable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.Builder;

/**
 * Observation mode resolved against the reference tables.
 *
 * <p>Immutable once built. Thermal components, pixel scale and binned wavelengths are looked
 * up on first request and remembered.
 *
 * <p>Instances come from {@link ObservationModeResolver#resolveMode(String)}.
 */
public class ObservationMode {

  /** hc in the units that turn throughput * wavelength * area into a count rate. */
  public static final double HC = 5.03411762e7;

  private final ParsedMode parsed;
  private final ComponentChain chain;
  private final List<String> throughputFileNames;
  private final List<Component> components;
  private final double primaryArea;
  private final double sensitivityConstant;

  private final Supplier<Optional<String>> binnedWaveSetSpec;
  private final Supplier<double[]> binnedWavelengths;
  private final Supplier<List<ThermalComponent>> thermalComponents;
  private final Supplier<Double> pixelScale;

  private final OpticalComposer opticalComposer;
  private final SensitivityComposer sensitivityComposer;
  private final Supplier<ThermalComposer> thermalComposer;

  @Builder(access = AccessLevel.PACKAGE)
  private ObservationMode(ParsedMode parsed, ComponentChain chain,
      List<String> throughputFileNames, List<Component> components, double primaryArea,
      Supplier<Optional<String>> binnedWaveSetSpec, Supplier<double[]> binnedWavelengths,
      Supplier<List<ThermalComponent>> thermalComponents, Supplier<Double> pixelScale,
      OpticalComposer opticalComposer, SensitivityComposer sensitivityComposer,
      Supplier<ThermalComposer> thermalComposer) {
    this.parsed = parsed;
    this.chain = chain;
    this.throughputFileNames = List.copyOf(throughputFileNames);
    this.components = List.copyOf(components);
    this.primaryArea = primaryArea;
    this.sensitivityConstant = HC * primaryArea;
    this.binnedWaveSetSpec = binnedWaveSetSpec;
    this.binnedWavelengths = binnedWavelengths;
    this.thermalComponents = thermalComponents;
    this.pixelScale = pixelScale;
    this.opticalComposer = opticalComposer;
    this.sensitivityComposer = sensitivityComposer;
    this.thermalComposer = thermalComposer;
  }

  /** Mode text exactly as passed to the resolver. */
  public String rawString() {
    return parsed.rawString();
  }

  /** Mode text without any {@code band(...)} wrapper. */
  public String modeString() {
    return parsed.modeString();
  }

  public List<String> keywords() {
    return parsed.keywords();
  }

  public Map<String, Double> parameters() {
    return parsed.parameters();
  }

  public List<String> componentNames() {
    return chain.opticalNames();
  }

  public List<String> thermalComponentNames() {
    return chain.thermalNames();
  }

  /** Throughput file of every optical component, {@code clear} included, in chain order. */
  public List<String> throughputFileNames() {
    return throughputFileNames;
  }

  /** Throughput files that actually contribute, i.e. without the clear entries. */
  public List<String> showFiles() {
    return throughputFileNames.stream()
        .filter(name -> !ComponentTable.CLEAR.equals(name))
        .toList();
  }

  /** Non-empty optical components in chain order. */
  public List<Component> components() {
    return components;
  }

  public int size() {
    return components.size();
  }

  public double primaryArea() {
    return primaryArea;
  }

  /** {@link #HC} times the primary area. */
  public double sensitivityConstant() {
    return sensitivityConstant;
  }

  /** Wave catalog entry for this mode: a wavelength file name or a grid formula. */
  public Optional<String> binnedWaveSetSpec() {
    return binnedWaveSetSpec.get();
  }

  /**
   * Binned wavelength set best suited to this mode.
   *
   * @throws ComponentNotFoundException when the wave catalog has no entry for the mode
   */
  public double[] binnedWavelengths() {
    return binnedWavelengths.get().clone();
  }

  /**
   * Non-empty thermal components in chain order.
   *
   * @throws ThermalUnsupportedException when the mode has no thermal components
   */
  public List<ThermalComponent> thermalComponents() {
    return thermalComponents.get();
  }

  /**
   * Detector pixel scale in arcsec/pixel, keyed by the first two mode keywords.
   *
   * @throws ComponentNotFoundException when the detector table has no such entry
   */
  public double pixelScale() {
    return pixelScale.get();
  }

  /**
   * Combined throughput of all components.
   *
   * @throws BrokenChainException when the chain has no transmissive component
   */
  public TabularSpectralElement throughput() {
    return opticalComposer.compose(this);
  }

  /** Throughput times wavelength times {@link #sensitivityConstant()}. */
  public TabularSpectralElement sensitivity() {
    return sensitivityComposer.compose(this);
  }

  /**
   * Thermal background spectrum in photlam.
   *
   * @throws ThermalUnsupportedException when the mode has no thermal model
   * @throws BrokenChainException when the thermal model is inconsistent
   */
  public SourceSpectrum thermalSpectrum() {
    return thermalComposer.get().compose(this);
  }

  /** Product of the thermal chain throughputs from the first transmissive component on. */
  public TabularSpectralElement thermalThroughput() {
    return thermalComposer.get().thermalThroughput(this);
  }

  @Override
  public String toString() {
    return parsed.modeString();
  }
}
