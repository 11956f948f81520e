package io.github.fiserro.synphot.compose;

import io.github.fiserro.synphot.BrokenChainException;
import io.github.fiserro.synphot.Composer;
import io.github.fiserro.synphot.ObservationMode;
import io.github.fiserro.synphot.ThermalUnsupportedException;
import io.github.fiserro.synphot.component.Component;
import io.github.fiserro.synphot.component.ThermalComponent;
import io.github.fiserro.synphot.spectrum.Planck;
import io.github.fiserro.synphot.spectrum.SourceSpectrum;
import io.github.fiserro.synphot.spectrum.SpectralElement;
import io.github.fiserro.synphot.spectrum.TabularSpectralElement;
import io.github.fiserro.synphot.spectrum.ThermalSpectralElement;
import io.github.fiserro.synphot.spectrum.WaveSets;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Thermal background of an observation mode.
 *
 * <p>Starting from zero flux, the chain is walked in order. Each component first attenuates
 * everything accumulated so far by its throughput, then adds its own blackbody emission
 * weighted by beam fill factor and emissivity. Attenuation and emission stay unevaluated until
 * the spectrum is trimmed back to the working wavelength range after every addition.
 *
 * <p>The working range is the merged emissivity grid bounded by the default wavelength grid,
 * by the emissivity grids of all components but the first and by the calibration spectrum.
 */
@Slf4j
public class ThermalComposer implements Composer<SourceSpectrum> {

  static final String NAME_SUFFIX = "ThermalSpectrum";

  private final double[] defaultWaveSet;
  private final double[] calibrationWaveSet;

  /**
   * @param defaultWaveSet default wavelength grid bounding every thermal spectrum
   * @param calibrationWaveSet grid of the calibration spectrum, {@code null} for no bound
   */
  public ThermalComposer(double[] defaultWaveSet, double[] calibrationWaveSet) {
    this.defaultWaveSet = defaultWaveSet;
    this.calibrationWaveSet = calibrationWaveSet;
  }

  @Override
  public SourceSpectrum compose(ObservationMode mode) {
    return synthesize(mode.modeString() + " (thermal)", mode.thermalComponents());
  }

  /**
   * Thermal spectrum of {@code components} in photlam.
   *
   * @param name base name of the result
   * @param components thermal chain in order
   * @throws ThermalUnsupportedException when no component has an emissivity curve
   * @throws BrokenChainException when the emissivity grids leave no common wavelength range
   */
  public SourceSpectrum synthesize(String name, List<ThermalComponent> components) {
    if (components.stream().noneMatch(c -> c.emissivity().isPresent())) {
      throw new ThermalUnsupportedException("No thermal support provided for " + name);
    }

    double[] wave = waveSetIntersection(components);
    if (wave.length == 0) {
      throw new BrokenChainException(
          "Emissivity curves of " + name + " have no wavelengths in common");
    }
    double minWave = wave[0];
    double maxWave = wave[wave.length - 1];
    int firstTransmissive = firstTransmissiveIndex(components);
    log.debug("Synthesizing {} on {} wavelengths [{}, {}], first transmissive component {}",
        name, wave.length, minWave, maxWave, firstTransmissive);

    SourceSpectrum spectrum = SourceSpectrum.zeros(name + " " + NAME_SUFFIX, wave);
    for (int i = 0; i < components.size(); i++) {
      ThermalComponent component = components.get(i);

      Optional<SpectralElement> throughput = component.throughput();
      if (i >= firstTransmissive && throughput.isPresent()) {
        spectrum = spectrum.times(throughput.get());
      }

      Optional<ThermalSpectralElement> emissivity = component.emissivity();
      if (emissivity.isPresent()) {
        ThermalSpectralElement element = emissivity.get();
        SourceSpectrum emission = Planck.blackbody(spectrum.waveSet(), element.temperature())
            .scale(element.beamFillFactor())
            .times(element);
        spectrum = spectrum.plus(emission).trim(minWave, maxWave);
      }
    }
    return spectrum;
  }

  /**
   * Product of the thermal chain throughputs, starting at the first transmissive component.
   *
   * @throws BrokenChainException when no component transmits
   */
  public TabularSpectralElement thermalThroughput(ObservationMode mode) {
    List<ThermalComponent> components = mode.thermalComponents();
    SpectralElement product = OpticalComposer.multiplyThroughputs(
        components, firstTransmissiveIndex(components), mode.modeString());
    double[] wave = product.waveSet();
    return new TabularSpectralElement(product.name(), wave, product.evaluate(wave));
  }

  /**
   * Index of the first component with a throughput curve, or {@code components.size()} when
   * none has one. Components before it only block and contribute no transmissive factor.
   */
  public static int firstTransmissiveIndex(List<? extends Component> components) {
    for (int i = 0; i < components.size(); i++) {
      if (components.get(i).throughput().isPresent()) {
        return i;
      }
    }
    return components.size();
  }

  /**
   * Merged emissivity grid strictly inside the default grid, the emissivity grids of every
   * component after the first and the calibration spectrum.
   */
  double[] waveSetIntersection(List<ThermalComponent> components) {
    double minWave = defaultWaveSet[0];
    double maxWave = defaultWaveSet[defaultWaveSet.length - 1];
    for (ThermalComponent component : components.subList(1, components.size())) {
      if (component.emissivity().isPresent()) {
        double[] wave = component.emissivity().get().waveSet();
        minWave = Math.max(minWave, wave[0]);
        maxWave = Math.min(maxWave, wave[wave.length - 1]);
      }
    }

    double[] result = WaveSets.intersect(mergeEmissivityWaveSets(components), minWave, maxWave);

    // TODO: check against reference data whether the calibration star bound changes any
    // thermal result; it has no known physical motivation.
    if (calibrationWaveSet != null) {
      result = WaveSets.intersect(
          result, calibrationWaveSet[0], calibrationWaveSet[calibrationWaveSet.length - 1]);
    }
    return result;
  }

  /** Union of all emissivity grids, in chain order. */
  static double[] mergeEmissivityWaveSets(List<ThermalComponent> components) {
    double[] result = null;
    for (ThermalComponent component : components) {
      if (component.emissivity().isPresent()) {
        result = WaveSets.merge(result, component.emissivity().get().waveSet());
      }
    }
    return result == null ? new double[0] : result;
  }
}
