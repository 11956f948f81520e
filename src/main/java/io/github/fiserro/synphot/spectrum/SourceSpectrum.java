package io.github.fiserro.synphot.spectrum;

import com.google.common.base.Preconditions;
import java.util.function.DoubleUnaryOperator;

/**
 * Flux-density spectrum in photlam (photons s^-1 cm^-2 A^-1), immutable.
 *
 * <p>Arithmetic with other spectra or spectral elements keeps its operands and evaluates them at
 * each requested wavelength; the result's grid is the merged grid of the operands. Each operand
 * is zero outside its own grid. {@link #trim} tabulates the result.
 */
public class SourceSpectrum {

  public static final String PHOTLAM = "photlam";

  private final String name;
  private final double[] wave;
  private final DoubleUnaryOperator flux;

  public SourceSpectrum(String name, double[] wave, double[] flux) {
    Preconditions.checkArgument(wave.length == flux.length,
        "%s: %s wavelengths but %s fluxes", name, wave.length, flux.length);
    this.name = name;
    double[] grid = wave.clone();
    double[] table = flux.clone();
    this.wave = grid;
    this.flux = w -> TabularSpectralElement.interpolate(grid, table, w);
  }

  private SourceSpectrum(String name, double[] wave, DoubleUnaryOperator flux) {
    this.name = name;
    this.wave = wave;
    this.flux = flux;
  }

  /** All-zero spectrum on {@code wave}. */
  public static SourceSpectrum zeros(String name, double[] wave) {
    return new SourceSpectrum(name, wave, new double[wave.length]);
  }

  public String name() {
    return name;
  }

  public String fluxUnits() {
    return PHOTLAM;
  }

  public double[] waveSet() {
    return wave.clone();
  }

  /** Flux sampled on {@link #waveSet()}. */
  public double[] flux() {
    double[] result = new double[wave.length];
    for (int i = 0; i < wave.length; i++) {
      result[i] = evaluate(wave[i]);
    }
    return result;
  }

  public double evaluate(double wavelength) {
    return flux.applyAsDouble(wavelength);
  }

  /** Attenuates this spectrum by {@code element}: {@code this(w) * element(w)}. */
  public SourceSpectrum times(SpectralElement element) {
    return new SourceSpectrum(name, WaveSets.merge(wave, element.waveSet()),
        w -> evaluate(w) * element.evaluate(w));
  }

  /** Sum of both spectra on the merged grid. */
  public SourceSpectrum plus(SourceSpectrum other) {
    return new SourceSpectrum(name, WaveSets.merge(wave, other.wave),
        w -> evaluate(w) + other.evaluate(w));
  }

  public SourceSpectrum scale(double factor) {
    return new SourceSpectrum(name, wave, w -> factor * evaluate(w));
  }

  /** Tabulated copy holding only the samples with {@code min <= w <= max}. */
  public SourceSpectrum trim(double min, double max) {
    double[] trimmed = WaveSets.trim(wave, min, max);
    double[] result = new double[trimmed.length];
    for (int i = 0; i < trimmed.length; i++) {
      result[i] = evaluate(trimmed[i]);
    }
    return new SourceSpectrum(name, trimmed, result);
  }

  public SourceSpectrum renamed(String newName) {
    return new SourceSpectrum(newName, wave, flux);
  }

  @Override
  public String toString() {
    return name;
  }
}
