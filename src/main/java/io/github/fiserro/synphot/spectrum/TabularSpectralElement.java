package io.github.fiserro.synphot.spectrum;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/** Array-backed {@link SpectralElement} with piecewise-linear evaluation. */
public class TabularSpectralElement implements SpectralElement {

  private final String name;
  private final double[] wave;
  private final double[] values;

  public TabularSpectralElement(String name, double[] wave, double[] values) {
    Preconditions.checkArgument(wave.length == values.length,
        "%s: %s wavelengths but %s values", name, wave.length, values.length);
    this.name = name;
    this.wave = wave.clone();
    this.values = values.clone();
  }

  /** Same curve under another display name. */
  public TabularSpectralElement renamed(String newName) {
    return new TabularSpectralElement(newName, wave, values);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public double[] waveSet() {
    return wave.clone();
  }

  /** Tabulated values, parallel to {@link #waveSet()}. */
  public double[] values() {
    return values.clone();
  }

  @Override
  public double evaluate(double wavelength) {
    return interpolate(wave, values, wavelength);
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * Linear interpolation of {@code values} tabulated on {@code wave}, zero outside the table.
   */
  static double interpolate(double[] wave, double[] values, double wavelength) {
    if (wave.length == 0 || wavelength < wave[0] || wavelength > wave[wave.length - 1]) {
      return 0.0;
    }
    int index = Arrays.binarySearch(wave, wavelength);
    if (index >= 0) {
      return values[index];
    }
    int upper = -index - 1;
    int lower = upper - 1;
    double ratio = (wavelength - wave[lower]) / (wave[upper] - wave[lower]);
    return values[lower] + ratio * (values[upper] - values[lower]);
  }
}
