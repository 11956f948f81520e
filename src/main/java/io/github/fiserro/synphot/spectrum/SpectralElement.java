package io.github.fiserro.synphot.spectrum;

/**
 * Dimensionless spectral curve (throughput or emissivity) tabulated on its own wavelength grid.
 *
 * <p>Implementations are immutable. Operations return new elements.
 */
public interface SpectralElement {

  /** Display name, used to build the provenance name of composed curves. */
  String name();

  /** Native wavelength grid in Angstrom, ascending. */
  double[] waveSet();

  /** Value at {@code wavelength}; linear between samples, zero outside the native grid. */
  double evaluate(double wavelength);

  default double[] evaluate(double[] wavelengths) {
    double[] result = new double[wavelengths.length];
    for (int i = 0; i < wavelengths.length; i++) {
      result[i] = evaluate(wavelengths[i]);
    }
    return result;
  }

  /**
   * Pointwise product {@code this(w) * other(w)} on the merged grid of both elements. Operands
   * are kept and evaluated at every requested wavelength.
   */
  default SpectralElement multiply(SpectralElement other) {
    return new CompositeSpectralElement(this, other);
  }
}
