package io.github.fiserro.synphot.spectrum;

/**
 * Product of two elements, evaluated pointwise as {@code left(w) * right(w)} on request.
 *
 * <p>Nothing is tabulated, so a chain {@code a.multiply(b).multiply(c)} evaluates every operand
 * at each wavelength instead of interpolating an intermediate table.
 */
class CompositeSpectralElement implements SpectralElement {

  private final SpectralElement left;
  private final SpectralElement right;
  private final double[] wave;

  CompositeSpectralElement(SpectralElement left, SpectralElement right) {
    this.left = left;
    this.right = right;
    this.wave = WaveSets.merge(left.waveSet(), right.waveSet());
  }

  @Override
  public String name() {
    return left.name() + "*" + right.name();
  }

  @Override
  public double[] waveSet() {
    return wave.clone();
  }

  @Override
  public double evaluate(double wavelength) {
    return left.evaluate(wavelength) * right.evaluate(wavelength);
  }

  @Override
  public String toString() {
    return name();
  }
}
