package io.github.fiserro.synphot.spectrum;

/**
 * Planck blackbody photon radiance.
 *
 * <p>Result unit is photlam per square arcsecond: photons s^-1 cm^-2 A^-1 arcsec^-2.
 */
public final class Planck {

  /** Speed of light in A/s. */
  static final double C = 2.99792458e18;

  /** hc/k in A K. */
  static final double HC_OVER_K = 1.4387769e8;

  /** Square arcseconds per steradian. */
  static final double ARCSEC2_PER_SR = 4.25451702961522e10;

  /** A^2 per cm^2. */
  private static final double A2_PER_CM2 = 1.0e16;

  private static final double SMALL_X = 1.0e-4;
  private static final double LARGE_X = 85.0;

  private Planck() {}

  /**
   * Blackbody at {@code temperature} sampled on {@code wavelengths}.
   *
   * @param wavelengths wavelengths in Angstrom
   * @param temperature temperature in Kelvin
   */
  public static double[] photlamPerArcsec2(double[] wavelengths, double temperature) {
    double[] result = new double[wavelengths.length];
    for (int i = 0; i < wavelengths.length; i++) {
      result[i] = photlamPerArcsec2(wavelengths[i], temperature);
    }
    return result;
  }

  public static double photlamPerArcsec2(double wavelength, double temperature) {
    if (wavelength <= 0 || temperature <= 0) {
      return 0.0;
    }
    double x = HC_OVER_K / (wavelength * temperature);

    // 1 / (e^x - 1), with its series form for tiny x and underflow cut-off for huge x
    double factor;
    if (x < SMALL_X) {
      factor = 1.0 / (x * (1.0 + 0.5 * x));
    } else if (x < LARGE_X) {
      factor = 1.0 / Math.expm1(x);
    } else {
      return 0.0;
    }

    double lambda2 = wavelength * wavelength;
    return 2.0 * C * A2_PER_CM2 / (lambda2 * lambda2) * factor / ARCSEC2_PER_SR;
  }

  /** Blackbody as a spectrum on {@code wavelengths}. */
  public static SourceSpectrum blackbody(double[] wavelengths, double temperature) {
    return new SourceSpectrum("bb(" + temperature + "K)", wavelengths,
        photlamPerArcsec2(wavelengths, temperature));
  }
}
