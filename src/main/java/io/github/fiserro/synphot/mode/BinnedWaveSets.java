package io.github.fiserro.synphot.mode;

import io.github.fiserro.synphot.ReferenceDataException;
import io.github.fiserro.synphot.spectrum.SpectrumFileReader;
import lombok.RequiredArgsConstructor;

/**
 * Expands a wave catalog binset entry into wavelengths.
 *
 * <p>An entry is either the name of a file with one wavelength per line, or a formula
 * {@code (c0,c1[,c2[,c3]])}: a grid from {@code c0} towards {@code c1} whose step grows
 * linearly from {@code c2} to {@code c3}. Both steps default to {@code (c1-c0)/1999}, i.e. a
 * 2000 point grid.
 */
@RequiredArgsConstructor
public class BinnedWaveSets {

  private static final double DEFAULT_INTERVALS = 1999.0;

  private final SpectrumFileReader spectrumReader;

  public double[] expand(String binset) {
    String entry = binset.strip();
    if (entry.startsWith("(")) {
      return fromFormula(entry);
    }
    return spectrumReader.readWavelengths(entry);
  }

  static double[] fromFormula(String formula) {
    if (!formula.startsWith("(") || !formula.endsWith(")")) {
      throw new ReferenceDataException("Malformed wavelength formula " + formula);
    }
    String[] coefficients = formula.substring(1, formula.length() - 1).split(",");
    if (coefficients.length < 2) {
      throw new ReferenceDataException("Wavelength formula " + formula + " needs c0 and c1");
    }

    double c0 = coefficient(coefficients[0], formula);
    double c1 = coefficient(coefficients[1], formula);
    double c2 = (c1 - c0) / DEFAULT_INTERVALS;
    double c3 = c2;
    if (coefficients.length > 2) {
      c2 = coefficient(coefficients[2], formula);
      c3 = c2;
    }
    if (coefficients.length > 3) {
      c3 = coefficient(coefficients[3], formula);
    }
    if (c1 <= c0 || c2 + c3 <= 0) {
      throw new ReferenceDataException("Wavelength formula " + formula + " describes no grid");
    }

    int nwave = (int) (2.0 * (c1 - c0) / (c3 + c2)) + 1;
    double a = (c3 * c3 - c2 * c2) / (4.0 * (c1 - c0));
    double b = c2;
    double c = c0;

    double[] result = new double[nwave];
    for (int i = 0; i < nwave; i++) {
      result[i] = ((a * i) + b) * i + c;
    }
    return result;
  }

  private static double coefficient(String token, String formula) {
    try {
      return Double.parseDouble(token.strip());
    } catch (NumberFormatException e) {
      throw new ReferenceDataException("Bad coefficient '" + token + "' in " + formula, e);
    }
  }
}
