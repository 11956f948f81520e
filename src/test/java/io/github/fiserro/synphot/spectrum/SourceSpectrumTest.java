package io.github.fiserro.synphot.spectrum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SourceSpectrumTest {

  private final SourceSpectrum flat =
      new SourceSpectrum("flat", new double[] {1000, 2000, 3000}, new double[] {2, 2, 2});

  @Test
  void times_shouldAttenuateOnMergedGrid() {
    SpectralElement half = new TabularSpectralElement(
        "half", new double[] {1500, 2500}, new double[] {0.5, 0.5});

    SourceSpectrum result = flat.times(half);

    assertArrayEquals(new double[] {1000, 1500, 2000, 2500, 3000}, result.waveSet());
    assertArrayEquals(new double[] {0, 1, 1, 1, 0}, result.flux());
    assertEquals("flat", result.name());
  }

  @Test
  void times_chained_shouldEvaluateEveryOperandAtEachGridPoint() {
    SpectralElement ramp =
        new TabularSpectralElement("ramp", new double[] {1000, 3000}, new double[] {0, 1});

    SourceSpectrum constant =
        new SourceSpectrum("c", new double[] {1000, 3000}, new double[] {2, 2});
    SourceSpectrum result = constant.times(ramp).times(ramp).plus(flat.scale(0));

    assertArrayEquals(new double[] {1000, 2000, 3000}, result.waveSet());
    assertArrayEquals(new double[] {0, 0.5, 2}, result.flux(), 1e-12);
    assertArrayEquals(new double[] {0, 0.5, 2}, result.trim(1000, 3000).flux(), 1e-12);
  }

  @Test
  void flux_shouldReturnCopy() {
    flat.flux()[0] = -1;
    flat.waveSet()[0] = -1;

    assertEquals(2, flat.evaluate(1000));
    assertEquals(1000, flat.waveSet()[0]);
  }

  @Test
  void plus_shouldTreatMissingSamplesAsZero() {
    SourceSpectrum other =
        new SourceSpectrum("other", new double[] {3000, 4000}, new double[] {1, 1});

    SourceSpectrum sum = flat.plus(other);

    assertArrayEquals(new double[] {1000, 2000, 3000, 4000}, sum.waveSet());
    assertArrayEquals(new double[] {2, 2, 3, 1}, sum.flux());
  }

  @Test
  void trim_shouldKeepBoundsInclusive() {
    SourceSpectrum trimmed = flat.trim(1000, 2000);

    assertArrayEquals(new double[] {1000, 2000}, trimmed.waveSet());
  }

  @Test
  void scale_shouldMultiplyFlux() {
    assertArrayEquals(new double[] {1, 1, 1}, flat.scale(0.5).flux());
  }

  @Test
  void multiply_shouldNameProductAfterOperands() {
    SpectralElement a =
        new TabularSpectralElement("a", new double[] {1000, 2000}, new double[] {0.5, 1.0});
    SpectralElement b =
        new TabularSpectralElement("b", new double[] {1500, 2000}, new double[] {0.5, 0.5});

    SpectralElement product = a.multiply(b);

    assertEquals("a*b", product.name());
    assertArrayEquals(new double[] {0, 0.375, 0.5}, product.evaluate(new double[] {1000, 1500, 2000}),
        1e-12);
  }
}
