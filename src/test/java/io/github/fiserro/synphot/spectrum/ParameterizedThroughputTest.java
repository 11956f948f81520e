package io.github.fiserro.synphot.spectrum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.fiserro.synphot.ComponentNotFoundException;
import io.github.fiserro.synphot.ParameterOutOfRangeException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link ParameterizedThroughput}: bracketing interpolation between parameter columns.
 */
class ParameterizedThroughputTest {

  private static final double[] WAVE = {4000, 5000, 6000};

  private final ParameterizedThroughput family = new ParameterizedThroughput(
      "ccd_mjd.dat", "mjd", WAVE, new double[] {0.5, 0.5, 0.5},
      Map.of(
          52000.0, new double[] {0.4, 0.5, 0.6},
          54000.0, new double[] {0.5, 0.6, 0.7},
          56000.0, new double[] {0.7, 0.8, 0.9}));

  @ParameterizedTest(name = "mjd={0}")
  @CsvSource({
      "52000, 0.5",
      "53000, 0.55",
      "54000, 0.6",
      "55000, 0.7",
      "55500, 0.75",
      "56000, 0.8",
  })
  void interpolate_shouldBlendBracketingColumns(double mjd, double expectedAt5000) {
    TabularSpectralElement element = family.interpolate(mjd);

    assertEquals(expectedAt5000, element.evaluate(5000), 1e-12);
    assertArrayEquals(WAVE, element.waveSet());
  }

  @Test
  void interpolate_shouldBeMonotonicBetweenColumns() {
    double previous = family.interpolate(52000).evaluate(4000);
    for (double mjd = 52250; mjd <= 56000; mjd += 250) {
      double current = family.interpolate(mjd).evaluate(4000);
      assertTrue(current >= previous, "not monotonic at mjd " + mjd);
      previous = current;
    }
  }

  @Test
  void interpolate_shouldNameResultAfterValue() {
    assertEquals("ccd_mjd.dat#54000.0", family.interpolate(54000).name());
  }

  @Test
  void interpolate_negativeZero_shouldUseZeroColumn() {
    ParameterizedThroughput aperture = new ParameterizedThroughput(
        "aper.dat", "aper", WAVE, null,
        Map.of(
            0.0, new double[] {0.2, 0.2, 0.2},
            1.0, new double[] {0.6, 0.6, 0.6}));

    TabularSpectralElement element = aperture.interpolate(-0.0);

    assertEquals(0.2, element.evaluate(5000));
    assertEquals("aper.dat#0.0", element.name());
  }

  @ParameterizedTest
  @ValueSource(doubles = {51999.0, 56000.5, Double.NaN})
  void interpolate_outsideTabulatedRange_shouldFail(double mjd) {
    assertThrows(ParameterOutOfRangeException.class, () -> family.interpolate(mjd));
  }

  @Test
  void defaultThroughput_shouldUseUnparameterizedColumn() {
    assertEquals(0.5, family.defaultThroughput().evaluate(6000));
    assertEquals("ccd_mjd.dat", family.defaultThroughput().name());
  }

  @Test
  void defaultThroughput_withoutDefaultColumn_shouldFail() {
    ParameterizedThroughput noDefault = new ParameterizedThroughput(
        "f.dat", "mjd", WAVE, null, Map.of(1.0, new double[] {1, 1, 1}));

    assertThrows(ComponentNotFoundException.class, noDefault::defaultThroughput);
  }

  @Test
  void minMaxParameter_shouldSpanColumns() {
    assertEquals(52000, family.minParameter());
    assertEquals(56000, family.maxParameter());
  }
}
