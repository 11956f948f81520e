package io.github.fiserro.synphot.mode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.fiserro.synphot.ReferenceDataException;
import io.github.fiserro.synphot.spectrum.SpectrumFileReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BinnedWaveSetsTest {

  @Mock
  private SpectrumFileReader spectrumReader;

  @Test
  void expand_constantStep_shouldGiveEvenGrid() {
    double[] wave = new BinnedWaveSets(spectrumReader).expand("(4000,7000,50)");

    assertEquals(61, wave.length);
    assertEquals(4000, wave[0]);
    assertEquals(4050, wave[1]);
    assertEquals(7000, wave[60]);
    verifyNoInteractions(spectrumReader);
  }

  @Test
  void fromFormula_growingStep_shouldEndAtUpperBound() {
    double[] wave = BinnedWaveSets.fromFormula("(1000,2000,10,30)");

    assertEquals(51, wave.length);
    assertEquals(1000, wave[0]);
    assertEquals(10.2, wave[1] - wave[0], 1e-9);
    assertEquals(29.8, wave[50] - wave[49], 1e-9);
    assertEquals(2000, wave[50], 1e-9);
  }

  @Test
  void fromFormula_twoCoefficients_shouldDefaultToTwoThousandPoints() {
    double[] wave = BinnedWaveSets.fromFormula("(1000,2999)");

    assertEquals(1000, wave[0]);
    assertEquals(1.0, wave[1] - wave[0], 1e-12);
    assertEquals(2000, wave.length);
    assertEquals(2999, wave[1999], 1e-9);
  }

  @Test
  void expand_fileName_shouldReadWavelengthFile() {
    double[] expected = {4000, 5000, 6000};
    when(spectrumReader.readWavelengths("crrefer$wavecat/acs_hrc_wave.dat")).thenReturn(expected);

    double[] wave = new BinnedWaveSets(spectrumReader).expand(" crrefer$wavecat/acs_hrc_wave.dat ");

    assertArrayEquals(expected, wave);
    verify(spectrumReader).readWavelengths("crrefer$wavecat/acs_hrc_wave.dat");
  }

  @ParameterizedTest
  @ValueSource(strings = {"(7000,4000)", "(1000)", "(a,b)", "(1000,2000,0,0)", "(1000,2000"})
  void fromFormula_malformed_shouldFail(String formula) {
    assertThrows(ReferenceDataException.class, () -> BinnedWaveSets.fromFormula(formula));
  }
}
