package io.github.fiserro.synphot.compose;

import io.github.fiserro.synphot.Composer;
import io.github.fiserro.synphot.ObservationMode;
import io.github.fiserro.synphot.spectrum.TabularSpectralElement;
import lombok.RequiredArgsConstructor;

/**
 * Sensitivity of an observation mode, {@code throughput(w) * w * sensitivityConstant}.
 * Converts flux in erg s^-1 cm^-2 A^-1 into count rate per Angstrom.
 */
@RequiredArgsConstructor
public class SensitivityComposer implements Composer<TabularSpectralElement> {

  private final OpticalComposer opticalComposer;

  @Override
  public TabularSpectralElement compose(ObservationMode mode) {
    TabularSpectralElement throughput = opticalComposer.compose(mode);
    double[] wave = throughput.waveSet();
    double[] values = throughput.values();
    double constant = mode.sensitivityConstant();

    double[] sensitivity = new double[wave.length];
    for (int i = 0; i < wave.length; i++) {
      sensitivity[i] = values[i] * wave[i] * constant;
    }
    return new TabularSpectralElement(throughput.name(), wave, sensitivity);
  }
}
