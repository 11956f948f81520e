package io.github.fiserro.synphot.spectrum;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Emissivity curve of a component together with the temperature and beam fill factor used
 * when its thermal self-emission is synthesized.
 */
@Getter
@Accessors(fluent = true)
public class ThermalSpectralElement extends TabularSpectralElement {

  /** Component temperature in Kelvin. */
  private final double temperature;

  /** Scale applied to the component's blackbody contribution. */
  private final double beamFillFactor;

  public ThermalSpectralElement(String name, double[] wave, double[] emissivity,
      double temperature, double beamFillFactor) {
    super(name, wave, emissivity);
    this.temperature = temperature;
    this.beamFillFactor = beamFillFactor;
  }
}
