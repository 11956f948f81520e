package io.github.fiserro.synphot.component;

import io.github.fiserro.synphot.spectrum.SpectralElement;
import io.github.fiserro.synphot.spectrum.ThermalSpectralElement;
import java.util.Optional;

/** Component of a thermal chain: optional throughput plus optional emissivity. */
public class ThermalComponent extends Component {

  private final String thermalName;
  private final ThermalSpectralElement emissivity;

  public ThermalComponent(String name, SpectralElement throughput,
      String thermalName, ThermalSpectralElement emissivity) {
    super(name, throughput);
    this.thermalName = thermalName;
    this.emissivity = emissivity;
  }

  /** Emissivity file reference the component was built from. */
  public String thermalName() {
    return thermalName;
  }

  public Optional<ThermalSpectralElement> emissivity() {
    return Optional.ofNullable(emissivity);
  }

  /** Empty only when it neither transmits nor emits. */
  @Override
  public boolean isEmpty() {
    return super.isEmpty() && emissivity == null;
  }
}
