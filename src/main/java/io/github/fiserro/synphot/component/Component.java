package io.github.fiserro.synphot.component;

import io.github.fiserro.synphot.spectrum.SpectralElement;
import java.util.Optional;

/**
 * Optical component of an observation mode: a named throughput curve. A component without a
 * curve is clear: it occupies its place in the chain but does not attenuate.
 */
public class Component {

  private final String name;
  private final SpectralElement throughput;

  public Component(String name, SpectralElement throughput) {
    this.name = name;
    this.throughput = throughput;
  }

  /** Throughput file reference the component was built from. */
  public String name() {
    return name;
  }

  public Optional<SpectralElement> throughput() {
    return Optional.ofNullable(throughput);
  }

  public boolean isEmpty() {
    return throughput == null;
  }

  @Override
  public String toString() {
    return throughput == null ? name : throughput.name();
  }
}
