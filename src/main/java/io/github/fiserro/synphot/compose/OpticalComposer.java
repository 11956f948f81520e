package io.github.fiserro.synphot.compose;

import io.github.fiserro.synphot.BrokenChainException;
import io.github.fiserro.synphot.Composer;
import io.github.fiserro.synphot.ObservationMode;
import io.github.fiserro.synphot.component.Component;
import io.github.fiserro.synphot.spectrum.SpectralElement;
import io.github.fiserro.synphot.spectrum.TabularSpectralElement;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Combined throughput of an observation mode: the product of all component throughputs.
 *
 * <p>The result is tabulated on the union of all component grids. At each wavelength every
 * component is evaluated and the values are multiplied left to right in chain order, so results
 * are reproducible to the last bit. The result is named after its components joined with
 * {@code *}.
 */
@Slf4j
public class OpticalComposer implements Composer<TabularSpectralElement> {

  @Override
  public TabularSpectralElement compose(ObservationMode mode) {
    List<Component> components = mode.components();
    SpectralElement product = multiplyThroughputs(components, 0, mode.modeString());

    String name = components.stream()
        .map(Component::toString)
        .collect(Collectors.joining("*"));
    double[] wave = product.waveSet();
    log.debug("Throughput of {} from {} components on {} wavelengths",
        mode.modeString(), components.size(), wave.length);
    return new TabularSpectralElement(name, wave, product.evaluate(wave));
  }

  /**
   * Product of the throughputs of {@code components} from {@code index} on.
   *
   * @throws BrokenChainException when no component from {@code index} on has a throughput
   */
  static SpectralElement multiplyThroughputs(
      List<? extends Component> components, int index, String modeString) {
    if (index >= components.size()) {
      throw new BrokenChainException(String.format(
          "No transmissive components in obsmode %s (index %d of %d); graph table may be broken",
          modeString, index, components.size()));
    }

    SpectralElement product = null;
    for (Component component : components.subList(index, components.size())) {
      Optional<SpectralElement> throughput = component.throughput();
      if (throughput.isPresent()) {
        product = product == null ? throughput.get() : product.multiply(throughput.get());
      }
    }
    if (product == null) {
      throw new BrokenChainException(
          "No transmissive components in obsmode " + modeString + "; graph table may be broken");
    }
    return product;
  }
}
