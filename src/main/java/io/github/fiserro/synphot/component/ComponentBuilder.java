package io.github.fiserro.synphot.component;

import io.github.fiserro.synphot.spectrum.ParameterizedThroughput;
import io.github.fiserro.synphot.spectrum.SpectralElement;
import io.github.fiserro.synphot.spectrum.SpectrumFileReader;
import io.github.fiserro.synphot.spectrum.ThermalSpectralElement;
import io.github.fiserro.synphot.table.ComponentTable;
import io.github.fiserro.synphot.table.ReferenceName;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds components from throughput and emissivity file references.
 *
 * <ul>
 *   <li>{@code clear} gives an empty component, nothing is read</li>
 *   <li>{@code file[key#]} interpolates the family in {@code file} at {@code parameters[key]},
 *       or uses its default column when the mode has no such parameter</li>
 *   <li>any other name is read as a plain throughput curve</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class ComponentBuilder {

  private final SpectrumFileReader spectrumReader;

  /** Component for {@code fileName}, taken from {@code cache} when it was built before. */
  public Component build(String fileName, Map<String, Double> parameters, ComponentCache cache) {
    Double value = parameterValue(fileName, parameters);
    return cache.get(new ComponentKey(fileName, value), key -> build(fileName, value));
  }

  /** Component for {@code fileName}, interpolated at {@code parameter} when not {@code null}. */
  public Component build(String fileName, Double parameter) {
    log.debug("Building component {} (parameter={})", fileName, parameter);
    return new Component(fileName, throughput(fileName, parameter));
  }

  /** Thermal component; the emissivity is read unless {@code thermalFile} is clear. */
  public ThermalComponent buildThermal(String throughputFile, String thermalFile,
      Map<String, Double> parameters) {
    SpectralElement throughput =
        throughput(throughputFile, parameterValue(throughputFile, parameters));
    ThermalSpectralElement emissivity = ComponentTable.isClear(thermalFile)
        ? null
        : spectrumReader.readThermal(thermalFile);
    log.debug("Built thermal component {} / {}", throughputFile, thermalFile);
    return new ThermalComponent(throughputFile, throughput, thermalFile, emissivity);
  }

  private SpectralElement throughput(String fileName, Double value) {
    if (ComponentTable.isClear(fileName)) {
      return null;
    }
    if (!ReferenceName.parse(fileName).isParameterized()) {
      return spectrumReader.readThroughput(fileName);
    }
    ParameterizedThroughput family = spectrumReader.readFamily(fileName);
    return value == null ? family.defaultThroughput() : family.interpolate(value);
  }

  private static Double parameterValue(String fileName, Map<String, Double> parameters) {
    ReferenceName reference = ReferenceName.parse(fileName);
    return reference.isParameterized() ? parameters.get(reference.parameterKey()) : null;
  }
}
