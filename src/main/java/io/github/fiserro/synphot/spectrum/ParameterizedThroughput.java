package io.github.fiserro.synphot.spectrum;

import com.google.common.base.Preconditions;
import io.github.fiserro.synphot.ComponentNotFoundException;
import io.github.fiserro.synphot.ParameterOutOfRangeException;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Family of throughput curves sharing one wavelength grid, each column tabulated for a value of
 * a continuous instrument setting (e.g. {@code mjd}).
 *
 * <p>Uses linear interpolation between the two columns bracketing the requested value. Values
 * outside the tabulated parameter range are rejected, never clamped.
 */
@Slf4j
public class ParameterizedThroughput {

  private final String name;
  private final String parameterKey;
  private final double[] wave;
  private final double[] defaultThroughput;
  private final NavigableMap<Double, double[]> columns;

  /**
   * @param name reference name of the family without the parameter marker
   * @param parameterKey parameter the columns are keyed by
   * @param wave shared wavelength grid
   * @param defaultThroughput unparameterized column, or {@code null} if the family has none
   * @param columns throughput per parameter value
   */
  public ParameterizedThroughput(String name, String parameterKey, double[] wave,
      double[] defaultThroughput, Map<Double, double[]> columns) {
    Preconditions.checkArgument(!columns.isEmpty(), "%s has no parameter columns", name);
    this.name = name;
    this.parameterKey = parameterKey;
    this.wave = wave;
    this.defaultThroughput = defaultThroughput;
    this.columns = new TreeMap<>(columns);
  }

  public String name() {
    return name;
  }

  public double minParameter() {
    return columns.firstKey();
  }

  public double maxParameter() {
    return columns.lastKey();
  }

  /**
   * Throughput at {@code value}.
   *
   * @throws ParameterOutOfRangeException when {@code value} lies outside the tabulated range
   */
  public TabularSpectralElement interpolate(double value) {
    // -0.0 sorts below 0.0 in the column map
    value += 0.0;
    if (Double.isNaN(value) || value < minParameter() || value > maxParameter()) {
      throw new ParameterOutOfRangeException(String.format(
          "%s#%s is outside the range [%s, %s] of %s",
          parameterKey, value, minParameter(), maxParameter(), name));
    }

    String elementName = name + "#" + value;
    double[] exact = columns.get(value);
    if (exact != null) {
      return new TabularSpectralElement(elementName, wave, exact);
    }

    Map.Entry<Double, double[]> lower = columns.floorEntry(value);
    Map.Entry<Double, double[]> upper = columns.ceilingEntry(value);
    double ratio = (value - lower.getKey()) / (upper.getKey() - lower.getKey());
    log.debug("Interpolating {} at {}={} between {} and {}", name, parameterKey, value,
        lower.getKey(), upper.getKey());

    double[] result = new double[wave.length];
    for (int i = 0; i < wave.length; i++) {
      double lo = lower.getValue()[i];
      double hi = upper.getValue()[i];
      result[i] = lo + ratio * (hi - lo);
    }
    return new TabularSpectralElement(elementName, wave, result);
  }

  /**
   * The unparameterized column, used when the mode does not give a value for the parameter.
   *
   * @throws ComponentNotFoundException when the family has no such column
   */
  public TabularSpectralElement defaultThroughput() {
    if (defaultThroughput == null) {
      throw new ComponentNotFoundException(String.format(
          "%s has no default throughput and no value was given for %s#", name, parameterKey));
    }
    return new TabularSpectralElement(name, wave, defaultThroughput);
  }
}
