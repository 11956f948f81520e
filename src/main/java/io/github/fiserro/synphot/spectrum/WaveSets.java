package io.github.fiserro.synphot.spectrum;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * Operations on wavelength grids. A grid is a {@code double[]} sorted ascending, in Angstrom.
 *
 * <p>Grids of different components do not share sample points, so bounding is done by value
 * ({@link #intersect}, {@link #trim}) rather than by set intersection.
 */
public final class WaveSets {

  private WaveSets() {}

  /**
   * Sorted union of two ascending grids with exact duplicates removed.
   *
   * @param a first grid, may be {@code null}
   * @param b second grid, may be {@code null}
   * @return merged grid; the other operand when one of them is {@code null}
   */
  public static double[] merge(double[] a, double[] b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }

    double[] out = new double[a.length + b.length];
    int i = 0;
    int j = 0;
    int n = 0;
    while (i < a.length || j < b.length) {
      double next;
      if (j >= b.length || (i < a.length && a[i] <= b[j])) {
        next = a[i++];
      } else {
        next = b[j++];
      }
      if (n == 0 || out[n - 1] != next) {
        out[n++] = next;
      }
    }
    return n == out.length ? out : Arrays.copyOf(out, n);
  }

  /** Samples of {@code wave} strictly inside {@code (min, max)}. */
  public static double[] intersect(double[] wave, double min, double max) {
    return Arrays.stream(wave).filter(w -> w > min && w < max).toArray();
  }

  /** Samples of {@code wave} inside {@code [min, max]}, bounds included. */
  public static double[] trim(double[] wave, double min, double max) {
    return Arrays.stream(wave).filter(w -> w >= min && w <= max).toArray();
  }

  /** {@code count} points evenly spaced in log10 between {@code min} and {@code max}. */
  public static double[] logSpaced(double min, double max, int count) {
    Preconditions.checkArgument(min > 0 && max > min, "invalid log range [%s, %s]", min, max);
    double[] log = linearSpaced(Math.log10(min), Math.log10(max), count);
    for (int i = 0; i < log.length; i++) {
      log[i] = Math.pow(10.0, log[i]);
    }
    return log;
  }

  /** {@code count} points evenly spaced between {@code min} and {@code max}, both included. */
  public static double[] linearSpaced(double min, double max, int count) {
    Preconditions.checkArgument(count >= 2, "need at least two points, got %s", count);
    double[] result = new double[count];
    double step = (max - min) / (count - 1);
    for (int i = 0; i < count; i++) {
      result[i] = min + i * step;
    }
    return result;
  }
}
