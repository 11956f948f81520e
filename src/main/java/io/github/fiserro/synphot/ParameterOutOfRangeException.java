package io.github.fiserro.synphot;

/** Interpolation parameter lies outside the grid of a parameterized throughput family. */
public class ParameterOutOfRangeException extends SynphotException {

  public ParameterOutOfRangeException(String message) {
    super(message);
  }
}
