package io.github.fiserro.synphot;

/** No component of the mode carries an emissivity curve, so there is no thermal model. */
public class ThermalUnsupportedException extends SynphotException {

  public ThermalUnsupportedException(String message) {
    super(message);
  }
}
