package io.github.fiserro.synphot;

/** A reference file could not be located, read or understood. */
public class ReferenceDataException extends SynphotException {

  public ReferenceDataException(String message) {
    super(message);
  }

  public ReferenceDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
