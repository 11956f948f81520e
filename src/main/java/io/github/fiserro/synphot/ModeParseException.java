package io.github.fiserro.synphot;

/** Malformed observation-mode syntax, e.g. {@code mjd#abc}. */
public class ModeParseException extends SynphotException {

  public ModeParseException(String message) {
    super(message);
  }

  public ModeParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
