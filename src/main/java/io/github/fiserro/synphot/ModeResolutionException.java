package io.github.fiserro.synphot;

/** The graph table could not turn the mode keywords into a component chain. */
public class ModeResolutionException extends SynphotException {

  public ModeResolutionException(String message) {
    super(message);
  }
}
