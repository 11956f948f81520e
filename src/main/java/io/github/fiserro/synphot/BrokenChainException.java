package io.github.fiserro.synphot;

/**
 * The resolved component chain is empty or inconsistent, so nothing can be composed from it.
 * Never replaced by an empty result.
 */
public class BrokenChainException extends SynphotException {

  public BrokenChainException(String message) {
    super(message);
  }
}
