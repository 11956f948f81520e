package io.github.fiserro.synphot;

/**
 * A name could not be found in a reference table. Usually means the graph table and the
 * component table do not belong together.
 */
public class ComponentNotFoundException extends ModeResolutionException {

  public ComponentNotFoundException(String message) {
    super(message);
  }
}
