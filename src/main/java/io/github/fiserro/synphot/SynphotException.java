package io.github.fiserro.synphot;

/**
 * Base type of every failure raised while resolving or composing an observation mode.
 *
 * <p>All subtypes are unchecked. Callers that want to tell failure kinds apart catch the concrete
 * subclass.
 */
public abstract class SynphotException extends RuntimeException {

  protected SynphotException(String message) {
    super(message);
  }

  protected SynphotException(String message, Throwable cause) {
    super(message, cause);
  }
}
