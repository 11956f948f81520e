package io.github.fiserro.synphot;

import java.util.function.Function;

/**
 * Strategy that composes the components of a resolved observation mode into one result, such
 * as its throughput or thermal background. As a {@code Function} it can be mapped over a stream
 * of modes.
 *
 * @param <R> the composed result type
 */
public interface Composer<R> extends Function<ObservationMode, R> {

  R compose(ObservationMode mode);

  @Override
  default R apply(ObservationMode mode) {
    return compose(mode);
  }
}
