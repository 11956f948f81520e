package io.github.fiserro.synphot.table;

import java.util.List;

/**
 * Ordered component names produced by a graph table traversal. Both lists have one entry per
 * visited graph node.
 *
 * @param opticalNames throughput component names
 * @param thermalNames emissivity component names, aligned with {@code opticalNames}
 */
public record ComponentChain(List<String> opticalNames, List<String> thermalNames) {

  public ComponentChain {
    opticalNames = List.copyOf(opticalNames);
    thermalNames = List.copyOf(thermalNames);
  }
}
