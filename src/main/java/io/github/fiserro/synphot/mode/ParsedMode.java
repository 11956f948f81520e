package io.github.fiserro.synphot.mode;

import java.util.List;
import java.util.Map;

/**
 * Observation-mode string split into keywords and interpolation parameters.
 *
 * @param rawString text as given by the caller
 * @param modeString text with any {@code band(...)} wrapper removed
 * @param keywords lowercase keywords; parameterized ones reduced to {@code key#}
 * @param parameters parameter values by key
 */
public record ParsedMode(
    String rawString, String modeString, List<String> keywords, Map<String, Double> parameters) {

  public ParsedMode {
    keywords = List.copyOf(keywords);
    parameters = Map.copyOf(parameters);
  }
}
