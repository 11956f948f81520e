package io.github.fiserro.synphot.mode;

import io.github.fiserro.synphot.ModeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses observation-mode strings such as {@code acs,hrc,f555w,mjd#54000}.
 *
 * <p>The text is lowercased and split on commas. A {@code key#value} token becomes the keyword
 * {@code key#} and the parameter {@code key -> value}, so graph lookups do not depend on the
 * numeric value. When no token carries {@code #}, the keywords are exactly the comma split.
 */
@Slf4j
public class ModeParser {

  private static final Pattern BAND = Pattern.compile("band\\((.*?)\\)", Pattern.CASE_INSENSITIVE);
  private static final String PARAMETER_MARK = "#";
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([e][+-]?\\d+)?");

  public ParsedMode parse(String rawString) {
    if (rawString == null) {
      throw new ModeParseException("Observation mode must not be null");
    }

    String modeString = stripBand(rawString);
    if (modeString.isEmpty()) {
      return new ParsedMode(rawString, modeString, List.of(), Map.of());
    }

    List<String> tokens = Arrays.asList(modeString.toLowerCase(Locale.ROOT).split(",", -1));
    if (!modeString.contains(PARAMETER_MARK)) {
      return new ParsedMode(rawString, modeString, tokens, Map.of());
    }

    List<String> keywords = new ArrayList<>(tokens.size());
    Map<String, Double> parameters = new LinkedHashMap<>();
    for (String token : tokens) {
      if (!token.contains(PARAMETER_MARK)) {
        keywords.add(token);
        continue;
      }
      String[] parts = token.split(PARAMETER_MARK, -1);
      if (parts.length != 2) {
        throw new ModeParseException(
            "Malformed parameter '" + token + "' in obsmode " + rawString);
      }
      String key = parts[0];
      double value = parseValue(key, parts[1], rawString);
      if (parameters.put(key, value) != null) {
        throw new ModeParseException(
            "Parameter '" + key + "' given more than once in obsmode " + rawString);
      }
      keywords.add(key + PARAMETER_MARK);
    }

    log.trace("Parsed {} -> keywords={}, parameters={}", rawString, keywords, parameters);
    return new ParsedMode(rawString, modeString, keywords, parameters);
  }

  private static String stripBand(String text) {
    Matcher matcher = BAND.matcher(text);
    return matcher.find() ? matcher.group(1) : text;
  }

  private static double parseValue(String key, String value, String rawString) {
    if (!DECIMAL.matcher(value).matches()) {
      throw new ModeParseException(
          "Value '" + value + "' of parameter '" + key + "' in obsmode " + rawString
              + " is not a number");
    }
    return Double.parseDouble(value);
  }
}
