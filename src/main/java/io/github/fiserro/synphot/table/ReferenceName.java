package io.github.fiserro.synphot.table;

/**
 * A reference file name split from its optional parameter marker.
 *
 * <p>{@code crrefer$acs/ccd_mjd.dat[mjd#]} gives bare name {@code crrefer$acs/ccd_mjd.dat} and
 * parameter key {@code mjd}. Names without a marker have a {@code null} key.
 *
 * @param bareName file reference without the marker
 * @param parameterKey key of the interpolation parameter, or {@code null}
 */
public record ReferenceName(String bareName, String parameterKey) {

  private static final String MARKER_END = "#]";

  public static ReferenceName parse(String name) {
    if (name.endsWith(MARKER_END)) {
      int open = name.lastIndexOf('[');
      if (open > 0) {
        return new ReferenceName(
            name.substring(0, open), name.substring(open + 1, name.length() - MARKER_END.length()));
      }
    }
    return new ReferenceName(name, null);
  }

  public boolean isParameterized() {
    return parameterKey != null;
  }
}
