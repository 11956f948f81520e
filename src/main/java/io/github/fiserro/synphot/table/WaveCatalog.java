package io.github.fiserro.synphot.table;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Catalog of the binned wavelength set best suited to an observation mode.
 *
 * <p>Each line maps an obsmode to either a wavelength file or a {@code (c0,c1[,c2[,c3]])}
 * formula. An exact obsmode match wins; otherwise the entry with the most keywords, all present
 * in the mode, is used. Ambiguous hits are logged and the first one in file order is still
 * returned.
 */
@Slf4j
public class WaveCatalog {

  /**
   * @param obsmode lowercase obsmode of the entry
   * @param keywords keywords of {@code obsmode}
   * @param binset wavelength file name or formula
   */
  public record Entry(String obsmode, Set<String> keywords, String binset) {}

  private final String name;
  private final List<Entry> entries;

  public WaveCatalog(String name, List<Entry> entries) {
    this.name = name;
    this.entries = List.copyOf(entries);
  }

  public static WaveCatalog read(Path path, String name) {
    List<Entry> entries = TextTables.readRows(path, name).stream()
        .map(tokens -> {
          String obsmode = tokens[0].toLowerCase(Locale.ROOT);
          return new Entry(obsmode, Set.copyOf(Arrays.asList(obsmode.split(","))), tokens[1]);
        })
        .toList();
    log.debug("Loaded wave catalog {} with {} entries", name, entries.size());
    return new WaveCatalog(name, entries);
  }

  /** Binned wavelength set entry for {@code modeString}, if the catalog has one. */
  public Optional<String> lookup(String modeString) {
    String obsmode = modeString.toLowerCase(Locale.ROOT);

    List<Entry> exact = entries.stream().filter(e -> e.obsmode().equals(obsmode)).toList();
    if (!exact.isEmpty()) {
      return Optional.of(pick(obsmode, exact));
    }

    Set<String> keywords = Set.copyOf(Arrays.asList(obsmode.split(",")));
    List<Entry> partial = entries.stream()
        .filter(e -> keywords.containsAll(e.keywords()))
        .toList();
    if (partial.isEmpty()) {
      return Optional.empty();
    }
    int best = partial.stream().mapToInt(e -> e.keywords().size()).max().getAsInt();
    return Optional.of(pick(obsmode,
        partial.stream().filter(e -> e.keywords().size() == best).toList()));
  }

  private String pick(String obsmode, List<Entry> candidates) {
    Entry first = candidates.get(0);
    boolean ambiguous = candidates.stream().anyMatch(e -> !e.binset().equals(first.binset()));
    if (ambiguous) {
      log.warn("Ambiguous wavecat entry for '{}' in {}: {}; using {}", obsmode, name,
          candidates.stream().map(Entry::binset).toList(), first.binset());
    }
    return first.binset();
  }
}
