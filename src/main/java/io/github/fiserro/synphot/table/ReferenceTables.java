package io.github.fiserro.synphot.table;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fiserro.synphot.spectrum.SourceSpectrum;
import io.github.fiserro.synphot.spectrum.SpectrumFileReader;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache of parsed reference tables, keyed by resolved file path.
 *
 * <p>Tables are read once on first use and kept for the lifetime of the cache; reference data
 * is treated as immutable while it is in use. Each entry is published only after it has been
 * fully read, so concurrent first use of the same table never sees a partial table.
 */
@Slf4j
public class ReferenceTables {

    @Getter
    @Accessors(fluent = true)
    private final ReferenceFiles referenceFiles;

    @Getter
    @Accessors(fluent = true)
    private final SpectrumFileReader spectrumReader;

    private final ObjectMapper objectMapper;

    private final Map<Path, GraphTable> graphTables = new ConcurrentHashMap<>();
    private final Map<Path, ComponentTable> componentTables = new ConcurrentHashMap<>();
    private final Map<Path, WaveCatalog> waveCatalogs = new ConcurrentHashMap<>();
    private final Map<Path, DetectorTable> detectorTables = new ConcurrentHashMap<>();
    private final Map<Path, SourceSpectrum> spectra = new ConcurrentHashMap<>();

    public ReferenceTables(ReferenceFiles referenceFiles, ObjectMapper objectMapper) {
        this(referenceFiles, objectMapper, new SpectrumFileReader(referenceFiles));
    }

    public ReferenceTables(ReferenceFiles referenceFiles, ObjectMapper objectMapper,
                           SpectrumFileReader spectrumReader) {
        this.referenceFiles = referenceFiles;
        this.objectMapper = objectMapper;
        this.spectrumReader = spectrumReader;
    }

    public GraphTable graphTable(String refName) {
        return graphTables.computeIfAbsent(referenceFiles.resolve(refName),
            path -> GraphTable.read(path, refName, objectMapper));
    }

    /** Component table; also used for thermal tables, which share the format. */
    public ComponentTable componentTable(String refName) {
        return componentTables.computeIfAbsent(referenceFiles.resolve(refName),
            path -> ComponentTable.read(path, refName, objectMapper));
    }

    public WaveCatalog waveCatalog(String refName) {
        return waveCatalogs.computeIfAbsent(referenceFiles.resolve(refName),
            path -> WaveCatalog.read(path, refName));
    }

    public DetectorTable detectorTable(String refName) {
        return detectorTables.computeIfAbsent(referenceFiles.resolve(refName),
            path -> DetectorTable.read(path, refName));
    }

    /** Source spectrum such as the calibration star used to bound thermal spectra. */
    public SourceSpectrum sourceSpectrum(String refName) {
        return spectra.computeIfAbsent(referenceFiles.resolve(refName), path -> {
            log.debug("Loading source spectrum {}", refName);
            return spectrumReader.readSource(refName);
        });
    }
}
