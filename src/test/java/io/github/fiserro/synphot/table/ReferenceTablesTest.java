package io.github.fiserro.synphot.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fiserro.synphot.ReferenceDataFixtures;
import io.github.fiserro.synphot.spectrum.SourceSpectrum;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReferenceTablesTest {

    private ReferenceTables tables;

    @BeforeEach
    void setUp() {
        Path root = ReferenceDataFixtures.root();
        tables = new ReferenceTables(new ReferenceFiles(root, Map.of("crrefer", root)),
            new ObjectMapper());
    }

    @Test
    void graphTable_shouldBeReadOnce() {
        assertSame(tables.graphTable("mtab/graph.json"), tables.graphTable("mtab/graph.json"));
    }

    @Test
    void componentTable_aliasAndPlainName_shouldShareEntry() {
        assertSame(tables.componentTable("mtab/comp.json"),
            tables.componentTable("crrefer$mtab/comp.json"));
    }

    @Test
    void detectorTable_shouldExposePixelScales() {
        DetectorTable detectors = tables.detectorTable("detectors.dat");

        assertEquals(0.025, detectors.pixelScale("acs,hrc").getAsDouble());
        assertTrue(detectors.pixelScale("acs,wfc").isEmpty());
    }

    @Test
    void sourceSpectrum_shouldSpanCalibrationRange() {
        SourceSpectrum vega = tables.sourceSpectrum("calspec/alpha_lyr_stis.dat");

        assertEquals(900, vega.waveSet()[0]);
        assertEquals(1.0e6, vega.waveSet()[vega.waveSet().length - 1]);
    }

    @Test
    void concurrentFirstUse_shouldPublishSingleInstance() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<GraphTable>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> tables.graphTable("mtab/graph.json"));
            }
            List<Future<GraphTable>> results = executor.invokeAll(tasks);

            GraphTable first = results.get(0).get();
            for (Future<GraphTable> result : results) {
                assertSame(first, result.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
