package io.github.fiserro.synphot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads {@link SynphotConfig} from JSON.
 * Values missing from the file keep their defaults.
 * The {@code SYNPHOT_ROOT} environment variable, when set, overrides the root directory.
 */
@Slf4j
@RequiredArgsConstructor
public class SynphotConfigLoader {

    static final String CONFIG_RESOURCE = "/synphot.json";
    static final String ROOT_ENV = "SYNPHOT_ROOT";

    private final ObjectMapper objectMapper;
    private final Function<String, String> environment;

    public SynphotConfigLoader() {
        this(new ObjectMapper(), System::getenv);
    }

    /**
     * Loads configuration from the {@code /synphot.json} classpath resource.
     *
     * @return configuration with values from the resource or defaults
     */
    public SynphotConfig loadConfiguration() {
        SynphotConfig config;
        try (InputStream in = SynphotConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using default configuration", CONFIG_RESOURCE);
                config = SynphotConfig.builder().build();
            } else {
                config = objectMapper.readValue(in, SynphotConfig.class);
                log.info("Loaded configuration from classpath {}", CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}: {}; using default configuration",
                CONFIG_RESOURCE, e.getMessage());
            config = SynphotConfig.builder().build();
        }
        return applyEnvironment(config);
    }

    /**
     * Loads configuration from a JSON file. A missing or unreadable file yields the defaults.
     *
     * @param file JSON configuration file
     * @return configuration with values from the file or defaults
     */
    public SynphotConfig loadConfiguration(Path file) {
        SynphotConfig config;
        if (!Files.isRegularFile(file)) {
            log.info("Configuration file {} not found, using default configuration", file);
            config = SynphotConfig.builder().build();
        } else {
            try {
                config = objectMapper.readValue(file.toFile(), SynphotConfig.class);
                log.info("Loaded configuration from {}", file);
            } catch (IOException e) {
                log.warn("Failed to read configuration {}: {}; using default configuration",
                    file, e.getMessage());
                config = SynphotConfig.builder().build();
            }
        }
        return applyEnvironment(config);
    }

    private SynphotConfig applyEnvironment(SynphotConfig config) {
        String root = environment.apply(ROOT_ENV);
        if (root == null || root.isBlank()) {
            return config;
        }
        log.info("Reference data root overridden by {}: {}", ROOT_ENV, root);
        return config.toBuilder().rootDir(root).build();
    }
}
