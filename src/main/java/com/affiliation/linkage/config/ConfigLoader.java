package com.affiliation.linkage.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a {@link PipelineConfig} from YAML.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
        // Utility class
    }

    public static PipelineConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            PipelineConfig config = parse(in, path.toString());
            log.info("config.loaded file={}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration bundled on the classpath.
     */
    public static PipelineConfig loadResource(String resource) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            return parse(in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + resource + ": " + e.getMessage(), e);
        }
    }

    public static PipelineConfig parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return PipelineConfig.defaults();
        }
        try {
            PipelineConfig config = YAML.readValue(yaml, PipelineConfig.class);
            return validate(config != null ? config : PipelineConfig.defaults(), "inline YAML");
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static PipelineConfig parse(InputStream in, String source) {
        try {
            PipelineConfig config = YAML.readValue(in, PipelineConfig.class);
            return validate(config != null ? config : PipelineConfig.defaults(), source);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds every stage's options once so that bad values fail at load time rather than mid-run.
     */
    static PipelineConfig validate(PipelineConfig config, String source) {
        try {
            config.extraction().toOptions();
            config.sort().toOptions();
            config.join().toFieldRoles();
            config.store().toOptions();
            config.linkage().toOptions(config.store().referenceConvention());
            return config;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }
}
