package com.centinel.core.config;

import com.centinel.core.normalizer.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link CentinelConfig} from JSON. Sections left out take their
 * defaults; unknown keys are rejected. The result is validated before it is
 * returned, so a bad configuration fails before any document is touched.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "centinel.json";

    private final ObjectReader reader = CanonicalJson.mapper()
            .readerFor(CentinelConfig.class)
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public CentinelConfig load(Path path) {
        Objects.requireNonNull(path, "Config path cannot be null");
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path, e);
        }
        CentinelConfig config = parse(json);
        log.info("Loaded configuration from {}", path);
        return config;
    }

    public CentinelConfig loadResource(String resource) {
        Objects.requireNonNull(resource, "Resource name cannot be null");
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            CentinelConfig config = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.info("Loaded configuration from classpath resource {}", resource);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + resource, e);
        }
    }

    public CentinelConfig parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("Configuration is empty");
        }
        CentinelConfig config;
        try {
            config = reader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        config.validate();
        log.debug("Configuration valid: {} workers, candidate_count={}, {} required keys",
                config.pipeline().workers(), config.candidateCount(), config.requiredKeys().size());
        return config;
    }
}
