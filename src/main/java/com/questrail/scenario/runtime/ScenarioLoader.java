package com.questrail.scenario.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.questrail.scenario.api.ScenarioConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads YAML scenario documents.
 */
public final class ScenarioLoader
{
    private final ObjectMapper mapper;

    public ScenarioLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public ScenarioLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws IOException if the file cannot be read
     * @throws ScenarioConfigurationException if its content is not a valid scenario
     */
    public ScenarioDocument load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public ScenarioDocument load(InputStream in, String source) throws IOException {
        try {
            return ScenarioDocument.from(mapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new ScenarioConfigurationException("Malformed scenario " + source + ": " + e.getOriginalMessage(), null, e);
        }
    }

    /**
     * Parses a document held in memory.
     */
    public ScenarioDocument parse(String yaml) {
        Objects.requireNonNull(yaml, "yaml");
        try {
            return ScenarioDocument.from(mapper.readTree(yaml));
        } catch (JsonProcessingException e) {
            throw new ScenarioConfigurationException("Malformed scenario: " + e.getOriginalMessage(), null, e);
        }
    }
}
