package org.carball.cablesizer.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.model.job.CircuitDefinition;
import org.carball.cablesizer.model.job.CircuitFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads circuit job files. YAML is used for .yml/.yaml files, JSON otherwise.
 */
@Slf4j
public class CircuitFileParser {

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public CircuitFileParser() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        this.jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public CircuitFile parse(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Circuit file not found: " + path);
        }

        String content = Files.readString(path);
        CircuitFile circuitFile = isYaml(path) ? parseYaml(content) : parseJson(content);
        log.info("Loaded {} circuits from {}", circuitFile.getCircuits().size(), path);
        return circuitFile;
    }

    public CircuitFile parseYaml(String content) throws IOException {
        return finish(yamlMapper.readValue(content, CircuitFile.class));
    }

    public CircuitFile parseJson(String content) throws IOException {
        return finish(jsonMapper.readValue(content, CircuitFile.class));
    }

    private CircuitFile finish(CircuitFile circuitFile) {
        if (circuitFile == null || circuitFile.getCircuits() == null || circuitFile.getCircuits().isEmpty()) {
            throw new IllegalArgumentException("Circuit file contains no circuits");
        }

        List<CircuitDefinition> circuits = circuitFile.getCircuits();
        for (int i = 0; i < circuits.size(); i++) {
            CircuitDefinition circuit = circuits.get(i);
            if (circuit.getName() == null || circuit.getName().isBlank()) {
                circuit.setName("circuit-" + (i + 1));
                log.debug("Unnamed circuit at position {} named {}", i + 1, circuit.getName());
            }
        }
        return circuitFile;
    }

    private static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml");
    }
}
