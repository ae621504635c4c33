package com.raditha.divergence.alignment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.divergence.extraction.MissingInputException;
import com.raditha.divergence.model.NameMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the pipeline-A to pipeline-B pass name mapping from a JSON object
 * such as {@code {"InstCombine": "instcombine", "early-cse": "early-cse"}}.
 */
public class MappingLoader {

    private static final Logger logger = LoggerFactory.getLogger(MappingLoader.class);

    private final ObjectMapper objectMapper;

    public MappingLoader() {
        this(new ObjectMapper());
    }

    public MappingLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MissingInputException     if the file does not exist
     * @throws MalformedMappingException if the content is not an object of strings
     */
    public NameMapping load(Path mappingFile) {
        if (!Files.isRegularFile(mappingFile)) {
            throw new MissingInputException("Mapping file not found: " + mappingFile);
        }
        try {
            NameMapping mapping = parse(Files.readString(mappingFile), mappingFile.toString());
            logger.info("Loaded {} pass mappings from {}", mapping.size(), mappingFile);
            return mapping;
        } catch (IOException e) {
            throw new MissingInputException("Cannot read mapping file " + mappingFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse mapping JSON that is already in memory.
     *
     * @param source used in error messages only
     */
    public NameMapping parse(String json, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMappingException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMappingException("Mapping in " + source + " must be a JSON object");
        }

        Map<String, String> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new MalformedMappingException("Mapping value for '" + field.getKey()
                        + "' in " + source + " must be a string");
            }
            entries.put(field.getKey(), field.getValue().asText());
        }
        return NameMapping.of(entries);
    }
}
