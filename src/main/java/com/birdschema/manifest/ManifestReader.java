package com.birdschema.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the manifest file (a BIRD {@code dev_tables.json} or anything shaped
 * like it): a JSON array of objects carrying {@code db_id} and
 * {@code table_names_original}.
 */
public class ManifestReader {
    private static final Logger logger = LoggerFactory.getLogger(ManifestReader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public List<ManifestEntry> read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ManifestException("Manifest file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<ManifestEntry> entries = read(in, path.toString());
            logger.info("Loaded {} databases from {}", entries.size(), path);
            return entries;
        } catch (IOException e) {
            throw new ManifestException("Failed to read manifest " + path + ": " + e.getMessage(), e);
        }
    }

    public List<ManifestEntry> read(InputStream in, String source) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Manifest " + source + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ManifestException("Manifest " + source + " must be a JSON array of databases");
        }

        List<ManifestEntry> entries;
        try {
            entries = mapper.convertValue(root, new TypeReference<List<ManifestEntry>>() {});
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Manifest " + source + " has a malformed entry: " + e.getMessage(), e);
        }

        for (int i = 0; i < entries.size(); i++) {
            ManifestEntry entry = entries.get(i);
            if (entry == null || entry.dbId() == null || entry.dbId().isEmpty()) {
                throw new ManifestException("Manifest " + source + " entry " + i + " has no db_id");
            }
        }
        return entries;
    }
}
