package com.birdschema.output;

import com.birdschema.model.SchemaDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Writes a {@link SchemaDocument} as indented JSON. The document goes to a
 * temporary file next to the target first and is then moved into place, so
 * readers never see a partial file. The replaced file keeps the permissions
 * of the file it overwrites, or {@code rw-r--r--} when there was none.
 */
public class SchemaWriter {
    private static final Logger logger = LoggerFactory.getLogger(SchemaWriter.class);

    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS =
            PosixFilePermissions.fromString("rw-r--r--");

    private final ObjectMapper mapper;

    public SchemaWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(SchemaDocument document, Path output) {
        Path target = output.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            copyPermissions(tmp, target);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Schema written to {}", output);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new OutputException("Failed to write schema to " + output + ": " + e.getMessage(), e);
        }
    }

    public SchemaDocument read(Path input) {
        try {
            return mapper.readValue(input.toFile(), SchemaDocument.class);
        } catch (IOException e) {
            throw new OutputException("Failed to read schema from " + input + ": " + e.getMessage(), e);
        }
    }

    // createTempFile makes the file owner-only.
    private static void copyPermissions(Path tmp, Path target) throws IOException {
        if (!Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
